package org.janelia.dwiproc.client.stage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.execution.KernelCommand;
import org.janelia.dwiproc.client.output.OutputPersister;
import org.janelia.dwiproc.client.parameter.TractographyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates subject tractography: tracks from the configured strategy, SIFT2 per-streamline
 * weights, and raw and weighted track density images on the FOD grid.
 */
public class TractographyStage {

    public static final String SIFT_KERNEL_NAME = "tcksift2";
    public static final String MAP_KERNEL_NAME = "tckmap";

    private final TractographyParameters parameters;
    private final ExecutionContext context;
    private final OutputPersister outputPersister;

    public TractographyStage(final TractographyParameters parameters,
                             final ExecutionContext context,
                             final OutputPersister outputPersister) {
        this.parameters = parameters;
        this.context = context;
        this.outputPersister = outputPersister;
    }

    /**
     * @param  wmFod     white matter FOD volume.
     * @param  entities  subject entities.
     *
     * @return generated artifacts.
     *
     * @throws UnsupportedMethodException
     *   if the configured method is not implemented (raised before any kernel is invoked).
     */
    public TractographyOutputs run(final Path wmFod,
                                   final BidsEntities entities)
            throws UnsupportedMethodException, IOException {

        final TractographyMethod method = TractographyMethod.fromName(parameters.method);
        final TractographyStrategy strategy = method.getStrategy();

        LOG.info("run: generating {} tractography for {}", method, entities);

        final BidsName bids = new BidsName(entities, "dwi");

        final Path tracks = strategy.generateTracks(wmFod, bids, parameters, context);

        LOG.info("run: computing per-streamline multipliers");

        final Path weights = context.allocateKernelDirectory(SIFT_KERNEL_NAME).resolve(
                bids.method("SIFT2").suffix("tckWeights").extension(".txt").toFileName());
        context.run(new KernelCommand(SIFT_KERNEL_NAME)
                            .addInput(tracks)
                            .addInput(wmFod)
                            .addOutput(weights)
                            .addOption("-nthreads", context.getThreads()));

        final Path rawDensity = buildDensityImage(tracks, null, wmFod, bids.measure("raw"));
        final Path weightedDensity = buildDensityImage(tracks, weights, wmFod, bids.measure("weighted"));

        final TractographyOutputs outputs = new TractographyOutputs(tracks, weights, rawDensity, weightedDensity);

        OutputPersister.save(Arrays.asList(tracks, weights, weightedDensity),
                             outputPersister.getOutputDirectory(bids));

        LOG.info("run: exit, generated {}", outputs);

        return outputs;
    }

    private Path buildDensityImage(final Path tracks,
                                   final Path weights,
                                   final Path template,
                                   final BidsName bids)
            throws IOException {

        final Path output = context.allocateKernelDirectory(MAP_KERNEL_NAME).resolve(
                bids.suffix("tdi").extension(".nii.gz").toFileName());

        final KernelCommand command = new KernelCommand(MAP_KERNEL_NAME)
                .addInput(tracks)
                .addOutput(output)
                .addOption("-template", template)
                .addOption("-tck_weights_in", weights)
                .addOption("-nthreads", context.getThreads());

        context.run(command);

        return output;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TractographyStage.class);
}
