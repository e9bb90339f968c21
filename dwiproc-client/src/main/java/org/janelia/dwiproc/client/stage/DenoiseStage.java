package org.janelia.dwiproc.client.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.execution.KernelCommand;
import org.janelia.dwiproc.client.output.OutputPersister;
import org.janelia.dwiproc.client.parameter.DenoiseParameters;
import org.janelia.dwiproc.spec.InputGroup;
import org.janelia.dwiproc.util.TextMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs MP-PCA denoising (dwidenoise) on a diffusion volume unless it is disabled or
 * the acquisition has too few diffusion weighted directions.
 */
public class DenoiseStage {

    public enum Decision {
        SKIP, RUN
    }

    /** Minimum number of non-zero b-values required for denoising. */
    public static final int MINIMUM_DIRECTIONS = 30;

    public static final String KERNEL_NAME = "dwidenoise";

    private final DenoiseParameters parameters;
    private final ExecutionContext context;
    private final OutputPersister outputPersister;

    public DenoiseStage(final DenoiseParameters parameters,
                        final ExecutionContext context,
                        final OutputPersister outputPersister) {
        this.parameters = parameters;
        this.context = context;
        this.outputPersister = outputPersister;
    }

    public static int countDiffusionWeighted(final double[] bvals) {
        int count = 0;
        for (final double bval : bvals) {
            if (bval != 0) {
                count++;
            }
        }
        return count;
    }

    public static Decision decide(final double[] bvals,
                                  final boolean skipRequested) {
        if (skipRequested || (countDiffusionWeighted(bvals) < MINIMUM_DIRECTIONS)) {
            return Decision.SKIP;
        }
        return Decision.RUN;
    }

    /**
     * @return denoised volume, or the original dwi volume if denoising was skipped.
     *
     * @throws ExpectedOutputMissingException
     *   if a noise map was requested but not produced.
     */
    public Path run(final InputGroup inputGroup)
            throws IOException {

        final double[] bvals = TextMatrix.loadFlat(inputGroup.getBval());

        if (decide(bvals, parameters.skip) == Decision.SKIP) {
            if (parameters.skip) {
                LOG.info("run: denoising disabled, skipping for {}", inputGroup.getEntities());
            } else {
                LOG.info("run: less than {} directions ({}), skipping denoising for {}",
                         MINIMUM_DIRECTIONS, countDiffusionWeighted(bvals), inputGroup.getEntities());
            }
            return inputGroup.getDwi();
        }

        LOG.info("run: performing denoising for {}", inputGroup.getEntities());

        final BidsName bids = new BidsName(inputGroup.getEntities(), "dwi");
        final Path kernelDirectory = context.allocateKernelDirectory(KERNEL_NAME);

        final Path denoised = kernelDirectory.resolve(
                bids.description("denoise").suffix("dwi").extension(".nii.gz").toFileName());
        final Path noiseMap = parameters.map ?
                              kernelDirectory.resolve(bids.algorithm(parameters.estimator)
                                                              .parameter("noise")
                                                              .suffix("dwimap")
                                                              .extension(".nii.gz")
                                                              .toFileName()) :
                              null;

        final KernelCommand command = new KernelCommand(KERNEL_NAME)
                .addInput(inputGroup.getDwi())
                .addOutput(denoised)
                .addOption("-estimator", parameters.estimator)
                .addOutputOption("-noise", noiseMap)
                .addOption("-extent", parameters.getExtentArgument())
                .addOption("-nthreads", context.getThreads());

        context.run(command);

        if (noiseMap != null) {
            if (! Files.exists(noiseMap)) {
                throw new ExpectedOutputMissingException(KERNEL_NAME, noiseMap);
            }
            OutputPersister.save(noiseMap, outputPersister.getOutputDirectory(bids));
        }

        return denoised;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DenoiseStage.class);
}
