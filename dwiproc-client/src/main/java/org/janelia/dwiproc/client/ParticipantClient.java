package org.janelia.dwiproc.client;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.execution.KernelRunner;
import org.janelia.dwiproc.client.execution.LocalKernelRunner;
import org.janelia.dwiproc.client.output.OutputPersister;
import org.janelia.dwiproc.client.parameter.CommandLineParameters;
import org.janelia.dwiproc.client.parameter.DenoiseParameters;
import org.janelia.dwiproc.client.parameter.InputParameters;
import org.janelia.dwiproc.client.parameter.IoParameters;
import org.janelia.dwiproc.client.parameter.MetadataParameters;
import org.janelia.dwiproc.client.parameter.TractographyParameters;
import org.janelia.dwiproc.client.stage.DenoiseStage;
import org.janelia.dwiproc.client.stage.TractographyOutputs;
import org.janelia.dwiproc.client.stage.TractographyStage;
import org.janelia.dwiproc.gradient.GradientRotator;
import org.janelia.dwiproc.intensity.VolumeNormalizer;
import org.janelia.dwiproc.phase.EddyIndexExpander;
import org.janelia.dwiproc.phase.JsonSidecarMetadata;
import org.janelia.dwiproc.phase.PhaseEncodingIndexGrouper;
import org.janelia.dwiproc.phase.PhaseEncodingRecord;
import org.janelia.dwiproc.phase.PhaseEncodingResolver;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.janelia.dwiproc.spec.InputGroup;
import org.janelia.dwiproc.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that runs the participant level diffusion derivative pipeline for one subject:
 * phase encoding and eddy index tables, denoising, b-vector rotation, b0 normalization and
 * tractography.  Stages run sequentially and any failure aborts the subject run.
 */
public class ParticipantClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public IoParameters io = new IoParameters();

        @ParametersDelegate
        public InputParameters input = new InputParameters();

        @ParametersDelegate
        public MetadataParameters metadata = new MetadataParameters();

        @ParametersDelegate
        public DenoiseParameters denoise = new DenoiseParameters();

        @ParametersDelegate
        public TractographyParameters tractography = new TractographyParameters();

        /**
         * Loads inputs from the index (when one is specified) and validates all parameter groups.
         *
         * @throws IllegalArgumentException
         *   if any parameter is invalid.
         */
        public void loadAndValidate()
                throws IllegalArgumentException, IOException {
            io.validate();
            final Path indexPath = io.getIndexPath();
            if (indexPath != null) {
                input = InputParameters.fromIndex(indexPath);
            }
            input.validate();
            metadata.validate();
            denoise.validate();
            tractography.validate();
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.loadAndValidate();

                LOG.info("runClient: entry, parameters={}", parameters);

                final ParticipantClient client = new ParticipantClient(parameters, new LocalKernelRunner());
                client.run();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final ExecutionContext context;
    private final OutputPersister outputPersister;

    public ParticipantClient(final Parameters parameters,
                             final KernelRunner kernelRunner) {
        this.parameters = parameters;
        this.context = new ExecutionContext(kernelRunner,
                                            new ScratchAllocator(parameters.io.getWorkingDirectory()),
                                            parameters.io.threads);
        this.outputPersister = new OutputPersister(parameters.io.getOutputDirectory());
    }

    public ParticipantOutputs run()
            throws IOException {

        final BidsEntities entities = parameters.input.getEntities();
        final List<InputGroup> inputGroups = parameters.input.buildInputGroups();

        LOG.info("run: entry, processing {} acquisition(s) for {}", inputGroups.size(), entities);

        FileUtil.ensureWritableDirectory(outputPersister.getOutputRoot().toFile());
        FileUtil.ensureWritableDirectory(context.getScratchAllocator().getWorkingDirectory().toFile());

        final ParticipantOutputs outputs = new ParticipantOutputs();

        // phase encoding and eddy tables
        final PhaseEncodingResolver resolver = new PhaseEncodingResolver(
                new JsonSidecarMetadata(getSidecars(inputGroups),
                                        parameters.metadata.echoSpacing,
                                        parameters.metadata.peDirections));
        final List<PhaseEncodingRecord> records = new ArrayList<>();
        final List<String> directionLabels = new ArrayList<>();
        final List<Path> volumes = new ArrayList<>();
        for (int i = 0; i < inputGroups.size(); i++) {
            final PhaseEncodingRecord record = resolver.resolve(i, inputGroups.get(i));
            records.add(record);
            directionLabels.add(record.getLabel());
            volumes.add(inputGroups.get(i).getDwi());
        }
        final ScratchAllocator scratchAllocator = context.getScratchAllocator();
        outputs.phaseEncodingTable = PhaseEncodingResolver.writeTable(records, entities, scratchAllocator);

        final List<String> groupIndices = PhaseEncodingIndexGrouper.group(directionLabels);
        if (groupIndices.isEmpty()) {
            LOG.info("run: phase encoding directions {} were not grouped, assigning index 1 to every volume",
                     directionLabels);
        }
        outputs.eddyIndexFile = EddyIndexExpander.writeIndexFile(volumes,
                                                                 groupIndices.isEmpty() ? null : groupIndices,
                                                                 entities,
                                                                 scratchAllocator);

        // denoise
        final DenoiseStage denoiseStage = new DenoiseStage(parameters.denoise, context, outputPersister);
        for (final InputGroup inputGroup : inputGroups) {
            outputs.denoisedVolumes.add(denoiseStage.run(inputGroup));
        }

        // optional auxiliary kernels
        final Path transform = parameters.input.getTransform();
        if (transform != null) {
            final Path rotated = GradientRotator.rotate(inputGroups.get(0).getBvec(), transform,
                                                        entities, scratchAllocator);
            outputs.rotatedBvec = OutputPersister.save(rotated,
                                                       outputPersister.getOutputDirectory(
                                                               new BidsName(entities, "dwi")));
        }

        final Path b0 = parameters.input.getB0();
        if (b0 != null) {
            outputs.normalizedB0 = VolumeNormalizer.normalize(b0, entities, scratchAllocator);
        }

        // tractography
        final Path wmFod = parameters.input.getWmFod();
        if (wmFod != null) {
            final TractographyStage tractographyStage =
                    new TractographyStage(parameters.tractography, context, outputPersister);
            outputs.tractography = tractographyStage.run(wmFod, entities);
        } else {
            LOG.info("run: no white matter FOD specified, skipping tractography for {}", entities);
        }

        LOG.info("run: exit, produced {}", outputs);

        return outputs;
    }

    private static List<Path> getSidecars(final List<InputGroup> inputGroups) {
        final List<Path> sidecars = new ArrayList<>(inputGroups.size());
        for (final InputGroup inputGroup : inputGroups) {
            sidecars.add(inputGroup.getDwiSidecar());
        }
        return sidecars;
    }

    /**
     * Artifacts produced by one participant run.
     */
    public static class ParticipantOutputs {

        public Path phaseEncodingTable;
        public Path eddyIndexFile;
        public final List<Path> denoisedVolumes = new ArrayList<>();
        public Path rotatedBvec;
        public Path normalizedB0;
        public TractographyOutputs tractography;

        @Override
        public String toString() {
            return "{phaseEncodingTable: " + phaseEncodingTable + ", eddyIndexFile: " + eddyIndexFile +
                   ", denoisedVolumes: " + denoisedVolumes + ", rotatedBvec: " + rotatedBvec +
                   ", normalizedB0: " + normalizedB0 + ", tractography: " + tractography + "}";
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ParticipantClient.class);
}
