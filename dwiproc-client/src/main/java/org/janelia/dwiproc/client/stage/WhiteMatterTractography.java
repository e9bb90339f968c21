package org.janelia.dwiproc.client.stage;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.execution.KernelCommand;
import org.janelia.dwiproc.client.parameter.TractographyParameters;

/**
 * iFOD2 probabilistic tracking (tckgen) with dynamic seeding from the white matter FOD.
 */
public class WhiteMatterTractography
        implements TractographyStrategy {

    public static final String KERNEL_NAME = "tckgen";
    public static final String ALGORITHM = "iFOD2";

    @Override
    public Path generateTracks(final Path wmFod,
                               final BidsName bids,
                               final TractographyParameters parameters,
                               final ExecutionContext context)
            throws IOException {

        final Path tracks = context.allocateKernelDirectory(KERNEL_NAME).resolve(
                bids.method(ALGORITHM).suffix("tractography").extension(".tck").toFileName());

        final KernelCommand command = new KernelCommand(KERNEL_NAME)
                .addInput(wmFod)
                .addOutput(tracks)
                .addOption("-algorithm", ALGORITHM)
                .addOption("-seed_dynamic", wmFod)
                .addOption("-step", parameters.steps)
                .addOption("-cutoff", parameters.cutoff)
                .addOption("-select", parameters.streamlines)
                .addOption("-nthreads", context.getThreads());

        context.run(command);

        return tracks;
    }
}
