package org.janelia.dwiproc.client.stage;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.parameter.TractographyParameters;

/**
 * Generates a streamline track file from a white matter FOD volume.
 */
public interface TractographyStrategy {

    /**
     * @param  wmFod       white matter fiber orientation distribution volume.
     * @param  bids        name holding the subject entities and datatype for outputs.
     * @param  parameters  tractography parameters.
     * @param  context     execution context for kernel invocations.
     *
     * @return generated track file.
     */
    Path generateTracks(final Path wmFod,
                        final BidsName bids,
                        final TractographyParameters parameters,
                        final ExecutionContext context)
            throws IOException;
}
