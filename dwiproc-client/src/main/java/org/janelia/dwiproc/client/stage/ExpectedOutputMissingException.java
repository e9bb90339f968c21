package org.janelia.dwiproc.client.stage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an external kernel completes without producing an output it was asked to write.
 */
public class ExpectedOutputMissingException
        extends IOException {

    private final Path expectedOutput;

    public ExpectedOutputMissingException(final String kernelName,
                                          final Path expectedOutput) {
        super(kernelName + " did not produce expected output " + expectedOutput);
        this.expectedOutput = expectedOutput;
    }

    public Path getExpectedOutput() {
        return expectedOutput;
    }
}
