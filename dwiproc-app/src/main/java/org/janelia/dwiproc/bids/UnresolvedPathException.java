package org.janelia.dwiproc.bids;

import java.nio.file.Path;

/**
 * Thrown when a working path does not contain any subject component,
 * so its location in the output tree cannot be derived.
 */
public class UnresolvedPathException
        extends IllegalArgumentException {

    private final Path path;

    public UnresolvedPathException(final Path path) {
        super("unable to find a 'sub-' component in " + path + " to determine its output location");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
