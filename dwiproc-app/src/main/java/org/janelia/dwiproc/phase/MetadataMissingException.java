package org.janelia.dwiproc.phase;

/**
 * Thrown when required acquisition metadata (echo spacing or phase encoding direction)
 * cannot be resolved.
 */
public class MetadataMissingException
        extends IllegalArgumentException {

    public MetadataMissingException(final String message) {
        super(message);
    }

    public MetadataMissingException(final String message,
                                    final Throwable cause) {
        super(message, cause);
    }
}
