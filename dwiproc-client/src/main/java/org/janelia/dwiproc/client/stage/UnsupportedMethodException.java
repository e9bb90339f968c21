package org.janelia.dwiproc.client.stage;

/**
 * Thrown when a configured processing strategy has no implementation.
 */
public class UnsupportedMethodException
        extends UnsupportedOperationException {

    public UnsupportedMethodException(final String message) {
        super(message);
    }
}
