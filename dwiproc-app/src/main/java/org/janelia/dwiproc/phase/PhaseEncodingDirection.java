package org.janelia.dwiproc.phase;

/**
 * Image space axis and sign along which phase encoding was applied,
 * identified by the BIDS labels i, j, k, i-, j- and k-.
 */
public enum PhaseEncodingDirection {

    I_POSITIVE("i", 0, 1),
    I_NEGATIVE("i-", 0, -1),
    J_POSITIVE("j", 1, 1),
    J_NEGATIVE("j-", 1, -1),
    K_POSITIVE("k", 2, 1),
    K_NEGATIVE("k-", 2, -1);

    private final String label;
    private final int axis;
    private final int sign;

    PhaseEncodingDirection(final String label,
                           final int axis,
                           final int sign) {
        this.label = label;
        this.axis = axis;
        this.sign = sign;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return zero based image axis (0 = i, 1 = j, 2 = k).
     */
    public int getAxis() {
        return axis;
    }

    /**
     * @return unit vector with a single non-zero component carrying this direction's sign.
     */
    public double[] getVector() {
        final double[] vector = new double[3];
        vector[axis] = sign;
        return vector;
    }

    /**
     * @throws IllegalArgumentException
     *   if the label is not one of the six recognized directions.
     */
    public static PhaseEncodingDirection fromLabel(final String label)
            throws IllegalArgumentException {
        if (label != null) {
            final String trimmed = label.trim();
            for (final PhaseEncodingDirection direction : values()) {
                if (direction.label.equals(trimmed)) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("invalid phase encoding direction '" + label +
                                           "', must be one of i, j, k, i-, j-, k-");
    }

    @Override
    public String toString() {
        return label;
    }
}
