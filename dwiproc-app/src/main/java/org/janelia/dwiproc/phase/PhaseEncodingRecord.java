package org.janelia.dwiproc.phase;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Phase encoding direction of one acquisition together with its numeric
 * encoding line [vx, vy, vz, readout].
 */
public class PhaseEncodingRecord
        implements Serializable {

    private final PhaseEncodingDirection direction;
    private final double readoutTime;

    public PhaseEncodingRecord(final PhaseEncodingDirection direction,
                               final double readoutTime) {
        this.direction = direction;
        this.readoutTime = readoutTime;
    }

    public PhaseEncodingDirection getDirection() {
        return direction;
    }

    public String getLabel() {
        return direction.getLabel();
    }

    public double getReadoutTime() {
        return readoutTime;
    }

    /**
     * @return encoding line [vx, vy, vz, readout].
     */
    public double[] getRow() {
        final double[] vector = direction.getVector();
        return new double[] { vector[0], vector[1], vector[2], readoutTime };
    }

    @Override
    public String toString() {
        return direction + " " + Arrays.toString(getRow());
    }
}
