package org.janelia.dwiproc.phase;

/**
 * Source of per-acquisition timing and geometry metadata.
 */
public interface AcquisitionMetadata {

    /**
     * @param  acquisitionIndex  zero based index of the acquisition within the subject's phase encoding set.
     *
     * @return effective echo spacing in seconds.
     *
     * @throws MetadataMissingException
     *   if the value cannot be resolved.
     */
    double getEffectiveEchoSpacing(final int acquisitionIndex)
            throws MetadataMissingException;

    /**
     * @param  acquisitionIndex  zero based index of the acquisition within the subject's phase encoding set.
     *
     * @return raw phase encoding direction label (e.g. "j-").
     *
     * @throws MetadataMissingException
     *   if the value cannot be resolved.
     */
    String getPhaseEncodingDirection(final int acquisitionIndex)
            throws MetadataMissingException;
}
