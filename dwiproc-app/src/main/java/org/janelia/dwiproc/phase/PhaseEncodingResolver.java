package org.janelia.dwiproc.phase;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.nifti.NiftiHeader;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.janelia.dwiproc.spec.InputGroup;
import org.janelia.dwiproc.util.TextMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives phase encoding records (direction plus [vx, vy, vz, readout] line) for acquisitions
 * and writes the concatenated phase encoding table used by distortion correction.
 */
public class PhaseEncodingResolver {

    public static final String CONCAT_LABEL = "concat-phenc";

    private final AcquisitionMetadata metadata;

    public PhaseEncodingResolver(final AcquisitionMetadata metadata) {
        this.metadata = metadata;
    }

    /**
     * @param  acquisitionIndex  zero based acquisition index (used to look up metadata).
     * @param  inputGroup        inputs for the acquisition.
     *
     * @return phase encoding record for the acquisition.
     *
     * @throws MetadataMissingException
     *   if echo spacing or direction cannot be resolved.
     *
     * @throws IOException
     *   if the dwi header cannot be read.
     */
    public PhaseEncodingRecord resolve(final int acquisitionIndex,
                                       final InputGroup inputGroup)
            throws MetadataMissingException, IOException {

        final double echoSpacing = metadata.getEffectiveEchoSpacing(acquisitionIndex);
        final String label = metadata.getPhaseEncodingDirection(acquisitionIndex);

        final PhaseEncodingDirection direction;
        try {
            direction = PhaseEncodingDirection.fromLabel(label);
        } catch (final IllegalArgumentException e) {
            throw new MetadataMissingException("unusable phase encoding direction for acquisition " +
                                               acquisitionIndex, e);
        }

        final NiftiHeader header = NiftiHeader.read(inputGroup.getDwi());
        final PhaseEncodingRecord record = resolve(direction, echoSpacing, header);

        LOG.info("resolve: acquisition {} of {} is {}", acquisitionIndex, inputGroup.getEntities(), record);

        return record;
    }

    /**
     * @return record whose readout term is echoSpacing times the number of voxels
     *         along the encoded axis.
     */
    public static PhaseEncodingRecord resolve(final PhaseEncodingDirection direction,
                                              final double echoSpacing,
                                              final NiftiHeader header) {
        final int phaseEncodeCount = header.getSize(direction.getAxis());
        return new PhaseEncodingRecord(direction, echoSpacing * phaseEncodeCount);
    }

    /**
     * Writes one "vx vy vz readout" row per record to a desc-concat_phenc.txt artifact.
     *
     * @return path of the written table.
     */
    public static Path writeTable(final List<PhaseEncodingRecord> records,
                                  final BidsEntities entities,
                                  final ScratchAllocator scratchAllocator)
            throws IOException {

        if (records.isEmpty()) {
            throw new IllegalArgumentException("at least one phase encoding record is required");
        }

        final BidsName name = new BidsName(entities, "dwi")
                .description("concat")
                .suffix("phenc")
                .extension(".txt");
        final Path path = scratchAllocator.allocateFile(CONCAT_LABEL, name);

        final double[][] rows = new double[records.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = records.get(i).getRow();
        }
        TextMatrix.save(path, rows);

        LOG.info("writeTable: wrote {} rows to {}", rows.length, path);

        return path;
    }

    private static final Logger LOG = LoggerFactory.getLogger(PhaseEncodingResolver.class);
}
