package org.janelia.dwiproc.gradient;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.janelia.dwiproc.util.TextMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reorients diffusion gradient directions with the linear part of a spatial transform.
 * Vectors are not renormalized, so b=0 (zero) directions stay zero.
 */
public class GradientRotator {

    public static final String LABEL = "rotate-bvec";

    private GradientRotator() {
    }

    /**
     * @param  bvec       3 x N gradient table.
     * @param  transform  3x3, 3x4 or 4x4 transform whose upper-left 3x3 block is applied.
     *
     * @return rotated 3 x N table.
     */
    public static double[][] rotate(final double[][] bvec,
                                    final double[][] transform)
            throws IllegalArgumentException {

        if (bvec.length != 3) {
            throw new IllegalArgumentException("gradient table must have 3 rows but has " + bvec.length);
        }
        if ((transform.length < 3) || (transform[0].length < 3)) {
            throw new IllegalArgumentException("transform must be at least 3x3");
        }

        final int count = bvec[0].length;
        final double[][] rotated = new double[3][count];
        for (int column = 0; column < count; column++) {
            for (int row = 0; row < 3; row++) {
                rotated[row][column] = (transform[row][0] * bvec[0][column]) +
                                       (transform[row][1] * bvec[1][column]) +
                                       (transform[row][2] * bvec[2][column]);
            }
        }

        return rotated;
    }

    /**
     * Rotates the bvec file with the transform file and writes the result as
     * a space-T1w_res-dwi_desc-preproc_dwi.bvec artifact.
     *
     * @return path of the rotated table.
     */
    public static Path rotate(final Path bvecFile,
                              final Path transformFile,
                              final BidsEntities entities,
                              final ScratchAllocator scratchAllocator)
            throws IOException {

        final double[][] bvec = TextMatrix.load(bvecFile);
        final double[][] transform = TextMatrix.load(transformFile);

        final double[][] rotated;
        try {
            rotated = rotate(bvec, transform);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("failed to rotate " + bvecFile + " with " + transformFile, e);
        }

        final BidsName name = new BidsName(entities, "dwi")
                .space("T1w")
                .resolution("dwi")
                .description("preproc")
                .suffix("dwi")
                .extension(".bvec");
        final Path path = scratchAllocator.allocateFile(LABEL, name);
        TextMatrix.save(path, rotated);

        LOG.info("rotate: wrote {} rotated directions to {}", rotated[0].length, path);

        return path;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GradientRotator.class);
}
