package org.janelia.dwiproc.intensity;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.bids.BidsName;
import org.janelia.dwiproc.nifti.NiftiImage;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescales the frames of a 4D volume so that every frame has the mean intensity of frame 0.
 */
public class VolumeNormalizer {

    public static final String LABEL = "normalize";

    /** Frames whose mean is within this distance of zero are left unscaled. */
    public static final double ZERO_MEAN_TOLERANCE = 1e-8;

    private VolumeNormalizer() {
    }

    /**
     * Normalizes the frames of image in place.  Frame 0 is the reference and is never modified.
     *
     * @return number of frames that were rescaled.
     */
    public static int normalize(final NiftiImage image) {

        final double referenceMean = image.getFrameMean(0);

        int scaledCount = 0;
        for (int frame = 1; frame < image.getNumberOfFrames(); frame++) {
            final double frameMean = image.getFrameMean(frame);
            if (Math.abs(frameMean) > ZERO_MEAN_TOLERANCE) {
                image.scaleFrame(frame, referenceMean / frameMean);
                scaledCount++;
            } else {
                LOG.debug("normalize: skipping frame {} with mean {}", frame, frameMean);
            }
        }

        return scaledCount;
    }

    /**
     * Normalizes the volume and writes it as a desc-normalized_b0.nii.gz artifact.
     *
     * @return path of the normalized volume.
     */
    public static Path normalize(final Path volume,
                                 final BidsEntities entities,
                                 final ScratchAllocator scratchAllocator)
            throws IOException {

        final NiftiImage image = NiftiImage.read(volume);
        final int scaledCount = normalize(image);

        final BidsName name = new BidsName(entities, "dwi")
                .description("normalized")
                .suffix("b0")
                .extension(".nii.gz");
        final Path path = scratchAllocator.allocateFile(LABEL, name);
        image.write(path);

        LOG.info("normalize: rescaled {} of {} frames from {}, wrote {}",
                 scaledCount, image.getNumberOfFrames(), volume, path);

        return path;
    }

    private static final Logger LOG = LoggerFactory.getLogger(VolumeNormalizer.class);
}
