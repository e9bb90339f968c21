package org.janelia.dwiproc.nifti;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Path;

import org.janelia.dwiproc.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single file NIfTI-1 image (".nii" or ".nii.gz") with voxel values held as doubles
 * (scaling already applied) in file order: x varies fastest, then y, z and frame.
 */
public class NiftiImage {

    private final NiftiHeader header;
    private final double[] data;

    public NiftiImage(final NiftiHeader header,
                      final double[] data) {
        if (header.getNumberOfVoxels() != data.length) {
            throw new IllegalArgumentException("header describes " + header.getNumberOfVoxels() +
                                               " voxels but " + data.length + " values were provided");
        }
        this.header = header;
        this.data = data;
    }

    public static NiftiImage read(final Path path)
            throws IOException {

        LOG.debug("read: entry, path={}", path);

        try (final InputStream inputStream =
                     FileUtil.DEFAULT_INSTANCE.getExtensionBasedInputStream(path.toString())) {

            final DataInputStream dataInputStream = new DataInputStream(inputStream);
            final NiftiHeader header = NiftiHeader.read(dataInputStream, path);

            final long voxelCount = header.getNumberOfVoxels();
            final NiftiDataType dataType = header.getDataType();
            final long byteCount = voxelCount * dataType.getBytesPerVoxel();
            if (byteCount > Integer.MAX_VALUE) {
                throw new IOException(path + " is too large to load (" + byteCount + " bytes)");
            }

            final byte[] bytes = new byte[(int) byteCount];
            dataInputStream.readFully(bytes);
            final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(header.getByteOrder());

            float slope = header.getScaleSlope();
            final float intercept = header.getScaleIntercept();
            final boolean scaled = (slope != 0.0f) && ((slope != 1.0f) || (intercept != 0.0f));
            if (slope == 0.0f) {
                slope = 1.0f;
            }

            final double[] data = new double[(int) voxelCount];
            for (int i = 0; i < data.length; i++) {
                final double value = dataType.read(buffer);
                data[i] = scaled ? (value * slope) + intercept : value;
            }

            LOG.debug("read: exit, loaded {} from {}", header, path);

            return new NiftiImage(header, data);
        }
    }

    public NiftiHeader getHeader() {
        return header;
    }

    /**
     * @return the live voxel array (modifications change this image).
     */
    public double[] getData() {
        return data;
    }

    public int getNumberOfFrames() {
        return header.getNumberOfFrames();
    }

    /**
     * @return mean value of the specified 3D frame.
     */
    public double getFrameMean(final int frame) {
        final int frameSize = header.getVoxelsPerFrame();
        final int start = checkFrame(frame) * frameSize;
        double sum = 0.0;
        for (int i = start; i < start + frameSize; i++) {
            sum += data[i];
        }
        return sum / frameSize;
    }

    /**
     * Multiplies every voxel of the specified frame by factor.
     */
    public void scaleFrame(final int frame,
                           final double factor) {
        final int frameSize = header.getVoxelsPerFrame();
        final int start = checkFrame(frame) * frameSize;
        for (int i = start; i < start + frameSize; i++) {
            data[i] *= factor;
        }
    }

    /**
     * Writes this image with floating point voxels (float64 if the source already used
     * float64, otherwise float32) and identity scaling.  All other header fields are kept.
     */
    public void write(final Path path)
            throws IOException {

        final NiftiHeader outputHeader = header.copy();
        final NiftiDataType outputType =
                header.getDataType() == NiftiDataType.FLOAT64 ? NiftiDataType.FLOAT64 : NiftiDataType.FLOAT32;
        outputHeader.setDataType(outputType);
        outputHeader.resetScaling();

        final ByteBuffer buffer =
                ByteBuffer.allocate(data.length * outputType.getBytesPerVoxel()).order(outputHeader.getByteOrder());
        for (final double value : data) {
            outputType.write(buffer, value);
        }

        try (final OutputStream outputStream =
                     FileUtil.DEFAULT_INSTANCE.getExtensionBasedOutputStream(path.toString())) {
            outputStream.write(outputHeader.toBytes());
            outputStream.write(buffer.array());
        }

        LOG.debug("write: wrote {} to {}", outputHeader, path);
    }

    private int checkFrame(final int frame) {
        if ((frame < 0) || (frame >= header.getNumberOfFrames())) {
            throw new IndexOutOfBoundsException("frame " + frame + " is outside range [0, " +
                                                header.getNumberOfFrames() + ")");
        }
        return frame;
    }

    private static final Logger LOG = LoggerFactory.getLogger(NiftiImage.class);
}
