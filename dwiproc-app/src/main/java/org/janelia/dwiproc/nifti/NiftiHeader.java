package org.janelia.dwiproc.nifti;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.dwiproc.util.FileUtil;

/**
 * NIfTI-1 header view over the raw 348 byte header (plus any extension bytes that
 * precede the voxel data).  The raw bytes are retained so that derived images keep
 * every field (affine, pixel dimensions, description, intent) of their source.
 */
public class NiftiHeader {

    public static final int HEADER_SIZE = 348;

    /** Minimum voxel offset for single file images (header plus 4 byte extension flag). */
    public static final int MINIMUM_VOXEL_OFFSET = 352;

    private static final int DIM_OFFSET = 40;
    private static final int DATATYPE_OFFSET = 70;
    private static final int BITPIX_OFFSET = 72;
    private static final int PIXDIM_OFFSET = 76;
    private static final int VOX_OFFSET_OFFSET = 108;
    private static final int SCL_SLOPE_OFFSET = 112;
    private static final int SCL_INTER_OFFSET = 116;
    private static final int SFORM_CODE_OFFSET = 254;
    private static final int SROW_X_OFFSET = 280;
    private static final int MAGIC_OFFSET = 344;

    private final ByteBuffer buffer;

    NiftiHeader(final byte[] bytes,
                final ByteOrder byteOrder) {
        this.buffer = ByteBuffer.wrap(bytes).order(byteOrder);
    }

    /**
     * Reads only the header of the specified image.
     *
     * @throws IOException
     *   if the file cannot be read or is not a single file NIfTI-1 image.
     */
    public static NiftiHeader read(final Path path)
            throws IOException {
        try (final InputStream inputStream =
                     FileUtil.DEFAULT_INSTANCE.getExtensionBasedInputStream(path.toString())) {
            return read(new DataInputStream(inputStream), path);
        }
    }

    static NiftiHeader read(final DataInputStream dataInputStream,
                            final Object source)
            throws IOException {

        final byte[] headerBytes = new byte[HEADER_SIZE];
        dataInputStream.readFully(headerBytes);

        final ByteBuffer probe = ByteBuffer.wrap(headerBytes);
        final ByteOrder byteOrder;
        if (probe.order(ByteOrder.LITTLE_ENDIAN).getInt(0) == HEADER_SIZE) {
            byteOrder = ByteOrder.LITTLE_ENDIAN;
        } else if (probe.order(ByteOrder.BIG_ENDIAN).getInt(0) == HEADER_SIZE) {
            byteOrder = ByteOrder.BIG_ENDIAN;
        } else {
            throw new IOException(source + " is not a NIfTI-1 image (invalid sizeof_hdr)");
        }

        if ((headerBytes[MAGIC_OFFSET] != 'n') || (headerBytes[MAGIC_OFFSET + 1] != '+') ||
            (headerBytes[MAGIC_OFFSET + 2] != '1')) {
            throw new IOException(source + " is not a single file NIfTI-1 image (invalid magic)");
        }

        final NiftiHeader headerOnly = new NiftiHeader(headerBytes, byteOrder);
        final int voxelOffset = headerOnly.getVoxelOffset();
        if (voxelOffset < HEADER_SIZE) {
            throw new IOException(source + " has invalid vox_offset " + voxelOffset);
        }

        // keep extension bytes so they can be written back unchanged
        final byte[] allBytes = Arrays.copyOf(headerBytes, voxelOffset);
        dataInputStream.readFully(allBytes, HEADER_SIZE, voxelOffset - HEADER_SIZE);

        return new NiftiHeader(allBytes, byteOrder);
    }

    /**
     * @return new little endian header for a float32 image with the specified dimensions,
     *         unit voxel size and an identity scanner (sform) transform.
     */
    public static NiftiHeader create(final int... dimensions) {

        if ((dimensions.length < 1) || (dimensions.length > 7)) {
            throw new IllegalArgumentException("image must have between 1 and 7 dimensions");
        }

        final NiftiHeader header = new NiftiHeader(new byte[MINIMUM_VOXEL_OFFSET], ByteOrder.LITTLE_ENDIAN);
        final ByteBuffer b = header.buffer;
        b.putInt(0, HEADER_SIZE);
        b.putShort(DIM_OFFSET, (short) dimensions.length);
        for (int i = 0; i < 7; i++) {
            b.putShort(DIM_OFFSET + (2 * (i + 1)), (short) (i < dimensions.length ? dimensions[i] : 1));
            b.putFloat(PIXDIM_OFFSET + (4 * (i + 1)), 1.0f);
        }
        b.putFloat(PIXDIM_OFFSET, 1.0f);  // qfac
        header.setDataType(NiftiDataType.FLOAT32);
        b.putFloat(VOX_OFFSET_OFFSET, MINIMUM_VOXEL_OFFSET);
        header.resetScaling();
        b.putShort(SFORM_CODE_OFFSET, (short) 1);
        for (int row = 0; row < 3; row++) {
            b.putFloat(SROW_X_OFFSET + (16 * row) + (4 * row), 1.0f);
        }
        b.put(MAGIC_OFFSET, (byte) 'n');
        b.put(MAGIC_OFFSET + 1, (byte) '+');
        b.put(MAGIC_OFFSET + 2, (byte) '1');
        b.put(MAGIC_OFFSET + 3, (byte) 0);

        return header;
    }

    /**
     * @return number of dimensions (dim[0]).
     */
    public int getNumberOfDimensions() {
        return buffer.getShort(DIM_OFFSET);
    }

    /**
     * @return size of each dimension (dim[1] .. dim[dim[0]]).
     */
    public int[] getDimensions() {
        final int[] dims = new int[getNumberOfDimensions()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = buffer.getShort(DIM_OFFSET + (2 * (i + 1)));
        }
        return dims;
    }

    /**
     * @param  axis  zero based spatial axis (0 = i/x, 1 = j/y, 2 = k/z).
     *
     * @return number of voxels along the specified axis (1 if the image has fewer dimensions).
     */
    public int getSize(final int axis) {
        final int[] dims = getDimensions();
        return axis < dims.length ? dims[axis] : 1;
    }

    /**
     * @return number of 3D frames (dim[4] for images with four or more dimensions, otherwise 1).
     */
    public int getNumberOfFrames() {
        return getNumberOfDimensions() < 4 ? 1 : getSize(3);
    }

    /**
     * @return number of voxels in one 3D frame.
     */
    public int getVoxelsPerFrame() {
        return getSize(0) * getSize(1) * getSize(2);
    }

    public long getNumberOfVoxels() {
        long count = 1;
        for (final int size : getDimensions()) {
            count *= size;
        }
        return count;
    }

    public NiftiDataType getDataType() {
        return NiftiDataType.fromCode(buffer.getShort(DATATYPE_OFFSET));
    }

    void setDataType(final NiftiDataType dataType) {
        buffer.putShort(DATATYPE_OFFSET, dataType.getCode());
        buffer.putShort(BITPIX_OFFSET, dataType.getBitsPerVoxel());
    }

    public int getVoxelOffset() {
        return (int) buffer.getFloat(VOX_OFFSET_OFFSET);
    }

    public ByteOrder getByteOrder() {
        return buffer.order();
    }

    /**
     * @return scaling slope, where 0 means "no scaling" as defined by the format.
     */
    public float getScaleSlope() {
        return buffer.getFloat(SCL_SLOPE_OFFSET);
    }

    public float getScaleIntercept() {
        return buffer.getFloat(SCL_INTER_OFFSET);
    }

    void resetScaling() {
        buffer.putFloat(SCL_SLOPE_OFFSET, 1.0f);
        buffer.putFloat(SCL_INTER_OFFSET, 0.0f);
    }

    /**
     * @return 3x4 scanner transform rows (srow_x, srow_y, srow_z).
     */
    public double[][] getSForm() {
        final double[][] rows = new double[3][4];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 4; column++) {
                rows[row][column] = buffer.getFloat(SROW_X_OFFSET + (16 * row) + (4 * column));
            }
        }
        return rows;
    }

    /**
     * @return copy of the raw header and extension bytes.
     */
    byte[] toBytes() {
        return Arrays.copyOf(buffer.array(), buffer.capacity());
    }

    NiftiHeader copy() {
        return new NiftiHeader(toBytes(), getByteOrder());
    }

    @Override
    public String toString() {
        return "{dims: " + Arrays.toString(getDimensions()) + ", type: " + getDataType() + "}";
    }
}
