package org.janelia.dwiproc.nifti;

import java.nio.ByteBuffer;

/**
 * Voxel data types readable by {@link NiftiImage}.  Only FLOAT32 and FLOAT64 can be written.
 */
public enum NiftiDataType {

    UINT8(2, 8) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.get() & 0xff;
        }
    },
    INT16(4, 16) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getShort();
        }
    },
    INT32(8, 32) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getInt();
        }
    },
    FLOAT32(16, 32) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getFloat();
        }
        @Override
        void write(final ByteBuffer buffer, final double value) {
            buffer.putFloat((float) value);
        }
    },
    FLOAT64(64, 64) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getDouble();
        }
        @Override
        void write(final ByteBuffer buffer, final double value) {
            buffer.putDouble(value);
        }
    },
    INT8(256, 8) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.get();
        }
    },
    UINT16(512, 16) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getShort() & 0xffff;
        }
    },
    UINT32(768, 32) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getInt() & 0xffffffffL;
        }
    },
    INT64(1024, 64) {
        @Override
        double read(final ByteBuffer buffer) {
            return buffer.getLong();
        }
    };

    private final short code;
    private final short bitsPerVoxel;

    NiftiDataType(final int code,
                  final int bitsPerVoxel) {
        this.code = (short) code;
        this.bitsPerVoxel = (short) bitsPerVoxel;
    }

    public short getCode() {
        return code;
    }

    public short getBitsPerVoxel() {
        return bitsPerVoxel;
    }

    public int getBytesPerVoxel() {
        return bitsPerVoxel / 8;
    }

    abstract double read(final ByteBuffer buffer);

    /**
     * Images are only written with floating point voxels.
     *
     * @throws UnsupportedOperationException
     *   for integer types.
     */
    void write(final ByteBuffer buffer, final double value)
            throws UnsupportedOperationException {
        throw new UnsupportedOperationException("writing " + this + " voxels is not supported");
    }

    public static NiftiDataType fromCode(final short code)
            throws IllegalArgumentException {
        for (final NiftiDataType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported NIfTI datatype code " + code);
    }
}
