package org.janelia.dwiproc.nifti;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.dwiproc.scratch.ScratchAllocatorTest;
import org.janelia.dwiproc.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link NiftiImage} and {@link NiftiHeader} classes.
 */
public class NiftiImageTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = ScratchAllocatorTest.createTestDirectory("test_nifti_image");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testWriteAndRead() throws Exception {

        final int[] dims = { 3, 2, 2, 4 };
        final double[] data = new double[3 * 2 * 2 * 4];
        for (int i = 0; i < data.length; i++) {
            data[i] = i * 0.5;
        }

        final Path path = writeVolume(testDirectory.toPath().resolve("vol.nii.gz"), dims, data);
        final NiftiImage loaded = NiftiImage.read(path);
        final NiftiHeader header = loaded.getHeader();

        Assert.assertArrayEquals("invalid dimensions", dims, header.getDimensions());
        Assert.assertEquals("invalid frame count", 4, loaded.getNumberOfFrames());
        Assert.assertEquals("invalid voxels per frame", 12, header.getVoxelsPerFrame());
        Assert.assertEquals("invalid datatype", NiftiDataType.FLOAT32, header.getDataType());
        Assert.assertArrayEquals("invalid data", data, loaded.getData(), 0.0);
        Assert.assertEquals("invalid sform x scale", 1.0, header.getSForm()[0][0], 0.0);
        Assert.assertEquals("invalid sform y shear", 0.0, header.getSForm()[1][0], 0.0);
        Assert.assertEquals("invalid mean for frame 1", (12 + 23) * 0.5 / 2.0, loaded.getFrameMean(1), 1e-9);

        final NiftiHeader headerOnly = NiftiHeader.read(path);
        Assert.assertEquals("invalid size along k", 2, headerOnly.getSize(2));
        Assert.assertEquals("missing axes should have size 1", 1, headerOnly.getSize(5));
    }

    @Test
    public void testScaledBigEndianIntegers() throws Exception {

        // 2x1x1 int16 image with slope 2 and intercept 1
        final ByteBuffer buffer = ByteBuffer.allocate(NiftiHeader.MINIMUM_VOXEL_OFFSET + 4).order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(0, NiftiHeader.HEADER_SIZE);
        buffer.putShort(40, (short) 3);
        buffer.putShort(42, (short) 2);
        buffer.putShort(44, (short) 1);
        buffer.putShort(46, (short) 1);
        buffer.putShort(70, NiftiDataType.INT16.getCode());
        buffer.putShort(72, NiftiDataType.INT16.getBitsPerVoxel());
        buffer.putFloat(108, NiftiHeader.MINIMUM_VOXEL_OFFSET);
        buffer.putFloat(112, 2.0f);
        buffer.putFloat(116, 1.0f);
        buffer.put(344, (byte) 'n');
        buffer.put(345, (byte) '+');
        buffer.put(346, (byte) '1');
        buffer.putShort(NiftiHeader.MINIMUM_VOXEL_OFFSET, (short) 3);
        buffer.putShort(NiftiHeader.MINIMUM_VOXEL_OFFSET + 2, (short) -4);

        final Path path = testDirectory.toPath().resolve("scaled.nii");
        Files.write(path, buffer.array());

        final NiftiImage image = NiftiImage.read(path);
        Assert.assertEquals("invalid byte order", ByteOrder.BIG_ENDIAN, image.getHeader().getByteOrder());
        Assert.assertArrayEquals("scaling not applied", new double[] { 7.0, -7.0 }, image.getData(), 0.0);
        Assert.assertEquals("3D image should have one frame", 1, image.getNumberOfFrames());

        final Path copy = testDirectory.toPath().resolve("scaled-copy.nii");
        image.write(copy);
        final NiftiImage reloaded = NiftiImage.read(copy);
        Assert.assertEquals("copy should be float32", NiftiDataType.FLOAT32, reloaded.getHeader().getDataType());
        Assert.assertEquals("copy should not be scaled", 1.0f, reloaded.getHeader().getScaleSlope(), 0.0f);
        Assert.assertArrayEquals("invalid copied data", new double[] { 7.0, -7.0 }, reloaded.getData(), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testIntegerTypesAreNotWritable() {
        NiftiDataType.INT16.write(ByteBuffer.allocate(2), 1.0);
    }

    @Test(expected = IOException.class)
    public void testInvalidFile() throws Exception {
        final Path path = testDirectory.toPath().resolve("not-nifti.nii");
        Files.write(path, new byte[400]);
        NiftiHeader.read(path);
    }

    /**
     * Writes a float32 volume with an identity transform.
     */
    public static Path writeVolume(final Path path,
                                   final int[] dims,
                                   final double[] data)
            throws IOException {
        new NiftiImage(NiftiHeader.create(dims), data).write(path);
        return path;
    }
}
