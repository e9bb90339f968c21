package org.janelia.dwiproc.util;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.dwiproc.scratch.ScratchAllocatorTest;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TextMatrix} class.
 */
public class TextMatrixTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = ScratchAllocatorTest.createTestDirectory("test_text_matrix");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testFormatRow() {
        Assert.assertEquals("invalid format",
                            "0.00000 -1.00000 0.00000 0.05000",
                            TextMatrix.formatRow(new double[] { -0.0, -1.0, 0.0, 0.05 }));
        Assert.assertEquals("invalid rounding",
                            "1.23457 100.00000",
                            TextMatrix.formatRow(new double[] { 1.234567, 100 }));
        Assert.assertEquals("values rounding to zero keep their sign",
                            "-0.00000",
                            TextMatrix.formatRow(new double[] { -0.000001 }));
    }

    @Test
    public void testLoad() throws Exception {

        final Path path = testDirectory.toPath().resolve("sub-01_dwi.bval");
        Files.write(path, Arrays.asList("# comment", "0 1000 1000", "", "2000 3000 0"), StandardCharsets.UTF_8);

        final double[][] rows = TextMatrix.load(path);

        Assert.assertEquals("invalid row count", 2, rows.length);
        Assert.assertArrayEquals("invalid first row", new double[] { 0, 1000, 1000 }, rows[0], 0.0);
        Assert.assertArrayEquals("invalid flat values",
                                 new double[] { 0, 1000, 1000, 2000, 3000, 0 },
                                 TextMatrix.loadFlat(path), 0.0);
    }

    @Test(expected = IOException.class)
    public void testLoadRaggedRows() throws Exception {
        final Path path = testDirectory.toPath().resolve("ragged.txt");
        Files.write(path, Arrays.asList("1 2 3", "4 5"), StandardCharsets.UTF_8);
        TextMatrix.load(path);
    }

    @Test(expected = IOException.class)
    public void testLoadNonNumeric() throws Exception {
        final Path path = testDirectory.toPath().resolve("bad.txt");
        Files.write(path, Arrays.asList("1 two 3"), StandardCharsets.UTF_8);
        TextMatrix.load(path);
    }
}
