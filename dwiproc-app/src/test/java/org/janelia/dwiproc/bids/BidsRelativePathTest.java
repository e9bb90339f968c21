package org.janelia.dwiproc.bids;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link BidsRelativePath} class.
 */
public class BidsRelativePathTest {

    @Test
    public void testSubjectDirectory() {

        final BidsRelativePath relativePath =
                BidsRelativePath.of(Paths.get("/work/3f9a1c2e_dwidenoise/sub-01/dwi/file.nii.gz"));

        Assert.assertEquals("invalid relative path",
                            Paths.get("sub-01", "dwi", "file.nii.gz"), relativePath.getRelativePath());
        Assert.assertEquals("invalid output location",
                            Paths.get("/out/sub-01/dwi/file.nii.gz"),
                            relativePath.resolveAgainst(Paths.get("/out")));
        Assert.assertEquals("invalid subject", "01", relativePath.getSubject());
    }

    @Test
    public void testEntityPrefixedFileName() {

        final Path artifact = Paths.get("/work/3f9a1c2e_tckgen/sub-01_ses-A_run-1_method-iFOD2_tractography.tck");
        final BidsRelativePath relativePath = BidsRelativePath.of(artifact);

        Assert.assertEquals("invalid relative path",
                            Paths.get("sub-01_ses-A_run-1_method-iFOD2_tractography.tck"),
                            relativePath.getRelativePath());
        Assert.assertEquals("invalid session", "A", relativePath.getEntities().get(BidsEntities.SESSION));
        Assert.assertEquals("invalid run", "1", relativePath.getEntities().get(BidsEntities.RUN));
        Assert.assertFalse("descriptor fields should not be treated as entities",
                           relativePath.getEntities().containsKey("method"));
    }

    @Test
    public void testSubjectMarkerMustStartComponent() {

        final BidsRelativePath relativePath =
                BidsRelativePath.of(Paths.get("/data/nhp-sub-study/work/3f9a1c2e_normalize/sub-02_desc-normalized_b0.nii.gz"));

        Assert.assertEquals("directory merely containing the marker should be skipped",
                            Paths.get("sub-02_desc-normalized_b0.nii.gz"), relativePath.getRelativePath());
        Assert.assertEquals("invalid subject", "02", relativePath.getSubject());
    }

    @Test(expected = UnresolvedPathException.class)
    public void testMarkerInsideComponentIsNotASubject() {
        BidsRelativePath.of(Paths.get("/data/nhp-sub-study/work/tracks.tck"));
    }

    @Test(expected = UnresolvedPathException.class)
    public void testMissingSubject() {
        BidsRelativePath.of(Paths.get("/work/3f9a1c2e_tckgen/tracks.tck"));
    }
}
