package org.janelia.dwiproc.client;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.dwiproc.client.execution.RecordingKernelRunner;
import org.janelia.dwiproc.client.output.OutputPersisterTest;
import org.janelia.dwiproc.client.parameter.CommandLineParameters;
import org.janelia.dwiproc.client.stage.UnsupportedMethodException;
import org.janelia.dwiproc.nifti.NiftiHeader;
import org.janelia.dwiproc.nifti.NiftiImage;
import org.janelia.dwiproc.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link ParticipantClient} class.
 */
public class ParticipantClientTest {

    private File testDirectory;
    private Path inputDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = OutputPersisterTest.createTestDirectory("test_participant_client");
        inputDirectory = testDirectory.toPath().resolve("in");
        Files.createDirectories(inputDirectory);
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new ParticipantClient.Parameters());
    }

    @Test
    public void testMissingSubject() throws Exception {
        final ParticipantClient.Parameters parameters = parse("--outputDirectory", "out",
                                                              "--dwi", "a.nii.gz",
                                                              "--bval", "a.bval",
                                                              "--bvec", "a.bvec");
        try {
            parameters.loadAndValidate();
            Assert.fail("missing subject should cause exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("invalid message: " + e.getMessage(), e.getMessage().contains("subject"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedInputCounts() throws Exception {
        parse("--outputDirectory", "out",
              "--subject", "01",
              "--dwi", "a.nii.gz", "b.nii.gz",
              "--bval", "a.bval",
              "--bvec", "a.bvec", "b.bvec").loadAndValidate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidEstimator() throws Exception {
        parse(withInputs("--outputDirectory", "out", "--denoiseEstimator", "Exp3")).loadAndValidate();
    }

    @Test(expected = UnsupportedMethodException.class)
    public void testUnknownTractographyMethod() throws Exception {
        parse(withInputs("--outputDirectory", "out", "--tractographyMethod", "bogus")).loadAndValidate();
    }

    @Test
    public void testLoadInputsFromIndex() throws Exception {

        final Path indexPath = inputDirectory.resolve("index.json");
        Files.write(indexPath,
                    Collections.singletonList(
                            "{ \"subject\": \"02\", \"session\": \"B\", \"dwi\": [ \"x.nii.gz\" ], " +
                            "\"bval\": [ \"x.bval\" ], \"bvec\": [ \"x.bvec\" ], \"wmFod\": \"fod.nii.gz\" }"),
                    StandardCharsets.UTF_8);

        final ParticipantClient.Parameters parameters = parse("--outputDirectory", "out",
                                                              "--indexPath", indexPath.toString());
        parameters.loadAndValidate();

        Assert.assertEquals("invalid subject", "02", parameters.input.subject);
        Assert.assertEquals("invalid session", "B", parameters.input.session);
        Assert.assertEquals("invalid acquisition count", 1, parameters.input.getAcquisitionCount());
        Assert.assertEquals("invalid wmFod", "fod.nii.gz", parameters.input.wmFod);
    }

    @Test
    public void testRun() throws Exception {

        final Path ap = writeAcquisition("ap", 31, "j");
        final Path pa = writeAcquisition("pa", 5, "j-");

        final Path transform = inputDirectory.resolve("dwi-to-t1w.txt");
        Files.write(transform, Arrays.asList("1 0 0 0", "0 1 0 0", "0 0 1 0", "0 0 0 1"), StandardCharsets.UTF_8);
        final Path b0 = writeVolume(inputDirectory.resolve("b0.nii.gz"), 3, 100.0);

        final Path outputRoot = testDirectory.toPath().resolve("out");
        final ParticipantClient.Parameters parameters = parse(
                "--outputDirectory", outputRoot.toString(),
                "--workingDirectory", testDirectory.toPath().resolve("work").toString(),
                "--threads", "2",
                "--subject", "01",
                "--dwi", ap.toString(), pa.toString(),
                "--bval", sibling(ap, ".bval"), sibling(pa, ".bval"),
                "--bvec", sibling(ap, ".bvec"), sibling(pa, ".bvec"),
                "--dwiJson", sibling(ap, ".json"), sibling(pa, ".json"),
                "--transform", transform.toString(),
                "--b0", b0.toString(),
                "--wmFod", inputDirectory.resolve("sub-01_wmfod.nii.gz").toString());
        parameters.loadAndValidate();

        final RecordingKernelRunner kernelRunner = new RecordingKernelRunner();
        final ParticipantClient.ParticipantOutputs outputs =
                new ParticipantClient(parameters, kernelRunner).run();

        Assert.assertEquals("invalid phase encoding table",
                            Arrays.asList("0.00000 1.00000 0.00000 0.00150",
                                          "0.00000 -1.00000 0.00000 0.00150"),
                            Files.readAllLines(outputs.phaseEncodingTable, StandardCharsets.UTF_8));

        final List<String> expectedIndices = new ArrayList<>(Collections.nCopies(31, "1"));
        expectedIndices.addAll(Collections.nCopies(5, "2"));
        Assert.assertEquals("invalid eddy indices",
                            Collections.singletonList(String.join(" ", expectedIndices)),
                            Files.readAllLines(outputs.eddyIndexFile, StandardCharsets.UTF_8));

        Assert.assertEquals("invalid denoised volume count", 2, outputs.denoisedVolumes.size());
        Assert.assertEquals("invalid denoised name",
                            "sub-01_run-1_desc-denoise_dwi.nii.gz",
                            outputs.denoisedVolumes.get(0).getFileName().toString());
        Assert.assertEquals("acquisition with few directions should not be denoised",
                            pa, outputs.denoisedVolumes.get(1));

        Assert.assertEquals("invalid kernel invocations",
                            Arrays.asList("dwidenoise", "tckgen", "tcksift2", "tckmap", "tckmap"),
                            kernelRunner.getPrograms());

        Assert.assertEquals("invalid rotated bvec location",
                            outputRoot.resolve("sub-01/dwi/sub-01_space-T1w_res-dwi_desc-preproc_dwi.bvec"),
                            outputs.rotatedBvec);
        Assert.assertTrue("rotated bvec should be persisted", Files.exists(outputs.rotatedBvec));

        final NiftiImage normalized = NiftiImage.read(outputs.normalizedB0);
        Assert.assertEquals("invalid normalized frame mean",
                            normalized.getFrameMean(0), normalized.getFrameMean(2), 1e-4);

        Assert.assertNotNull("tractography should run", outputs.tractography);
        Assert.assertTrue("tracks should be persisted",
                          Files.exists(outputRoot.resolve("sub-01/dwi/sub-01_method-iFOD2_tractography.tck")));
    }

    @Test
    public void testRunWithUngroupedDirections() throws Exception {

        final Path is = writeAcquisition("is", 3, "k");
        final Path si = writeAcquisition("si", 2, "k-");

        final ParticipantClient.Parameters parameters = parse(
                "--outputDirectory", testDirectory.toPath().resolve("out").toString(),
                "--workingDirectory", testDirectory.toPath().resolve("work").toString(),
                "--subject", "01",
                "--dwi", is.toString(), si.toString(),
                "--bval", sibling(is, ".bval"), sibling(si, ".bval"),
                "--bvec", sibling(is, ".bvec"), sibling(si, ".bvec"),
                "--dwiJson", sibling(is, ".json"), sibling(si, ".json"));
        parameters.loadAndValidate();

        final ParticipantClient.ParticipantOutputs outputs =
                new ParticipantClient(parameters, new RecordingKernelRunner()).run();

        Assert.assertEquals("every volume should be in group 1",
                            Collections.singletonList(String.join(" ", Collections.nCopies(7, "1"))),
                            Files.readAllLines(outputs.eddyIndexFile, StandardCharsets.UTF_8));
    }

    private static ParticipantClient.Parameters parse(final String... args) {
        final ParticipantClient.Parameters parameters = new ParticipantClient.Parameters();
        Assert.assertTrue("failed to parse " + Arrays.toString(args),
                          parameters.parse(args, ParticipantClient.class, false));
        return parameters;
    }

    private static String[] withInputs(final String... args) {
        final List<String> list = new ArrayList<>(Arrays.asList(args));
        list.addAll(Arrays.asList("--subject", "01",
                                  "--dwi", "a.nii.gz",
                                  "--bval", "a.bval",
                                  "--bvec", "a.bvec"));
        return list.toArray(new String[0]);
    }

    private static String sibling(final Path volume,
                                  final String extension) {
        final String name = volume.getFileName().toString().replace(".nii.gz", extension);
        return volume.resolveSibling(name).toString();
    }

    private Path writeAcquisition(final String direction,
                                  final int diffusionWeightedCount,
                                  final String peLabel) throws Exception {

        final int frameCount = diffusionWeightedCount + 1;
        final Path dwi = writeVolume(inputDirectory.resolve("sub-01_dir-" + direction + "_dwi.nii.gz"),
                                     frameCount, 50.0);

        final StringBuilder bvals = new StringBuilder("0");
        final StringBuilder[] bvecs = { new StringBuilder("0"), new StringBuilder("0"), new StringBuilder("0") };
        for (int i = 0; i < diffusionWeightedCount; i++) {
            bvals.append(" 1000");
            bvecs[0].append(" 1");
            bvecs[1].append(" 0");
            bvecs[2].append(" 0");
        }
        Files.write(dwi.resolveSibling(dwi.getFileName().toString().replace(".nii.gz", ".bval")),
                    Collections.singletonList(bvals.toString()), StandardCharsets.UTF_8);
        Files.write(dwi.resolveSibling(dwi.getFileName().toString().replace(".nii.gz", ".bvec")),
                    Arrays.asList(bvecs[0].toString(), bvecs[1].toString(), bvecs[2].toString()),
                    StandardCharsets.UTF_8);
        Files.write(dwi.resolveSibling(dwi.getFileName().toString().replace(".nii.gz", ".json")),
                    Collections.singletonList("{ \"EffectiveEchoSpacing\": 0.0005, " +
                                              "\"PhaseEncodingDirection\": \"" + peLabel + "\" }"),
                    StandardCharsets.UTF_8);

        return dwi;
    }

    /**
     * Writes a 2x3x2 volume with the specified number of frames where frame f has mean (f + 1) * base.
     */
    private static Path writeVolume(final Path path,
                                    final int frameCount,
                                    final double base) throws Exception {
        final int voxelsPerFrame = 2 * 3 * 2;
        final double[] data = new double[voxelsPerFrame * frameCount];
        for (int frame = 0; frame < frameCount; frame++) {
            for (int i = 0; i < voxelsPerFrame; i++) {
                data[(frame * voxelsPerFrame) + i] = (frame + 1) * base + ((i % 2 == 0) ? 1 : -1);
            }
        }
        new NiftiImage(NiftiHeader.create(2, 3, 2, frameCount), data).write(path);
        return path;
    }
}
