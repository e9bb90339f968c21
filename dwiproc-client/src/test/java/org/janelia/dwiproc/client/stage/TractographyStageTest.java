package org.janelia.dwiproc.client.stage;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.dwiproc.bids.BidsEntities;
import org.janelia.dwiproc.client.execution.ExecutionContext;
import org.janelia.dwiproc.client.execution.KernelCommand;
import org.janelia.dwiproc.client.execution.RecordingKernelRunner;
import org.janelia.dwiproc.client.output.OutputPersister;
import org.janelia.dwiproc.client.output.OutputPersisterTest;
import org.janelia.dwiproc.client.parameter.TractographyParameters;
import org.janelia.dwiproc.scratch.ScratchAllocator;
import org.janelia.dwiproc.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TractographyStage} class.
 */
public class TractographyStageTest {

    private File testDirectory;
    private RecordingKernelRunner kernelRunner;
    private TractographyParameters parameters;
    private TractographyStage stage;
    private Path wmFod;
    private Path outputRoot;

    @Before
    public void setup() throws Exception {
        testDirectory = OutputPersisterTest.createTestDirectory("test_tractography_stage");
        kernelRunner = new RecordingKernelRunner();
        parameters = new TractographyParameters();
        outputRoot = testDirectory.toPath().resolve("out");
        stage = new TractographyStage(parameters,
                                      new ExecutionContext(kernelRunner,
                                                           new ScratchAllocator(testDirectory.toPath().resolve("work")),
                                                           8),
                                      new OutputPersister(outputRoot));
        wmFod = testDirectory.toPath().resolve("in/sub-01_model-CSD_param-wm_dwimap.nii.gz");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testUnsupportedMethods() throws Exception {
        for (final String method : new String[] { "act", "bogus" }) {
            parameters.method = method;
            try {
                stage.run(wmFod, BidsEntities.forSubject("01"));
                Assert.fail("method '" + method + "' should cause exception");
            } catch (final UnsupportedMethodException e) {
                Assert.assertTrue("no kernel should be invoked for '" + method + "'",
                                  kernelRunner.getCommands().isEmpty());
            }
        }
    }

    @Test
    public void testWhiteMatterTractography() throws Exception {

        parameters.steps = 0.5;
        parameters.streamlines = 5000;

        final TractographyOutputs outputs = stage.run(wmFod, BidsEntities.forSubject("01"));

        Assert.assertEquals("invalid kernel order",
                            Arrays.asList("tckgen", "tcksift2", "tckmap", "tckmap"), kernelRunner.getPrograms());

        for (final KernelCommand command : kernelRunner.getCommands()) {
            final List<String> arguments = command.getArguments();
            final int threadIndex = arguments.indexOf("-nthreads");
            Assert.assertTrue("missing thread count for " + command, threadIndex >= 0);
            Assert.assertEquals("invalid thread count for " + command, "8", arguments.get(threadIndex + 1));
        }

        final List<String> tckgenArguments = kernelRunner.getCommands().get(0).getArguments();
        Assert.assertEquals("invalid seed", wmFod.toString(),
                            tckgenArguments.get(tckgenArguments.indexOf("-seed_dynamic") + 1));
        Assert.assertEquals("invalid step", "0.5", tckgenArguments.get(tckgenArguments.indexOf("-step") + 1));
        Assert.assertEquals("invalid select", "5000", tckgenArguments.get(tckgenArguments.indexOf("-select") + 1));
        Assert.assertFalse("cutoff should be omitted", tckgenArguments.contains("-cutoff"));

        Assert.assertFalse("raw density should not be weighted",
                           kernelRunner.getCommands().get(2).getArguments().contains("-tck_weights_in"));
        final List<String> weightedArguments = kernelRunner.getCommands().get(3).getArguments();
        Assert.assertEquals("weighted density should use SIFT2 weights",
                            outputs.getWeights().toString(),
                            weightedArguments.get(weightedArguments.indexOf("-tck_weights_in") + 1));

        Assert.assertEquals("invalid tracks name",
                            "sub-01_method-iFOD2_tractography.tck", outputs.getTracks().getFileName().toString());
        Assert.assertEquals("invalid weights name",
                            "sub-01_method-SIFT2_tckWeights.txt", outputs.getWeights().getFileName().toString());
        Assert.assertEquals("invalid raw density name",
                            "sub-01_meas-raw_tdi.nii.gz", outputs.getRawDensity().getFileName().toString());
        Assert.assertEquals("invalid weighted density name",
                            "sub-01_meas-weighted_tdi.nii.gz", outputs.getWeightedDensity().getFileName().toString());

        final Path persisted = outputRoot.resolve("sub-01/dwi");
        for (final Path artifact : Arrays.asList(outputs.getTracks(),
                                                 outputs.getWeights(),
                                                 outputs.getWeightedDensity())) {
            Assert.assertTrue(artifact.getFileName() + " should be persisted",
                              Files.exists(persisted.resolve(artifact.getFileName())));
        }
        Assert.assertFalse("raw density should not be persisted",
                           Files.exists(persisted.resolve(outputs.getRawDensity().getFileName())));
    }

    @Test
    public void testMethodNames() {
        Assert.assertEquals("invalid method", TractographyMethod.WM, TractographyMethod.fromName("wm"));
        Assert.assertEquals("invalid method", TractographyMethod.ACT, TractographyMethod.fromName("act"));
    }

    @Test(expected = UnsupportedMethodException.class)
    public void testActHasNoStrategy() {
        TractographyMethod.ACT.getStrategy();
    }
}
