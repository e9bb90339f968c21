package org.janelia.dwiproc.client.execution;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.dwiproc.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs kernels as local processes, forwarding their console output to the log.
 */
public class LocalKernelRunner
        implements KernelRunner {

    @Override
    public void run(final KernelCommand command)
            throws IOException {

        LOG.info("run: entry, command={}", command);

        final ProcessTimer timer = new ProcessTimer();

        final ProcessBuilder processBuilder = new ProcessBuilder(command.getCommandLine());
        processBuilder.redirectErrorStream(true);

        final Process process = processBuilder.start();

        try (final BufferedReader reader =
                     new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.info("{}: {}", command.getProgram(), line);
            }
        }

        final int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (final InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while waiting for " + command.getProgram(), e);
        }

        if (exitCode != 0) {
            throw new IOException(command.getProgram() + " failed with exit code " + exitCode +
                                  ", command was: " + command);
        }

        for (final Path output : command.getOutputs()) {
            if (! Files.exists(output)) {
                LOG.warn("run: {} did not write {}", command.getProgram(), output);
            }
        }

        LOG.info("run: exit, {} completed in {}", command.getProgram(), timer);
    }

    private static final Logger LOG = LoggerFactory.getLogger(LocalKernelRunner.class);
}
