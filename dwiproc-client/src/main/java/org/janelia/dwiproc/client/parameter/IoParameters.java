package org.janelia.dwiproc.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parameters for working and output locations and the thread budget handed to external kernels.
 */
public class IoParameters
        implements Serializable {

    @Parameter(
            names = "--outputDirectory",
            description = "Root directory for persisted derivatives",
            required = true)
    public String outputDirectory;

    @Parameter(
            names = "--workingDirectory",
            description = "Directory for intermediate (scratch) artifacts, default is <java.io.tmpdir>/dwiproc")
    public String workingDirectory;

    @Parameter(
            names = "--threads",
            description = "Number of threads external kernels may use")
    public int threads = 1;

    @Parameter(
            names = "--indexPath",
            description = "JSON index of resolved subject inputs (replaces the individual input options)")
    public String indexPath;

    public Path getOutputDirectory() {
        return Paths.get(outputDirectory).toAbsolutePath();
    }

    public Path getWorkingDirectory() {
        return workingDirectory == null ?
               Paths.get(System.getProperty("java.io.tmpdir"), "dwiproc") :
               Paths.get(workingDirectory).toAbsolutePath();
    }

    public Path getIndexPath() {
        return indexPath == null ? null : Paths.get(indexPath);
    }

    public void validate()
            throws IllegalArgumentException {
        if ((outputDirectory == null) || outputDirectory.trim().isEmpty()) {
            throw new IllegalArgumentException("outputDirectory must be specified");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
    }
}
