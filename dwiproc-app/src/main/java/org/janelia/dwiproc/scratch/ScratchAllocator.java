package org.janelia.dwiproc.scratch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.janelia.dwiproc.bids.BidsName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates hash tagged working subdirectories (e.g. "3f9a1c2e_eddy-indices") so that no two
 * stages, kernels or concurrently processed subjects ever write into the same directory.
 *
 * Directories are created eagerly when they are allocated.  An allocation that finds its
 * directory already present fails instead of reusing it.
 */
public class ScratchAllocator {

    private final Path workingDirectory;

    public ScratchAllocator(final Path workingDirectory) {
        if (workingDirectory == null) {
            throw new IllegalArgumentException("working directory must be specified");
        }
        this.workingDirectory = workingDirectory.toAbsolutePath();
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * @param  label  short stage or kernel label appended to the hash.
     *
     * @return newly created directory.
     *
     * @throws IOException
     *   if the directory already exists or cannot be created.
     */
    public Path allocate(final String label)
            throws IOException {

        if ((label == null) || label.isEmpty() || label.contains("/")) {
            throw new IllegalArgumentException("invalid scratch label '" + label + "'");
        }

        Files.createDirectories(workingDirectory);

        final Path directory = workingDirectory.resolve(newHash() + "_" + label);

        // createDirectory is atomic and fails with FileAlreadyExistsException on collision
        Files.createDirectory(directory);

        LOG.debug("allocate: created {}", directory);

        return directory;
    }

    /**
     * @return path for the named artifact inside a newly allocated directory.
     */
    public Path allocateFile(final String label,
                             final BidsName name)
            throws IOException {
        return allocate(label).resolve(name.toFileName());
    }

    /**
     * @return fresh opaque tag for a directory name.
     */
    protected String newHash() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, HASH_LENGTH);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ScratchAllocator.class);

    private static final int HASH_LENGTH = 8;
}
