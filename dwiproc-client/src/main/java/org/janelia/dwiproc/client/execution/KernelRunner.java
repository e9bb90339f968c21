package org.janelia.dwiproc.client.execution;

import java.io.IOException;

/**
 * Executes external processing kernels.  Implementations decide where and how a command runs
 * (local process, container, ...); callers only rely on the command having completed when
 * {@link #run} returns.
 */
public interface KernelRunner {

    /**
     * Runs the command to completion.
     *
     * @throws IOException
     *   if the command cannot be started or fails.
     */
    void run(final KernelCommand command)
            throws IOException;
}
