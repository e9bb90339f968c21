package org.janelia.dwiproc.client.execution;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.dwiproc.scratch.ScratchAllocator;

/**
 * Everything a stage needs to invoke external kernels for one subject run:
 * the runner, the scratch allocator and the thread budget passed to each kernel.
 *
 * Built once per run and handed to every stage.
 */
public class ExecutionContext {

    private final KernelRunner kernelRunner;
    private final ScratchAllocator scratchAllocator;
    private final int threads;

    public ExecutionContext(final KernelRunner kernelRunner,
                            final ScratchAllocator scratchAllocator,
                            final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
        this.kernelRunner = kernelRunner;
        this.scratchAllocator = scratchAllocator;
        this.threads = threads;
    }

    public ScratchAllocator getScratchAllocator() {
        return scratchAllocator;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * @return newly allocated scratch directory for one invocation of the specified kernel.
     */
    public Path allocateKernelDirectory(final String kernelName)
            throws IOException {
        return scratchAllocator.allocate(kernelName);
    }

    public void run(final KernelCommand command)
            throws IOException {
        kernelRunner.run(command);
    }
}
