package org.janelia.dwiproc.client.execution;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command line for one external kernel invocation, along with the output files it is
 * expected to produce.
 */
public class KernelCommand {

    private final String program;
    private final List<String> arguments;
    private final List<Path> outputs;

    public KernelCommand(final String program) {
        this.program = program;
        this.arguments = new ArrayList<>();
        this.outputs = new ArrayList<>();
    }

    public String getProgram() {
        return program;
    }

    public List<String> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    /**
     * @return files this invocation writes (positional and option outputs).
     */
    public List<Path> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    /**
     * @return program followed by its arguments.
     */
    public List<String> getCommandLine() {
        final List<String> commandLine = new ArrayList<>(arguments.size() + 1);
        commandLine.add(program);
        commandLine.addAll(arguments);
        return commandLine;
    }

    public KernelCommand addInput(final Path input) {
        arguments.add(input.toString());
        return this;
    }

    public KernelCommand addOutput(final Path output) {
        arguments.add(output.toString());
        outputs.add(output);
        return this;
    }

    public KernelCommand addFlag(final String option) {
        arguments.add(option);
        return this;
    }

    /**
     * Adds the option and its value, unless the value is null.
     */
    public KernelCommand addOption(final String option,
                                   final Object value) {
        if (value != null) {
            arguments.add(option);
            arguments.add(value.toString());
        }
        return this;
    }

    /**
     * Adds an option whose value is a file the kernel writes, unless the path is null.
     */
    public KernelCommand addOutputOption(final String option,
                                         final Path output) {
        if (output != null) {
            arguments.add(option);
            arguments.add(output.toString());
            outputs.add(output);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.join(" ", getCommandLine());
    }
}
