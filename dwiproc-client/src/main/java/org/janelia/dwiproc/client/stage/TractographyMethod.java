package org.janelia.dwiproc.client.stage;

import java.util.Arrays;

/**
 * Supported tractography seeding strategies.  Each constant supplies its own strategy,
 * so adding a constant without an implementation does not compile.
 */
public enum TractographyMethod {

    /** Probabilistic tracking seeded dynamically from the white matter FOD. */
    WM("wm") {
        @Override
        public TractographyStrategy getStrategy() {
            return new WhiteMatterTractography();
        }
    },

    /** Anatomically constrained tractography (declared but not implemented yet). */
    ACT("act") {
        @Override
        public TractographyStrategy getStrategy()
                throws UnsupportedMethodException {
            throw new UnsupportedMethodException("tractography method '" + getName() + "' is not supported yet");
        }
    };

    private final String name;

    TractographyMethod(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @throws UnsupportedMethodException
     *   if this method has no implementation.
     */
    public abstract TractographyStrategy getStrategy()
            throws UnsupportedMethodException;

    /**
     * @throws UnsupportedMethodException
     *   if the name does not identify a known method.
     */
    public static TractographyMethod fromName(final String name)
            throws UnsupportedMethodException {
        for (final TractographyMethod method : values()) {
            if (method.name.equals(name)) {
                return method;
            }
        }
        throw new UnsupportedMethodException("unknown tractography method '" + name + "', must be one of " +
                                             Arrays.toString(Arrays.stream(values()).map(m -> m.name).toArray()));
    }

    @Override
    public String toString() {
        return name;
    }
}
