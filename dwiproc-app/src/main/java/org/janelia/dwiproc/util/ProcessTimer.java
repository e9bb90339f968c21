package org.janelia.dwiproc.util;

/**
 * Utility to track elapsed time for a subject run or a single kernel invocation.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        if (hours > 0) {
            return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
        } else if (minutes > 0) {
            return minutes + " minutes, " + seconds + " seconds";
        }
        return (getElapsedMilliseconds() / 1000.0) + " seconds";
    }
}
