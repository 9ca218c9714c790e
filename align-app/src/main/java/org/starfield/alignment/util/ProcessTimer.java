package org.starfield.alignment.util;

/**
 * Tracks elapsed time for a process.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long minutes = elapsed / 60000;
        final double seconds = (elapsed % 60000) / 1000.0;
        return minutes > 0 ? String.format("%d minutes, %.3f seconds", minutes, seconds) :
               String.format("%.3f seconds", seconds);
    }
}
