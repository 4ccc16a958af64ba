package com.acme.perfgate.process;

/**
 * CPU and memory consumed by the subject during one load phase.
 */
public record ResourceUsage(double cpuPercent, long peakRssKb, long cpuTicks, double wallSeconds) {

    /**
     * {@code ticks / clockTicksPerSecond * 100 / wallSeconds}; zero when the ticks did not
     * advance or no wall time elapsed.
     */
    public static double cpuPercent(long startTicks, long endTicks, long clockTicksPerSecond, double wallSeconds) {
        if (endTicks <= startTicks || clockTicksPerSecond <= 0 || wallSeconds <= 0d) {
            return 0d;
        }
        return (double) (endTicks - startTicks) / clockTicksPerSecond * 100d / wallSeconds;
    }
}
