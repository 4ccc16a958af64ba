package com.acme.perfgate.model;

public final class DerivedMetrics {
    private DerivedMetrics() {
    }

    /**
     * CPU percent spent per thousand requests per second; zero when nothing was served.
     */
    public static double cpuPerKiloRps(double cpuPercent, double requestsPerSecond) {
        if (requestsPerSecond == 0d) {
            return 0d;
        }
        return cpuPercent * 1000d / requestsPerSecond;
    }
}
