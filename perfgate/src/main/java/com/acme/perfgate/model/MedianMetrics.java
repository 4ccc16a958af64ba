package com.acme.perfgate.model;

/**
 * Per-metric medians over all executed rounds. Each median is taken independently, so
 * {@link #cpuPerKiloRps()} is derived from the median CPU and median RPS rather than being
 * the median of per-round ratios.
 */
public record MedianMetrics(
    double requestsPerSecond,
    double p99LatencyUs,
    double cpuPercent,
    double residentMemoryKb
) {
    public double cpuPerKiloRps() {
        return DerivedMetrics.cpuPerKiloRps(cpuPercent, requestsPerSecond);
    }
}
