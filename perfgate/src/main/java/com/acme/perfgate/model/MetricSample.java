package com.acme.perfgate.model;

import java.util.Objects;

/**
 * One observation of a scenario in one round.
 */
public record MetricSample(
    Scenario scenario,
    int roundIndex,
    double requestsPerSecond,
    double p99LatencyUs,
    double cpuPercent,
    long residentMemoryKb
) {
    public MetricSample {
        Objects.requireNonNull(scenario, "scenario");
        if (roundIndex < 1) {
            throw new IllegalArgumentException("roundIndex is 1-based: " + roundIndex);
        }
    }

    public double cpuPerKiloRps() {
        return DerivedMetrics.cpuPerKiloRps(cpuPercent, requestsPerSecond);
    }
}
