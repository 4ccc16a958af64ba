package com.acme.perfgate.model;

import java.util.Objects;

public record BaselineEntry(
    Scenario scenario,
    double requestsPerSecond,
    double p99LatencyUs,
    double cpuPercent,
    double residentMemoryKb
) {
    public BaselineEntry {
        Objects.requireNonNull(scenario, "scenario");
    }

    public double cpuPerKiloRps() {
        return DerivedMetrics.cpuPerKiloRps(cpuPercent, requestsPerSecond);
    }
}
