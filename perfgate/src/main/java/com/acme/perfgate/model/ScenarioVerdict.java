package com.acme.perfgate.model;

import java.util.List;
import java.util.Objects;

public record ScenarioVerdict(
    Scenario scenario,
    BaselineEntry baseline,
    MedianMetrics median,
    int passRoundCount,
    int roundsExecuted,
    double rpsCvPercent,
    List<String> failureReasons
) {
    public ScenarioVerdict {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(median, "median");
        failureReasons = List.copyOf(failureReasons);
    }

    public boolean overallPass() {
        return failureReasons.isEmpty();
    }
}
