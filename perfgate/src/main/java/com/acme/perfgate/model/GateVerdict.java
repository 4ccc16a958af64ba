package com.acme.perfgate.model;

import java.util.List;

public record GateVerdict(
    List<ScenarioVerdict> scenarios,
    int plannedRounds,
    int roundsExecuted,
    int requiredPassRounds
) {
    public GateVerdict {
        scenarios = List.copyOf(scenarios);
    }

    /**
     * Logical AND over every scenario; a single failing scenario fails the gate.
     */
    public boolean overallPass() {
        for (ScenarioVerdict verdict : scenarios) {
            if (!verdict.overallPass()) {
                return false;
            }
        }
        return true;
    }
}
