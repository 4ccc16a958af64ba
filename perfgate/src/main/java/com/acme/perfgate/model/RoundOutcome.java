package com.acme.perfgate.model;

import java.util.List;

public record RoundOutcome(Scenario scenario, int roundIndex, List<String> failureReasons) {
    public RoundOutcome {
        failureReasons = List.copyOf(failureReasons);
    }

    public boolean pass() {
        return failureReasons.isEmpty();
    }
}
