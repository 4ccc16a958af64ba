package com.acme.perfgate.decision;

import com.acme.perfgate.model.Scenario;

import java.util.List;

public sealed interface RegressionResult permits RegressionResult.Pass, RegressionResult.Fail {
    Scenario scenario();

    record Pass(Scenario scenario) implements RegressionResult {}

    record Fail(Scenario scenario, List<String> reasons) implements RegressionResult {
        public Fail {
            reasons = List.copyOf(reasons);
        }
    }
}
