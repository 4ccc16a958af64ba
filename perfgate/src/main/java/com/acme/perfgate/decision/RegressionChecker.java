package com.acme.perfgate.decision;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.MetricSample;

import java.util.List;

public interface RegressionChecker {
    /**
     * Reasons the single round misses the baseline; empty means the round passes.
     */
    List<String> scoreRound(MetricSample sample, BaselineEntry baseline);

    RegressionResult check(MedianMetrics median, BaselineEntry baseline, int passRounds, int requiredPassRounds);
}
