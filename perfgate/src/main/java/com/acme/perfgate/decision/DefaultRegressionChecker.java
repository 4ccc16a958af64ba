package com.acme.perfgate.decision;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.MetricSample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Zero-regression contract: throughput may not drop, p99 and CPU per kRPS may not grow,
 * peak RSS stays under an absolute ceiling. Comparisons are inclusive, so matching the
 * baseline exactly passes.
 */
public final class DefaultRegressionChecker implements RegressionChecker {
    public static final String THROUGHPUT_BELOW_BASELINE = "throughput_below_baseline";
    public static final String P99_ABOVE_BASELINE = "p99_above_baseline";
    public static final String CPU_PER_KRPS_ABOVE_BASELINE = "cpu_per_krps_above_baseline";
    public static final String RSS_ABOVE_LIMIT = "rss_above_limit";
    public static final String PASS_ROUNDS_BELOW_QUORUM = "pass_rounds_below_quorum";

    private final long memoryHardLimitKb;

    public DefaultRegressionChecker(long memoryHardLimitKb) {
        if (memoryHardLimitKb <= 0) {
            throw new IllegalArgumentException("memoryHardLimitKb must be positive");
        }
        this.memoryHardLimitKb = memoryHardLimitKb;
    }

    @Override
    public List<String> scoreRound(MetricSample sample, BaselineEntry baseline) {
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(baseline, "baseline");
        return compare(
            sample.requestsPerSecond(),
            sample.p99LatencyUs(),
            sample.cpuPerKiloRps(),
            sample.residentMemoryKb(),
            baseline
        );
    }

    @Override
    public RegressionResult check(MedianMetrics median, BaselineEntry baseline, int passRounds, int requiredPassRounds) {
        Objects.requireNonNull(median, "median");
        Objects.requireNonNull(baseline, "baseline");
        List<String> reasons = compare(
            median.requestsPerSecond(),
            median.p99LatencyUs(),
            median.cpuPerKiloRps(),
            median.residentMemoryKb(),
            baseline
        );
        if (passRounds < requiredPassRounds) {
            reasons.add(PASS_ROUNDS_BELOW_QUORUM);
        }
        if (reasons.isEmpty()) {
            return new RegressionResult.Pass(baseline.scenario());
        }
        return new RegressionResult.Fail(baseline.scenario(), reasons);
    }

    private List<String> compare(double rps, double p99Us, double cpuPerKiloRps, double rssKb, BaselineEntry baseline) {
        List<String> reasons = new ArrayList<>(4);
        if (!(rps >= baseline.requestsPerSecond())) {
            reasons.add(THROUGHPUT_BELOW_BASELINE);
        }
        if (!(p99Us <= baseline.p99LatencyUs())) {
            reasons.add(P99_ABOVE_BASELINE);
        }
        if (!(cpuPerKiloRps <= baseline.cpuPerKiloRps())) {
            reasons.add(CPU_PER_KRPS_ABOVE_BASELINE);
        }
        if (!(rssKb <= memoryHardLimitKb)) {
            reasons.add(RSS_ABOVE_LIMIT);
        }
        return reasons;
    }
}
