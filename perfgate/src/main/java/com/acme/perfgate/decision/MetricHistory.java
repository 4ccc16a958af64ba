package com.acme.perfgate.decision;

import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Append-only per-scenario sample lists for one gate run. Rounds are accepted only whole:
 * a round that lacks any scenario is rejected before anything is appended.
 */
public final class MetricHistory {
    private final List<Scenario> scenarios;
    private final Map<Scenario, List<MetricSample>> samples = new LinkedHashMap<>();
    private int rounds;

    public MetricHistory(List<Scenario> scenarios) {
        if (scenarios.isEmpty()) {
            throw new IllegalArgumentException("scenario set is empty");
        }
        this.scenarios = List.copyOf(scenarios);
        for (Scenario scenario : this.scenarios) {
            samples.put(scenario, new ArrayList<>());
        }
    }

    /**
     * @param roundSamples samples keyed by scenario; scenarios outside the set are ignored
     * @throws RoundFailureException when a scenario of the set has no sample or the round is
     *                               out of sequence
     */
    public void append(int roundIndex, Map<Scenario, MetricSample> roundSamples) {
        if (roundIndex != rounds + 1) {
            throw new RoundFailureException("round " + roundIndex + " out of sequence, expected " + (rounds + 1));
        }
        for (Scenario scenario : scenarios) {
            MetricSample sample = roundSamples.get(scenario);
            if (sample == null) {
                throw new RoundFailureException("round " + roundIndex + " missing metrics for scenario: " + scenario);
            }
            if (sample.roundIndex() != roundIndex) {
                throw new RoundFailureException("sample for " + scenario + " belongs to round "
                    + sample.roundIndex() + ", expected " + roundIndex);
            }
        }
        for (Scenario scenario : scenarios) {
            samples.get(scenario).add(roundSamples.get(scenario));
        }
        rounds++;
    }

    public int rounds() {
        return rounds;
    }

    public List<Scenario> scenarios() {
        return scenarios;
    }

    public List<MetricSample> samples(Scenario scenario) {
        List<MetricSample> list = samples.get(scenario);
        if (list == null) {
            throw new IllegalArgumentException("unknown scenario: " + scenario);
        }
        return Collections.unmodifiableList(list);
    }

    public List<Double> requestsPerSecond(Scenario scenario) {
        return values(scenario, MetricSample::requestsPerSecond);
    }

    public double rpsCvPercent(Scenario scenario) {
        return GateMath.cvPercent(requestsPerSecond(scenario));
    }

    public MedianMetrics medians(Scenario scenario) {
        return new MedianMetrics(
            GateMath.median(requestsPerSecond(scenario)),
            GateMath.median(values(scenario, MetricSample::p99LatencyUs)),
            GateMath.median(values(scenario, MetricSample::cpuPercent)),
            GateMath.median(values(scenario, s -> (double) s.residentMemoryKb()))
        );
    }

    private List<Double> values(Scenario scenario, ToDoubleFunction<MetricSample> metric) {
        List<MetricSample> list = samples(scenario);
        List<Double> out = new ArrayList<>(list.size());
        for (MetricSample sample : list) {
            out.add(metric.applyAsDouble(sample));
        }
        return out;
    }
}
