package com.acme.perfgate.decision;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.model.GateSetupException;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundOutcome;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.model.ScenarioVerdict;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Accumulates rounds, scores each one against the baseline, extends the run on jitter and
 * computes the final verdict once all rounds are in.
 */
public final class RegressionDecisionEngine {
    private static final Logger LOG = Logger.getLogger(RegressionDecisionEngine.class.getName());

    private final GateConfiguration config;
    private final Map<Scenario, BaselineEntry> baselines;
    private final RegressionChecker checker;
    private final JitterPolicy jitterPolicy;
    private final MetricHistory history;
    private final Map<Scenario, Integer> passRounds = new LinkedHashMap<>();
    private final List<RoundOutcome> outcomes = new ArrayList<>();
    private int targetRounds;

    public RegressionDecisionEngine(GateConfiguration config,
                                    List<Scenario> scenarios,
                                    Map<Scenario, BaselineEntry> baselines) {
        this(config, scenarios, baselines, new DefaultRegressionChecker(config.memoryHardLimitKb()));
    }

    public RegressionDecisionEngine(GateConfiguration config,
                                    List<Scenario> scenarios,
                                    Map<Scenario, BaselineEntry> baselines,
                                    RegressionChecker checker) {
        this.config = Objects.requireNonNull(config, "config");
        this.checker = Objects.requireNonNull(checker, "checker");
        this.history = new MetricHistory(scenarios);
        this.baselines = new LinkedHashMap<>();
        for (Scenario scenario : scenarios) {
            BaselineEntry entry = baselines.get(scenario);
            if (entry == null) {
                throw new GateSetupException("baseline missing scenario: " + scenario);
            }
            this.baselines.put(scenario, entry);
            passRounds.put(scenario, 0);
        }
        this.jitterPolicy = new JitterPolicy(config.maxCvPercent(), config.maxTotalRounds());
        this.targetRounds = config.plannedRounds();
    }

    public int targetRounds() {
        return targetRounds;
    }

    public int executedRounds() {
        return history.rounds();
    }

    public boolean hasPendingRounds() {
        return history.rounds() < targetRounds;
    }

    public MetricHistory history() {
        return history;
    }

    public List<RoundOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    /**
     * Appends a complete round and scores every scenario in it.
     */
    public List<RoundOutcome> recordRound(int roundIndex, Map<Scenario, MetricSample> samples) {
        history.append(roundIndex, samples);
        List<RoundOutcome> roundOutcomes = new ArrayList<>(baselines.size());
        for (Map.Entry<Scenario, BaselineEntry> e : baselines.entrySet()) {
            Scenario scenario = e.getKey();
            List<String> reasons = checker.scoreRound(samples.get(scenario), e.getValue());
            RoundOutcome outcome = new RoundOutcome(scenario, roundIndex, reasons);
            if (outcome.pass()) {
                passRounds.merge(scenario, 1, Integer::sum);
            }
            roundOutcomes.add(outcome);
            LOG.fine(() -> "round=" + roundIndex + " scenario=" + scenario + " pass=" + outcome.pass()
                + (outcome.pass() ? "" : " reasons=" + outcome.failureReasons()));
        }
        outcomes.addAll(roundOutcomes);
        return roundOutcomes;
    }

    /**
     * Raises the target by one round when the run just reached its target, the cap allows
     * it and RPS jitter is above the threshold.
     *
     * @return true when the target was raised
     */
    public boolean maybeExtend() {
        if (!jitterPolicy.shouldExtend(history, targetRounds)) {
            return false;
        }
        targetRounds++;
        return true;
    }

    public int passRounds(Scenario scenario) {
        Integer count = passRounds.get(scenario);
        if (count == null) {
            throw new IllegalArgumentException("unknown scenario: " + scenario);
        }
        return count;
    }

    public GateVerdict verdict() {
        int executed = history.rounds();
        if (executed == 0) {
            throw new IllegalStateException("no rounds executed");
        }
        int required = config.requiredPassRounds(executed);
        List<ScenarioVerdict> verdicts = new ArrayList<>(baselines.size());
        for (Map.Entry<Scenario, BaselineEntry> e : baselines.entrySet()) {
            Scenario scenario = e.getKey();
            MedianMetrics median = history.medians(scenario);
            int passed = passRounds(scenario);
            RegressionResult result = checker.check(median, e.getValue(), passed, required);
            List<String> reasons = result instanceof RegressionResult.Fail fail ? fail.reasons() : List.of();
            verdicts.add(new ScenarioVerdict(
                scenario,
                e.getValue(),
                median,
                passed,
                executed,
                history.rpsCvPercent(scenario),
                reasons
            ));
        }
        return new GateVerdict(verdicts, config.plannedRounds(), executed, required);
    }
}
