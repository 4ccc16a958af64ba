package com.acme.perfgate.decision;

import com.acme.perfgate.model.Scenario;

/**
 * Decides whether RPS jitter warrants one more round.
 *
 * <p>The check happens only when the executed round count reaches the current target, and
 * never lets the target exceed {@code plannedRounds + maxExtraRounds}.</p>
 */
public final class JitterPolicy {
    private final double maxCvPercent;
    private final int maxTotalRounds;

    public JitterPolicy(double maxCvPercent, int maxTotalRounds) {
        this.maxCvPercent = maxCvPercent;
        this.maxTotalRounds = maxTotalRounds;
    }

    public boolean shouldExtend(MetricHistory history, int targetRounds) {
        if (history.rounds() != targetRounds || targetRounds >= maxTotalRounds) {
            return false;
        }
        return highJitter(history);
    }

    /**
     * True when any scenario's RPS CV strictly exceeds the threshold.
     */
    public boolean highJitter(MetricHistory history) {
        for (Scenario scenario : history.scenarios()) {
            if (history.rpsCvPercent(scenario) > maxCvPercent) {
                return true;
            }
        }
        return false;
    }
}
