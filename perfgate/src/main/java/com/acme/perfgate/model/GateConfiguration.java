package com.acme.perfgate.model;

import com.acme.perfgate.util.DurationSpec;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Decision knobs of one gate invocation. Loaded once and never changed while rounds run.
 */
public record GateConfiguration(
    int plannedRounds,
    double minPassRatio,
    OptionalInt minPassRoundsOverride,
    double maxCvPercent,
    int maxExtraRounds,
    DurationSpec durationPerRound,
    long memoryHardLimitKb
) {
    /** Ratios are configured to four decimals; 0.7778 stands for 7/9. */
    public static final double RATIO_PRECISION = 0.0001d;

    public GateConfiguration {
        Objects.requireNonNull(minPassRoundsOverride, "minPassRoundsOverride");
        Objects.requireNonNull(durationPerRound, "durationPerRound");
        if (plannedRounds < 1) {
            throw new GateSetupException("planned rounds must be >= 1, got " + plannedRounds);
        }
        if (!(minPassRatio > 0d && minPassRatio <= 1d)) {
            throw new GateSetupException("min pass ratio must be in (0, 1], got " + minPassRatio);
        }
        if (maxCvPercent < 0d) {
            throw new GateSetupException("max CV percent must be >= 0, got " + maxCvPercent);
        }
        if (maxExtraRounds < 0) {
            throw new GateSetupException("max extra rounds must be >= 0, got " + maxExtraRounds);
        }
        if (memoryHardLimitKb <= 0) {
            throw new GateSetupException("memory hard limit must be positive, got " + memoryHardLimitKb);
        }
    }

    public static GateConfiguration defaults() {
        return fromEnvironment(Map.of());
    }

    public static GateConfiguration fromEnvironment(Map<String, String> env) {
        OptionalInt override;
        DurationSpec duration;
        try {
            override = EnvVars.getOptionalInt(env, GateEnvKeys.MIN_PASS_ROUNDS);
            duration = DurationSpec.parse(EnvVars.getOrDefault(env, GateEnvKeys.DURATION, GateDefaults.DEFAULT_DURATION));
        } catch (IllegalArgumentException e) {
            throw new GateSetupException(e.getMessage(), e);
        }
        return new GateConfiguration(
            EnvVars.getIntClamped(env, GateEnvKeys.ROUNDS, GateDefaults.DEFAULT_ROUNDS, 1, 1_000),
            EnvVars.getDoubleClamped(env, GateEnvKeys.MIN_PASS_RATIO, GateDefaults.DEFAULT_MIN_PASS_RATIO, 0.0001d, 1.0d),
            override,
            EnvVars.getDoubleClamped(env, GateEnvKeys.MAX_CV_PERCENT, GateDefaults.DEFAULT_MAX_CV_PERCENT, 0.0d, 1_000.0d),
            EnvVars.getIntClamped(env, GateEnvKeys.MAX_EXTRA_ROUNDS, GateDefaults.DEFAULT_MAX_EXTRA_ROUNDS, 0, 1_000),
            duration,
            EnvVars.getLongClamped(env, GateEnvKeys.RSS_LIMIT_KB, GateDefaults.DEFAULT_RSS_LIMIT_KB, 1L, Long.MAX_VALUE)
        );
    }

    public int maxTotalRounds() {
        return plannedRounds + maxExtraRounds;
    }

    /**
     * {@code ceil(executedRounds * minPassRatio)}, raised to the explicit override when the
     * override is larger. The override never lowers the requirement.
     *
     * <p>A ratio written to four decimals is off from the fraction it stands for by at most
     * half of {@value #RATIO_PRECISION}, so the product is off by at most
     * {@code executedRounds * RATIO_PRECISION / 2}. Only an excess within that bound is
     * treated as rounding: 9 x 0.7778 = 7.0002 requires 7, 10 x 0.1001 = 1.001 requires 2.</p>
     */
    public int requiredPassRounds(int executedRounds) {
        double raw = executedRounds * minPassRatio;
        double tolerance = executedRounds * RATIO_PRECISION / 2d;
        int ratioRequired = (int) Math.ceil(raw - tolerance);
        if (minPassRoundsOverride.isPresent() && minPassRoundsOverride.getAsInt() > ratioRequired) {
            return minPassRoundsOverride.getAsInt();
        }
        return ratioRequired;
    }
}
