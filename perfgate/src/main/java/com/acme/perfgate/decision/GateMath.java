package com.acme.perfgate.decision;

import java.util.Arrays;
import java.util.List;

/**
 * Exact order statistics used by the verdict. No interpolation: the recorded baselines were
 * produced with the same rules and must stay comparable.
 */
public final class GateMath {
    private GateMath() {
    }

    /**
     * Middle element of the sorted values, or the mean of the two middle elements for an
     * even count.
     */
    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("median of empty sequence");
        }
        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = values.get(i);
        }
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2d;
    }

    /**
     * Population coefficient of variation in percent. Empty or zero-mean input is 0.
     */
    public static double cvPercent(List<Double> values) {
        int n = values.size();
        if (n == 0) {
            return 0d;
        }
        double sum = 0d;
        double sumSq = 0d;
        for (double v : values) {
            sum += v;
            sumSq += v * v;
        }
        if (sum == 0d) {
            return 0d;
        }
        double mean = sum / n;
        double variance = Math.max(0d, sumSq / n - mean * mean);
        return Math.sqrt(variance) / mean * 100d;
    }

    /**
     * Relative change from {@code baseline} to {@code current} in percent; 0 when the
     * baseline is 0.
     */
    public static double pctDelta(double baseline, double current) {
        if (baseline == 0d) {
            return 0d;
        }
        return (current - baseline) / baseline * 100d;
    }
}
