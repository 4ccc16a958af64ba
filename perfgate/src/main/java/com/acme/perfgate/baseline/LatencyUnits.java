package com.acme.perfgate.baseline;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unit-suffixed latency literals as printed by wrk and stored in baselines.
 */
public final class LatencyUnits {
    private static final Pattern LATENCY = Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)(ns|us|ms|s)$");

    private LatencyUnits() {
    }

    /**
     * Normalizes {@code 850ns}, {@code 12.5us}, {@code 1.23ms} or {@code 2s} to microseconds.
     * Whitespace is ignored and the unit is case-insensitive; {@code n/a}, blanks and unknown
     * units yield empty.
     */
    public static OptionalDouble toMicros(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String text = raw.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        if (text.isEmpty() || "n/a".equals(text)) {
            return OptionalDouble.empty();
        }
        Matcher m = LATENCY.matcher(text);
        if (!m.matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(m.group(1));
        double factor = switch (m.group(2)) {
            case "ns" -> 0.001d;
            case "us" -> 1d;
            case "ms" -> 1_000d;
            case "s" -> 1_000_000d;
            default -> throw new IllegalStateException("unreachable unit " + m.group(2));
        };
        return OptionalDouble.of(value * factor);
    }

    public static String formatMillis(double micros) {
        return String.format(Locale.ROOT, "%.2fms", micros / 1_000d);
    }
}
