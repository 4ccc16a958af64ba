package com.acme.perfgate.util;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * A wrk-style duration literal ({@code 500ms}, {@code 10s}, {@code 2m}, {@code 1h}).
 *
 * <p>The raw text is kept because it is handed verbatim to the load generator and echoed
 * into reports; a bare number means seconds, as wrk treats it.</p>
 */
public record DurationSpec(String raw, Duration duration) {

    public DurationSpec {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive: " + raw);
        }
    }

    public static DurationSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration is blank");
        }
        String text = raw.trim().toLowerCase(Locale.ROOT);
        int split = 0;
        while (split < text.length() && (Character.isDigit(text.charAt(split)) || text.charAt(split) == '.')) {
            split++;
        }
        if (split == 0) {
            throw new IllegalArgumentException("duration has no numeric part: " + raw);
        }
        double value;
        try {
            value = Double.parseDouble(text.substring(0, split));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed duration: " + raw, e);
        }
        String unit = text.substring(split);
        long millis = switch (unit) {
            case "ms" -> Math.round(value);
            case "", "s" -> Math.round(value * 1_000d);
            case "m" -> Math.round(value * 60_000d);
            case "h" -> Math.round(value * 3_600_000d);
            default -> throw new IllegalArgumentException("unsupported duration unit '" + unit + "' in " + raw);
        };
        return new DurationSpec(raw.trim(), Duration.ofMillis(millis));
    }

    @Override
    public String toString() {
        return raw;
    }
}
