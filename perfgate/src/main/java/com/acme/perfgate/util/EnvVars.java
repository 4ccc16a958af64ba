package com.acme.perfgate.util;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Every accessor has an overload taking an explicit map so configuration can be
 * built from a synthetic environment in tests and in the dual gate.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    /**
     * Accepts the shell-style {@code 0|1} switches as well as {@code true|false}.
     */
    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        String trimmed = v.trim();
        if ("1".equals(trimmed)) return true;
        if ("0".equals(trimmed)) return false;
        return Boolean.parseBoolean(trimmed);
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static double getDoubleClamped(Map<String, String> env,
                                          String name,
                                          double defaultValue,
                                          double min,
                                          double max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Optional integer: blank means "not set". A malformed value is rejected instead of
     * silently ignored because these knobs change the verdict.
     */
    public static OptionalInt getOptionalInt(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed integer for " + name + ": " + raw, e);
        }
    }
}
