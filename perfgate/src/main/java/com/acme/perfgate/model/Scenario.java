package com.acme.perfgate.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque identifier of one reproducible workload shape. The name doubles as the
 * leading token of round-log lines, so it is restricted to {@code [a-z_]+}.
 */
public record Scenario(String name) {
    private static final Pattern NAME = Pattern.compile("[a-z_]+");

    public Scenario {
        Objects.requireNonNull(name, "name");
        if (!isValidName(name)) {
            throw new IllegalArgumentException("scenario name must match [a-z_]+: '" + name + "'");
        }
    }

    public static boolean isValidName(String name) {
        return NAME.matcher(name).matches();
    }

    public static Scenario of(String name) {
        return new Scenario(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
