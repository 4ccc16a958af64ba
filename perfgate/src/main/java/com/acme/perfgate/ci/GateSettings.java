package com.acme.perfgate.ci;

import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one gate invocation reads from its environment.
 *
 * @param roundCommand external per-round command replacing the managed runner, if set
 * @param environment  the raw environment, passed on to the service layer
 */
public record GateSettings(
    GateConfiguration configuration,
    Path baselineFile,
    Path outputDir,
    Path lockFile,
    boolean includeAliasRemap,
    Optional<String> roundCommand,
    Map<String, String> environment
) {
    public GateSettings {
        environment = Map.copyOf(environment);
    }

    public static GateSettings fromEnvironment(Map<String, String> env) {
        String command = EnvVars.getOrDefault(env, GateEnvKeys.GATE_ROUND_COMMAND, "");
        return new GateSettings(
            GateConfiguration.fromEnvironment(env),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.BASELINE_FILE, GateDefaults.DEFAULT_BASELINE_FILE)),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.OUT_DIR, GateDefaults.DEFAULT_OUT_DIR)),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.LOCK_FILE, GateDefaults.DEFAULT_LOCK_FILE)),
            EnvVars.getBoolean(env, GateEnvKeys.INCLUDE_ALIAS_REMAP_SCENARIO, false),
            command.isEmpty() ? Optional.empty() : Optional.of(command),
            env
        );
    }
}
