package com.acme.perfgate.lifecycle;

import com.acme.perfgate.model.GateSetupException;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateEnvKeys;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * CPU core assignment for subject, simulator and load generator. A command with an
 * assigned core is launched through {@code taskset -c <core>}.
 */
public record CorePinning(OptionalInt subjectCore, OptionalInt upstreamCore, OptionalInt loadGeneratorCore) {
    private static final Logger LOG = Logger.getLogger(CorePinning.class.getName());
    public static final String TASKSET = "taskset";

    public static CorePinning none() {
        return new CorePinning(OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty());
    }

    /**
     * Explicit {@code PIN_*_CORE} values win. With auto-pinning on, unset slots become
     * subject 0, simulator 1, load generator 2 (or 0 with fewer than three CPUs); auto-pinning
     * is skipped below two CPUs or without {@code taskset}.
     */
    public static CorePinning fromEnvironment(Map<String, String> env, int cpuCount, boolean tasksetAvailable) {
        OptionalInt subject;
        OptionalInt upstream;
        OptionalInt loadGenerator;
        try {
            subject = EnvVars.getOptionalInt(env, GateEnvKeys.PIN_PROXY_CORE);
            upstream = EnvVars.getOptionalInt(env, GateEnvKeys.PIN_UPSTREAM_CORE);
            loadGenerator = EnvVars.getOptionalInt(env, GateEnvKeys.PIN_WRK_CORE);
        } catch (IllegalArgumentException e) {
            throw new GateSetupException(e.getMessage(), e);
        }
        if (EnvVars.getBoolean(env, GateEnvKeys.AUTO_PIN_CORES, false) && tasksetAvailable && cpuCount >= 2) {
            if (subject.isEmpty()) {
                subject = OptionalInt.of(0);
            }
            if (upstream.isEmpty()) {
                upstream = OptionalInt.of(1);
            }
            if (loadGenerator.isEmpty()) {
                loadGenerator = OptionalInt.of(cpuCount >= 3 ? 2 : 0);
            }
        }
        CorePinning pinning = new CorePinning(subject, upstream, loadGenerator);
        if (!tasksetAvailable && pinning.any()) {
            LOG.warning("Core pinning requested but taskset is not available; running unpinned");
            return none();
        }
        return pinning;
    }

    public boolean any() {
        return subjectCore.isPresent() || upstreamCore.isPresent() || loadGeneratorCore.isPresent();
    }

    public static List<String> wrap(List<String> command, OptionalInt core) {
        if (core.isEmpty()) {
            return List.copyOf(command);
        }
        List<String> wrapped = new ArrayList<>(command.size() + 3);
        wrapped.add(TASKSET);
        wrapped.add("-c");
        wrapped.add(Integer.toString(core.getAsInt()));
        wrapped.addAll(command);
        return List.copyOf(wrapped);
    }

    public String describe() {
        return "pin_proxy_core=" + render(subjectCore)
            + " pin_upstream_core=" + render(upstreamCore)
            + " pin_wrk_core=" + render(loadGeneratorCore);
    }

    private static String render(OptionalInt core) {
        return core.isPresent() ? Integer.toString(core.getAsInt()) : "none";
    }
}
