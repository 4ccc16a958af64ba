package com.acme.perfgate.lifecycle;

import com.acme.perfgate.model.GateSetupException;
import com.acme.perfgate.util.DurationSpec;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Process, port and load-profile settings for the managed service stack.
 */
public record ServiceSettings(
    Path subjectBinary,
    Path upstreamBinary,
    String loadGeneratorBinary,
    Path subjectConfigFile,
    Path lockFile,
    String host,
    int proxyPort,
    int upstreamPort,
    Duration startupTimeout,
    int warmupRequests,
    int loadGeneratorThreads,
    int connections,
    int workerThreads,
    DurationSpec loadGeneratorTimeout,
    String upstreamTransport,
    boolean requireUpstreamH2,
    String mockScenario,
    CorePinning pinning
) {
    static final Set<String> TRANSPORTS = Set.of("auto", "h2c");
    static final Set<String> MOCK_SCENARIOS = Set.of("text", "code", "full", "error");

    /**
     * Reads and validates the settings. The measurement profile is fixed to the standard
     * single-core shape (1 load thread, 8 connections, 1 subject worker); anything else is
     * rejected because results would not be comparable with the baseline.
     */
    public static ServiceSettings fromEnvironment(Map<String, String> env) {
        int wrkThreads = EnvVars.getIntClamped(env, GateEnvKeys.WRK_THREADS, GateDefaults.STANDARD_WRK_THREADS, 1, 1_024);
        int connections = EnvVars.getIntClamped(env, GateEnvKeys.CONNECTIONS, GateDefaults.STANDARD_CONNECTIONS, 1, 65_536);
        int workerThreads = EnvVars.getIntClamped(env, GateEnvKeys.WORKER_THREADS, GateDefaults.STANDARD_WORKER_THREADS, 1, 1_024);
        if (wrkThreads != GateDefaults.STANDARD_WRK_THREADS
            || connections != GateDefaults.STANDARD_CONNECTIONS
            || workerThreads != GateDefaults.STANDARD_WORKER_THREADS) {
            throw new GateSetupException("standard profile requires WRK_THREADS=" + GateDefaults.STANDARD_WRK_THREADS
                + " CONNECTIONS=" + GateDefaults.STANDARD_CONNECTIONS
                + " WORKER_THREADS=" + GateDefaults.STANDARD_WORKER_THREADS
                + ", got " + wrkThreads + "/" + connections + "/" + workerThreads);
        }

        String transport = EnvVars.getOrDefault(env, GateEnvKeys.UPSTREAM_TRANSPORT, GateDefaults.DEFAULT_UPSTREAM_TRANSPORT);
        if (!TRANSPORTS.contains(transport)) {
            throw new GateSetupException("unknown UPSTREAM_TRANSPORT: " + transport + " (use auto|h2c)");
        }
        String mockScenario = EnvVars.getOrDefault(env, GateEnvKeys.MOCK_SCENARIO, GateDefaults.DEFAULT_MOCK_SCENARIO);
        if (!MOCK_SCENARIOS.contains(mockScenario)) {
            throw new GateSetupException("unknown MOCK_SCENARIO: " + mockScenario + " (use text|code|full|error)");
        }
        DurationSpec wrkTimeout;
        try {
            wrkTimeout = DurationSpec.parse(EnvVars.getOrDefault(env, GateEnvKeys.WRK_TIMEOUT, GateDefaults.DEFAULT_WRK_TIMEOUT));
        } catch (IllegalArgumentException e) {
            throw new GateSetupException(e.getMessage(), e);
        }

        boolean tasksetAvailable = Executables.find(CorePinning.TASKSET, env).isPresent();
        CorePinning pinning = CorePinning.fromEnvironment(env, Runtime.getRuntime().availableProcessors(), tasksetAvailable);

        return new ServiceSettings(
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.SUBJECT_BIN, GateDefaults.DEFAULT_SUBJECT_BIN)),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.MOCK_UPSTREAM_BIN, GateDefaults.DEFAULT_MOCK_UPSTREAM_BIN)),
            EnvVars.getOrDefault(env, GateEnvKeys.WRK_BIN, GateDefaults.DEFAULT_WRK_BIN),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.SUBJECT_CONFIG_FILE, GateDefaults.DEFAULT_SUBJECT_CONFIG_FILE)),
            Path.of(EnvVars.getOrDefault(env, GateEnvKeys.LOCK_FILE, GateDefaults.DEFAULT_LOCK_FILE)),
            GateDefaults.LOOPBACK_HOST,
            EnvVars.getIntClamped(env, GateEnvKeys.PROXY_PORT, GateDefaults.DEFAULT_PROXY_PORT, 1, 65_535),
            EnvVars.getIntClamped(env, GateEnvKeys.UPSTREAM_PORT, GateDefaults.DEFAULT_UPSTREAM_PORT, 1, 65_535),
            Duration.ofSeconds(EnvVars.getIntClamped(env, GateEnvKeys.STARTUP_TIMEOUT_S, GateDefaults.DEFAULT_STARTUP_TIMEOUT_S, 1, 3_600)),
            EnvVars.getIntClamped(env, GateEnvKeys.WARMUP_REQUESTS, GateDefaults.DEFAULT_WARMUP_REQUESTS, 0, 1_000_000),
            wrkThreads,
            connections,
            workerThreads,
            wrkTimeout,
            transport,
            EnvVars.getBoolean(env, GateEnvKeys.REQUIRE_UPSTREAM_H2, true),
            mockScenario,
            pinning
        );
    }

    /**
     * @throws GateSetupException naming the first binary that is missing or not executable
     */
    public void verifyBinaries(Map<String, String> env) {
        if (!Executables.isExecutable(subjectBinary)) {
            throw new GateSetupException("subject binary not found or not executable: " + subjectBinary);
        }
        if (!Executables.isExecutable(upstreamBinary)) {
            throw new GateSetupException("upstream simulator binary not found or not executable: " + upstreamBinary);
        }
        if (Executables.find(loadGeneratorBinary, env).isEmpty()) {
            throw new GateSetupException("load generator not found: " + loadGeneratorBinary);
        }
    }

    public boolean h2cUpstream() {
        return "h2c".equals(upstreamTransport);
    }

    /**
     * The subject reads its config from its working directory.
     */
    public Path subjectWorkingDirectory() {
        Path parent = subjectConfigFile.toAbsolutePath().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }

    public SubjectProfile subjectProfile(UpstreamMode mode) {
        return new SubjectProfile(
            host,
            proxyPort,
            upstreamPort,
            h2cUpstream(),
            OptionalInt.of(workerThreads),
            GateDefaults.DEFAULT_RUNTIME_THREAD_STACK_SIZE_KB,
            mode
        );
    }

    public String describe() {
        return "wrk_threads=" + loadGeneratorThreads
            + " connections=" + connections
            + " worker_threads=" + workerThreads
            + " upstream_transport=" + upstreamTransport
            + " mock_scenario=" + mockScenario
            + " " + pinning.describe();
    }
}
