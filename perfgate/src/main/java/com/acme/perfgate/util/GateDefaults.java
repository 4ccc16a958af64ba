package com.acme.perfgate.util;

/**
 * Default decision, timing and profile constants for the gate.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class GateDefaults {

    // ---- Decision ----
    public static final int DEFAULT_ROUNDS = 9;
    public static final double DEFAULT_MIN_PASS_RATIO = 0.7778d;
    public static final double DEFAULT_MAX_CV_PERCENT = 5.0d;
    public static final int DEFAULT_MAX_EXTRA_ROUNDS = 3;
    public static final long DEFAULT_RSS_LIMIT_KB = 10_240L;
    public static final String DEFAULT_DURATION = "10s";
    public static final String DEFAULT_BASELINE_FILE = "artifacts/perf/baseline_single_core_1x8_pinned.md";
    public static final String DEFAULT_OUT_DIR = "artifacts/perf";

    // ---- Dual gate ----
    public static final int DEFAULT_PINNED_ROUNDS = 9;
    public static final int DEFAULT_UNPINNED_ROUNDS = 5;

    // ---- Processes ----
    public static final String DEFAULT_SUBJECT_BIN = "target/release/toolify";
    public static final String DEFAULT_MOCK_UPSTREAM_BIN = "target/release/mock_openai_upstream";
    public static final String DEFAULT_WRK_BIN = "wrk";
    public static final String DEFAULT_SUBJECT_CONFIG_FILE = "config.yaml";
    public static final String DEFAULT_LOCK_FILE = "/tmp/perfgate_bench_global.lock";
    public static final String LOOPBACK_HOST = "127.0.0.1";
    public static final int DEFAULT_PROXY_PORT = 18_080;
    public static final int DEFAULT_UPSTREAM_PORT = 19_001;
    public static final int DEFAULT_STARTUP_TIMEOUT_S = 10;
    public static final int DEFAULT_WARMUP_REQUESTS = 200;
    public static final int DEFAULT_RUNTIME_THREAD_STACK_SIZE_KB = 512;
    public static final long PROCESS_STOP_GRACE_MS = 3_000L;

    // ---- Standard single-core profile ----
    public static final int STANDARD_WRK_THREADS = 1;
    public static final int STANDARD_CONNECTIONS = 8;
    public static final int STANDARD_WORKER_THREADS = 1;
    public static final String DEFAULT_WRK_TIMEOUT = "2s";
    public static final String DEFAULT_UPSTREAM_TRANSPORT = "h2c";
    public static final String DEFAULT_MOCK_SCENARIO = "text";

    // ---- Probing (millis) ----
    public static final long POLL_INTERVAL_MS = 50L;
    public static final int CANARY_TIMEOUT_MS = 1_000;
    public static final int WARMUP_CONNECT_TIMEOUT_MS = 2_000;
    public static final int WARMUP_MAX_TIME_MS = 2_000;
    public static final int STATS_TIMEOUT_MS = 2_000;
    public static final long LOAD_GENERATOR_SLACK_MS = 15_000L;

    // ---- Sampling ----
    public static final long SAMPLER_INTERVAL_MS = 50L;
    public static final long DEFAULT_CLOCK_TICKS_PER_SECOND = 100L;
    public static final int MAX_RESOLVE_DEPTH = 8;

    // ---- Diagnostics ----
    public static final int CAPTURED_LOG_LINES = 120;
    public static final int HTTP_RESPONSE_LIMIT = 1024 * 1024;

    private GateDefaults() {
    }
}
