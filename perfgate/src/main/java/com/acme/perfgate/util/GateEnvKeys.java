package com.acme.perfgate.util;

/**
 * Canonical environment variable names understood by the gate.
 */
public final class GateEnvKeys {
    // ---- Decision ----
    public static final String BASELINE_FILE = "BASELINE_FILE";
    public static final String ROUNDS = "ROUNDS";
    public static final String MIN_PASS_ROUNDS = "MIN_PASS_ROUNDS";
    public static final String MIN_PASS_RATIO = "MIN_PASS_RATIO";
    public static final String MAX_CV_PERCENT = "MAX_CV_PERCENT";
    public static final String MAX_EXTRA_ROUNDS = "MAX_EXTRA_ROUNDS";
    public static final String DURATION = "DURATION";
    public static final String RSS_LIMIT_KB = "RSS_LIMIT_KB";
    public static final String INCLUDE_ALIAS_REMAP_SCENARIO = "INCLUDE_ALIAS_REMAP_SCENARIO";
    public static final String OUT_DIR = "OUT_DIR";
    public static final String OUT_FILE = "OUT_FILE";

    // ---- Processes ----
    public static final String SUBJECT_BIN = "SUBJECT_BIN";
    public static final String MOCK_UPSTREAM_BIN = "MOCK_UPSTREAM_BIN";
    public static final String WRK_BIN = "WRK_BIN";
    public static final String SUBJECT_CONFIG_FILE = "SUBJECT_CONFIG_FILE";
    public static final String PROXY_PORT = "PROXY_PORT";
    public static final String UPSTREAM_PORT = "UPSTREAM_PORT";
    public static final String LOCK_FILE = "LOCK_FILE";
    public static final String STARTUP_TIMEOUT_S = "STARTUP_TIMEOUT_S";
    public static final String WARMUP_REQUESTS = "WARMUP_REQUESTS";
    public static final String WORKER_THREADS = "WORKER_THREADS";

    // ---- Load profile ----
    public static final String WRK_THREADS = "WRK_THREADS";
    public static final String CONNECTIONS = "CONNECTIONS";
    public static final String WRK_TIMEOUT = "WRK_TIMEOUT";
    public static final String UPSTREAM_TRANSPORT = "UPSTREAM_TRANSPORT";
    public static final String REQUIRE_UPSTREAM_H2 = "REQUIRE_UPSTREAM_H2";
    public static final String MOCK_SCENARIO = "MOCK_SCENARIO";
    public static final String GATE_ROUND_COMMAND = "GATE_ROUND_COMMAND";

    // ---- Core affinity ----
    public static final String AUTO_PIN_CORES = "AUTO_PIN_CORES";
    public static final String PIN_PROXY_CORE = "PIN_PROXY_CORE";
    public static final String PIN_UPSTREAM_CORE = "PIN_UPSTREAM_CORE";
    public static final String PIN_WRK_CORE = "PIN_WRK_CORE";

    // ---- Dual gate ----
    public static final String PINNED_BASELINE_FILE = "PINNED_BASELINE_FILE";
    public static final String UNPINNED_BASELINE_FILE = "UNPINNED_BASELINE_FILE";
    public static final String PINNED_ROUNDS = "PINNED_ROUNDS";
    public static final String UNPINNED_ROUNDS = "UNPINNED_ROUNDS";
    public static final String PINNED_DURATION = "PINNED_DURATION";
    public static final String UNPINNED_DURATION = "UNPINNED_DURATION";
    public static final String PINNED_AUTO_PIN_CORES = "PINNED_AUTO_PIN_CORES";
    public static final String UNPINNED_AUTO_PIN_CORES = "UNPINNED_AUTO_PIN_CORES";
    public static final String SKIP_UNPINNED_OBSERVE = "SKIP_UNPINNED_OBSERVE";

    private GateEnvKeys() {
    }
}
