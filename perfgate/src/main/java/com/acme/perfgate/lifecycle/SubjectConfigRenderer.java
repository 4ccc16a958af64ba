package com.acme.perfgate.lifecycle;

/**
 * Renders the subject's YAML config. Client key {@code sk-client} and upstream key
 * {@code sk-upstream} are the fixed credentials the load scripts use.
 */
public final class SubjectConfigRenderer {
    public static final String CLIENT_KEY = "sk-client";
    static final String UPSTREAM_KEY = "sk-upstream";
    static final int RUNTIME_MAX_BLOCKING_THREADS = 8;
    static final int REQUEST_TIMEOUT_S = 30;

    public String render(SubjectProfile profile) {
        StringBuilder yaml = new StringBuilder(1024);
        yaml.append("server:\n")
            .append("  port: ").append(profile.proxyPort()).append('\n')
            .append("  host: \"").append(profile.host()).append("\"\n")
            .append("  timeout: ").append(REQUEST_TIMEOUT_S).append('\n')
            .append("  http_use_env_proxy: false\n")
            .append("  http_force_h2c_upstream: ").append(profile.forceH2cUpstream()).append('\n');
        if (profile.workerThreads().isPresent()) {
            yaml.append("  runtime_worker_threads: ").append(profile.workerThreads().getAsInt()).append('\n')
                .append("  runtime_max_blocking_threads: ").append(RUNTIME_MAX_BLOCKING_THREADS).append('\n')
                .append("  runtime_thread_stack_size_kb: ").append(profile.threadStackSizeKb()).append('\n');
        } else {
            yaml.append("  runtime_worker_threads: null\n")
                .append("  runtime_max_blocking_threads: null\n")
                .append("  runtime_thread_stack_size_kb: null\n");
        }

        String baseUrl = "http://" + profile.host() + ":" + profile.upstreamPort() + "/v1";
        yaml.append("upstream_services:\n");
        if (profile.upstreamMode() == UpstreamMode.ALIAS_GROUP) {
            appendService(yaml, "mock-openai-a", baseUrl, "smart:m1", true);
            appendService(yaml, "mock-openai-b", baseUrl, "smart:m2", false);
        } else {
            appendService(yaml, "mock-openai", baseUrl, "m1", true);
        }

        yaml.append("client_authentication:\n")
            .append("  allowed_keys:\n")
            .append("    - \"").append(CLIENT_KEY).append("\"\n")
            .append("features:\n")
            .append("  enable_function_calling: true\n")
            .append("  log_level: \"DISABLED\"\n")
            .append("  convert_developer_to_system: true\n")
            .append("  enable_fc_error_retry: false\n")
            .append("  fc_error_retry_max_attempts: 3\n");
        return yaml.toString();
    }

    private static void appendService(StringBuilder yaml, String name, String baseUrl, String model, boolean isDefault) {
        yaml.append("  - name: \"").append(name).append("\"\n")
            .append("    provider: \"openai\"\n")
            .append("    base_url: \"").append(baseUrl).append("\"\n")
            .append("    api_key: \"").append(UPSTREAM_KEY).append("\"\n")
            .append("    models:\n")
            .append("      - \"").append(model).append("\"\n")
            .append("    is_default: ").append(isDefault).append('\n');
    }
}
