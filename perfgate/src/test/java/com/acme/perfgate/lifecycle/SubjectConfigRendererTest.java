package com.acme.perfgate.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubjectConfigRendererTest {
    private final SubjectConfigRenderer renderer = new SubjectConfigRenderer();

    @Test
    void shouldRenderSingleUpstreamWithPinnedRuntime() {
        String yaml = renderer.render(new SubjectProfile("127.0.0.1", 18080, 19001, true,
            OptionalInt.of(1), 512, UpstreamMode.SINGLE));

        assertTrue(yaml.startsWith("server:\n  port: 18080\n  host: \"127.0.0.1\"\n"));
        assertTrue(yaml.contains("  http_force_h2c_upstream: true\n"));
        assertTrue(yaml.contains("  runtime_worker_threads: 1\n"));
        assertTrue(yaml.contains("  runtime_thread_stack_size_kb: 512\n"));
        assertTrue(yaml.contains("    base_url: \"http://127.0.0.1:19001/v1\"\n"));
        assertTrue(yaml.contains("      - \"m1\"\n"));
        assertTrue(yaml.contains("    - \"sk-client\"\n"));
        assertFalse(yaml.contains("smart:"));
    }

    @Test
    void shouldRenderAliasGroupWithTwoServices() {
        String yaml = renderer.render(new SubjectProfile("127.0.0.1", 18080, 19001, false,
            OptionalInt.empty(), 512, UpstreamMode.ALIAS_GROUP));

        assertTrue(yaml.contains("  runtime_worker_threads: null\n"));
        assertTrue(yaml.contains("  http_force_h2c_upstream: false\n"));
        assertTrue(yaml.contains("  - name: \"mock-openai-a\"\n"));
        assertTrue(yaml.contains("      - \"smart:m1\"\n"));
        assertTrue(yaml.contains("      - \"smart:m2\"\n"));
    }
}
