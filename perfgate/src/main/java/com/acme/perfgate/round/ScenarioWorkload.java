package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.UpstreamMode;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request shape and upstream wiring of one scenario.
 *
 * @param functionCallInjection attach a tool definition so the subject takes its
 *                              function-call injection path
 */
public record ScenarioWorkload(
    Scenario scenario,
    boolean streaming,
    boolean functionCallInjection,
    UpstreamMode upstreamMode,
    String model
) {
    public ScenarioWorkload {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(upstreamMode, "upstreamMode");
        Objects.requireNonNull(model, "model");
    }

    /**
     * Simulator response mode: {@code stream} or {@code nonstream}.
     */
    public String mockMode() {
        return streaming ? "stream" : "nonstream";
    }

    /**
     * Chat-completions request body sent by the canary, warm-up and load generator.
     */
    public String payload() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", "hi")));
        if (functionCallInjection) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", "get_weather");
            function.put("description", "Get the current weather for a city");
            function.put("parameters", Map.of(
                "type", "object",
                "properties", Map.of("city", Map.of("type", "string")),
                "required", List.of("city")
            ));
            body.put("tools", List.of(Map.of("type", "function", "function", function)));
        }
        if (streaming) {
            body.put("stream", true);
        }
        try {
            return JsonCodec.writeString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode payload for " + scenario, e);
        }
    }
}
