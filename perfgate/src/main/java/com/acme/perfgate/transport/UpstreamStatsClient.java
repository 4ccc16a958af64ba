package com.acme.perfgate.transport;

import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.handler.codec.http.HttpMethod;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Reads {@code GET /_mock/stats} from the upstream simulator.
 */
public final class UpstreamStatsClient {
    public static final String STATS_PATH = "/_mock/stats";

    private final NettyHttpClient http;
    private final int timeoutMs;

    public UpstreamStatsClient(NettyHttpClient http) {
        this(http, GateDefaults.STATS_TIMEOUT_MS);
    }

    public UpstreamStatsClient(NettyHttpClient http, int timeoutMs) {
        this.http = http;
        this.timeoutMs = timeoutMs;
    }

    /**
     * @param h2PriorKnowledge use cleartext HTTP/2 without upgrade; required when the
     *                         simulator only listens for h2c
     */
    public UpstreamProtocolStats fetch(String host, int port, boolean h2PriorKnowledge) {
        URI uri = URI.create("http://" + host + ":" + port + STATS_PATH);
        HttpReply reply;
        try {
            reply = h2PriorKnowledge
                ? http.getH2cPriorKnowledge(uri, timeoutMs)
                : http.send(HttpMethod.GET, uri, Map.of(), null, timeoutMs, timeoutMs);
        } catch (IOException e) {
            throw new RoundFailureException("failed to query upstream stats at " + uri + ": " + e.getMessage(), "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoundFailureException("interrupted while querying upstream stats at " + uri);
        }
        if (!reply.success()) {
            throw new RoundFailureException("upstream stats returned HTTP " + reply.status(), reply.body());
        }
        return parse(reply.body());
    }

    public static UpstreamProtocolStats parse(String json) {
        JsonNode root;
        try {
            root = JsonCodec.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RoundFailureException("upstream stats is not valid JSON", json, e);
        }
        if (root == null || !root.isObject()) {
            throw new RoundFailureException("upstream stats is not a JSON object", json);
        }
        return new UpstreamProtocolStats(
            root.path("mode").asText(""),
            root.path("scenario").asText(""),
            root.path("transport").asText(""),
            requiredCount(root, "h1", json),
            requiredCount(root, "h2", json),
            root.path("other").asLong(0L)
        );
    }

    private static long requiredCount(JsonNode root, String field, String json) {
        JsonNode node = root.get(field);
        if (node == null || !node.canConvertToLong()) {
            throw new RoundFailureException("upstream stats missing numeric field: " + field, json);
        }
        return node.asLong();
    }
}
