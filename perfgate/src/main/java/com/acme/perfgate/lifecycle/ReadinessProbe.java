package com.acme.perfgate.lifecycle;

import com.acme.perfgate.transport.HttpReply;
import com.acme.perfgate.transport.NettyHttpClient;
import com.acme.perfgate.util.GateDefaults;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Bounded readiness waits: TCP port, then HTTP canary, then discarded warm-up traffic.
 */
public final class ReadinessProbe {
    private static final Logger LOG = Logger.getLogger(ReadinessProbe.class.getName());
    private static final int PORT_CONNECT_TIMEOUT_MS = 200;

    private final NettyHttpClient http;
    private final Map<String, String> requestHeaders;

    public ReadinessProbe(NettyHttpClient http) {
        this.http = http;
        this.requestHeaders = Map.of(
            HttpHeaderNames.AUTHORIZATION.toString(), "Bearer " + SubjectConfigRenderer.CLIENT_KEY,
            HttpHeaderNames.CONTENT_TYPE.toString(), HttpHeaderValues.APPLICATION_JSON.toString()
        );
    }

    /**
     * @throws LifecycleException when the port does not accept connections within
     *                            {@code timeout} or the owning process exits first
     */
    public void awaitPort(String host, int port, Duration timeout, ManagedProcess owner) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (!owner.isAlive()) {
                throw new LifecycleException(owner.name() + " exited before listening on " + host + ":" + port,
                    owner.diagnostics());
            }
            if (accepts(host, port)) {
                LOG.fine(() -> owner.name() + " listening on " + host + ":" + port);
                return;
            }
            pause(owner);
        }
        throw new LifecycleException(owner.name() + " did not become ready in " + timeout.toSeconds() + "s",
            owner.diagnostics());
    }

    /**
     * Posts {@code payload} until a response is 200 or 4xx. A 4xx still proves the subject
     * is routing requests.
     */
    public void awaitCanary(URI endpoint, String payload, Duration timeout, ManagedProcess owner) {
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        long deadline = System.nanoTime() + timeout.toNanos();
        int lastStatus = -1;
        while (System.nanoTime() < deadline) {
            if (!owner.isAlive()) {
                throw new LifecycleException(owner.name() + " exited during HTTP readiness check", owner.diagnostics());
            }
            try {
                HttpReply reply = http.send(HttpMethod.POST, endpoint, requestHeaders, body,
                    GateDefaults.CANARY_TIMEOUT_MS, GateDefaults.CANARY_TIMEOUT_MS);
                lastStatus = reply.status();
                if (reply.status() == 200 || reply.clientError()) {
                    return;
                }
            } catch (IOException e) {
                LOG.finest(() -> "Canary not ready: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LifecycleException("interrupted while waiting for " + owner.name(), owner.diagnostics(), e);
            }
            pause(owner);
        }
        throw new LifecycleException(owner.name() + " HTTP endpoint did not become ready in " + timeout.toSeconds()
            + "s (last status " + lastStatus + ")", owner.diagnostics());
    }

    /**
     * Sends {@code count} requests and discards the responses; failures are counted, not fatal.
     */
    public void warmUp(URI endpoint, String payload, int count) {
        if (count <= 0) {
            return;
        }
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        int failures = 0;
        for (int i = 0; i < count; i++) {
            try {
                http.send(HttpMethod.POST, endpoint, requestHeaders, body,
                    GateDefaults.WARMUP_CONNECT_TIMEOUT_MS, GateDefaults.WARMUP_MAX_TIME_MS);
            } catch (IOException e) {
                failures++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LifecycleException("interrupted during warm-up", "", e);
            }
        }
        int failed = failures;
        LOG.fine(() -> "Warm-up done requests=" + count + " failures=" + failed);
    }

    static boolean accepts(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), PORT_CONNECT_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static void pause(ManagedProcess owner) {
        try {
            Thread.sleep(GateDefaults.POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LifecycleException("interrupted while waiting for " + owner.name(), owner.diagnostics(), e);
        }
    }
}
