package com.acme.perfgate.lifecycle;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Upstream simulator plus subject, started in order and ready to take load. Closing stops
 * the subject first, then the simulator.
 */
public final class ServiceStack implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ServiceStack.class.getName());
    public static final String CHAT_COMPLETIONS_PATH = "/v1/chat/completions";

    private final ManagedProcess upstream;
    private final ManagedProcess subject;
    private final URI endpoint;

    private ServiceStack(ManagedProcess upstream, ManagedProcess subject, URI endpoint) {
        this.upstream = upstream;
        this.subject = subject;
        this.endpoint = endpoint;
    }

    public static ServiceStack start(ServiceSettings settings,
                                     String label,
                                     String mockMode,
                                     UpstreamMode upstreamMode,
                                     String payload,
                                     Path scratchDir,
                                     SubjectConfigGuard configGuard,
                                     ReadinessProbe probe) {
        return start(settings, label, mockMode, upstreamMode, payload, scratchDir, configGuard, probe, process -> { });
    }

    /**
     * Simulator ready, config installed, subject ready, canary answered, warm-up sent.
     *
     * <p>{@code onStarted} sees each process right after it is spawned, before any readiness
     * wait, so an owner can stop it from another thread. If the callback throws, everything
     * started so far is stopped.</p>
     *
     * @param mockMode {@code stream} or {@code nonstream}
     * @throws LifecycleException when a process fails to start or become ready; anything
     *                            already started is stopped before this returns
     */
    public static ServiceStack start(ServiceSettings settings,
                                     String label,
                                     String mockMode,
                                     UpstreamMode upstreamMode,
                                     String payload,
                                     Path scratchDir,
                                     SubjectConfigGuard configGuard,
                                     ReadinessProbe probe,
                                     Consumer<ManagedProcess> onStarted) {
        ManagedProcess upstream = null;
        ManagedProcess subject = null;
        try {
            upstream = ManagedProcess.start(
                "upstream simulator",
                CorePinning.wrap(List.of(settings.upstreamBinary().toString()), settings.pinning().upstreamCore()),
                Map.of(
                    "MOCK_MODE", mockMode,
                    "MOCK_TRANSPORT", settings.upstreamTransport(),
                    "MOCK_SCENARIO", settings.mockScenario(),
                    "UPSTREAM_PORT", Integer.toString(settings.upstreamPort())
                ),
                null,
                scratchDir.resolve(label + "_upstream.log")
            );
            onStarted.accept(upstream);
            probe.awaitPort(settings.host(), settings.upstreamPort(), settings.startupTimeout(), upstream);

            configGuard.install(new SubjectConfigRenderer().render(settings.subjectProfile(upstreamMode)));

            subject = ManagedProcess.start(
                "subject",
                CorePinning.wrap(List.of(settings.subjectBinary().toAbsolutePath().toString()), settings.pinning().subjectCore()),
                Map.of(),
                settings.subjectWorkingDirectory(),
                scratchDir.resolve(label + "_proxy.log")
            );
            onStarted.accept(subject);
            probe.awaitPort(settings.host(), settings.proxyPort(), settings.startupTimeout(), subject);

            URI endpoint = URI.create("http://" + settings.host() + ":" + settings.proxyPort() + CHAT_COMPLETIONS_PATH);
            probe.awaitCanary(endpoint, payload, settings.startupTimeout(), subject);
            probe.warmUp(endpoint, payload, settings.warmupRequests());
            ManagedProcess startedSubject = subject;
            LOG.fine(() -> label + " stack ready subject_pid=" + startedSubject.pid());
            return new ServiceStack(upstream, subject, endpoint);
        } catch (IOException e) {
            stopQuietly(subject);
            stopQuietly(upstream);
            throw new LifecycleException("failed to install subject config: " + e.getMessage(), "", e);
        } catch (RuntimeException e) {
            stopQuietly(subject);
            stopQuietly(upstream);
            throw e;
        }
    }

    public ManagedProcess upstream() {
        return upstream;
    }

    public ManagedProcess subject() {
        return subject;
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public void close() {
        try {
            subject.close();
        } finally {
            upstream.close();
        }
    }

    private static void stopQuietly(ManagedProcess process) {
        if (process == null) {
            return;
        }
        try {
            process.close();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to stop " + process.name(), e);
        }
    }
}
