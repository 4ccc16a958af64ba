package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.CleanupSupervisor;
import com.acme.perfgate.lifecycle.ServiceSettings;
import com.acme.perfgate.lifecycle.SubjectConfigGuard;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.process.ProcessResolver;
import com.acme.perfgate.process.ProcfsProcessTable;
import com.acme.perfgate.process.ProcfsStatsReader;
import com.acme.perfgate.process.ResourceSampler;
import com.acme.perfgate.process.WrapperAwareStrategy;
import com.acme.perfgate.transport.NettyHttpClient;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManagedRoundRunnerTest {
    @TempDir
    Path dir;

    private HttpServer subjectPort;
    private ServerSocket upstreamPort;
    private ExecutorService roundThread;

    @BeforeEach
    void openPorts() throws Exception {
        // The fake binaries only sleep; the ports they would serve are answered in-process.
        subjectPort = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        subjectPort.createContext("/", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                in.readAllBytes();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        subjectPort.start();
        upstreamPort = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
        roundThread = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void closePorts() throws Exception {
        roundThread.shutdownNow();
        subjectPort.stop(0);
        upstreamPort.close();
    }

    @Test
    void shouldStopSubjectAndSimulatorWhenCleanupRunsDuringLoad() throws Exception {
        Path subjectPidFile = dir.resolve("subject.pid");
        Path upstreamPidFile = dir.resolve("upstream.pid");
        ServiceSettings settings = ServiceSettings.fromEnvironment(Map.of(
            "SUBJECT_BIN", sleeper("fake_subject", subjectPidFile).toString(),
            "MOCK_UPSTREAM_BIN", sleeper("fake_upstream", upstreamPidFile).toString(),
            "SUBJECT_CONFIG_FILE", dir.resolve("config.yaml").toString(),
            "PROXY_PORT", Integer.toString(subjectPort.getAddress().getPort()),
            "UPSTREAM_PORT", Integer.toString(upstreamPort.getLocalPort()),
            "STARTUP_TIMEOUT_S", "10",
            "WARMUP_REQUESTS", "0",
            "REQUIRE_UPSTREAM_H2", "0"
        ));
        Path scratch = Files.createDirectories(dir.resolve("scratch"));
        BlockingLoad load = new BlockingLoad();

        CleanupSupervisor supervisor = new CleanupSupervisor();
        SubjectConfigGuard guard = supervisor.register("subject config",
            SubjectConfigGuard.open(settings.subjectConfigFile(), scratch));
        ManagedRoundRunner runner = supervisor.register("round runner", new ManagedRoundRunner(
            settings,
            ScenarioCatalog.standard(false),
            scratch,
            guard,
            new NettyHttpClient(),
            load,
            new ResourceSampler(new ProcfsStatsReader(), 100L),
            new ProcessResolver(new ProcfsProcessTable(), new WrapperAwareStrategy("fake_subject"))
        ));

        Future<?> round = roundThread.submit(() -> runner.runRound(1));
        assertTrue(load.loading.await(15, TimeUnit.SECONDS), "load phase not reached");
        long subjectPid = awaitPid(subjectPidFile);
        long upstreamPid = awaitPid(upstreamPidFile);
        assertTrue(isAlive(subjectPid));
        assertTrue(isAlive(upstreamPid));
        assertTrue(Files.exists(settings.subjectConfigFile()));

        supervisor.close();

        assertFalse(awaitAlive(subjectPid, false), "subject still running after cleanup");
        assertFalse(awaitAlive(upstreamPid, false), "simulator still running after cleanup");
        assertFalse(Files.exists(settings.subjectConfigFile()));
        ExecutionException e = assertThrows(ExecutionException.class, () -> round.get(10, TimeUnit.SECONDS));
        assertInstanceOf(RoundFailureException.class, e.getCause());
    }

    @Test
    void shouldRefuseNewScenariosAfterClose() throws Exception {
        ServiceSettings settings = ServiceSettings.fromEnvironment(Map.of(
            "SUBJECT_CONFIG_FILE", dir.resolve("config.yaml").toString()
        ));
        Path scratch = Files.createDirectories(dir.resolve("scratch"));
        try (SubjectConfigGuard guard = SubjectConfigGuard.open(settings.subjectConfigFile(), scratch)) {
            ManagedRoundRunner runner = new ManagedRoundRunner(
                settings,
                ScenarioCatalog.standard(false),
                scratch,
                guard,
                new NettyHttpClient(),
                new BlockingLoad(),
                new ResourceSampler(new ProcfsStatsReader(), 100L),
                new ProcessResolver(new ProcfsProcessTable(), new WrapperAwareStrategy("fake_subject"))
            );
            runner.close();

            RoundFailureException e = assertThrows(RoundFailureException.class, () -> runner.runRound(1));
            assertTrue(e.getMessage().contains("round runner closed"));
        }
    }

    private Path sleeper(String name, Path pidFile) throws IOException {
        Path script = dir.resolve(name);
        Files.writeString(script, "#!/bin/sh\necho $$ > '" + pidFile + "'\nexec sleep 300\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    private static long awaitPid(Path pidFile) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (Files.exists(pidFile)) {
                String text = Files.readString(pidFile, StandardCharsets.UTF_8).trim();
                if (!text.isEmpty()) {
                    return Long.parseLong(text);
                }
            }
            Thread.sleep(20);
        }
        throw new AssertionError("no pid written to " + pidFile);
    }

    private static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static boolean awaitAlive(long pid, boolean expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (isAlive(pid) != expected && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        return isAlive(pid);
    }

    private static final class BlockingLoad implements LoadGenerator {
        final CountDownLatch loading = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        @Override
        public LoadResult run(ScenarioWorkload workload, URI endpoint, Path scratchDir) {
            loading.countDown();
            try {
                released.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new RoundFailureException(workload.scenario() + " load stopped", "");
        }

        @Override
        public void close() {
            released.countDown();
        }
    }
}
