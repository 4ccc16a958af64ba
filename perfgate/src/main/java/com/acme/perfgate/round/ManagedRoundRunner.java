package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.LifecycleException;
import com.acme.perfgate.lifecycle.ManagedProcess;
import com.acme.perfgate.lifecycle.ReadinessProbe;
import com.acme.perfgate.lifecycle.ServiceSettings;
import com.acme.perfgate.lifecycle.ServiceStack;
import com.acme.perfgate.lifecycle.SubjectConfigGuard;
import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.process.ClockTicks;
import com.acme.perfgate.process.ProcessResolver;
import com.acme.perfgate.process.ProcfsProcessTable;
import com.acme.perfgate.process.ProcfsStatsReader;
import com.acme.perfgate.process.ResourceSampler;
import com.acme.perfgate.process.ResourceUsage;
import com.acme.perfgate.process.WrapperAwareStrategy;
import com.acme.perfgate.transport.NettyHttpClient;
import com.acme.perfgate.transport.UpstreamStatsClient;
import com.acme.perfgate.util.DurationSpec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every scenario of a round against freshly started processes:
 * stack up, resolve subject pid, sample while loading, check protocol purity, stack down.
 *
 * <p>{@link #close()} may run from a shutdown hook while a scenario is in flight; it stops
 * the load generator and every process of the current stack before returning.</p>
 */
public final class ManagedRoundRunner implements RoundRunner {
    private static final Logger LOG = Logger.getLogger(ManagedRoundRunner.class.getName());
    // Linux truncates /proc/<pid>/comm to 15 bytes.
    private static final int COMM_NAME_LIMIT = 15;

    private final ServiceSettings settings;
    private final ScenarioCatalog catalog;
    private final Path scratchDir;
    private final SubjectConfigGuard configGuard;
    private final NettyHttpClient http;
    private final ReadinessProbe probe;
    private final UpstreamStatsClient statsClient;
    private final LoadGenerator loadGenerator;
    private final ResourceSampler sampler;
    private final ProcessResolver resolver;
    // newest first, so the subject is stopped before the simulator
    private final ConcurrentLinkedDeque<ManagedProcess> liveProcesses = new ConcurrentLinkedDeque<>();
    private volatile boolean closed;

    public ManagedRoundRunner(ServiceSettings settings,
                              ScenarioCatalog catalog,
                              Path scratchDir,
                              SubjectConfigGuard configGuard,
                              NettyHttpClient http,
                              LoadGenerator loadGenerator,
                              ResourceSampler sampler,
                              ProcessResolver resolver) {
        this.settings = settings;
        this.catalog = catalog;
        this.scratchDir = scratchDir;
        this.configGuard = configGuard;
        this.http = http;
        this.probe = new ReadinessProbe(http);
        this.statsClient = new UpstreamStatsClient(http);
        this.loadGenerator = loadGenerator;
        this.sampler = sampler;
        this.resolver = resolver;
    }

    public static ManagedRoundRunner create(ServiceSettings settings,
                                            ScenarioCatalog catalog,
                                            DurationSpec duration,
                                            Path scratchDir,
                                            SubjectConfigGuard configGuard) {
        String binaryName = settings.subjectBinary().getFileName().toString();
        String commName = binaryName.length() > COMM_NAME_LIMIT ? binaryName.substring(0, COMM_NAME_LIMIT) : binaryName;
        return new ManagedRoundRunner(
            settings,
            catalog,
            scratchDir,
            configGuard,
            new NettyHttpClient(),
            new WrkLoadGenerator(settings, duration),
            new ResourceSampler(new ProcfsStatsReader(), ClockTicks.detect()),
            new ProcessResolver(new ProcfsProcessTable(), new WrapperAwareStrategy(commName))
        );
    }

    @Override
    public Map<Scenario, MetricSample> runRound(int roundIndex) {
        RoundLog roundLog = new RoundLog();
        List<String> lines = new ArrayList<>();
        for (ScenarioWorkload workload : catalog.workloads()) {
            for (String line : runScenario(workload)) {
                LOG.info(line);
                roundLog.accept(line);
                lines.add(line);
            }
        }
        Path logFile = scratchDir.resolve("round_" + roundIndex + ".log");
        try {
            Files.write(logFile, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to write round log " + logFile, e);
        }
        return roundLog.samples(roundIndex, catalog.scenarios());
    }

    private List<String> runScenario(ScenarioWorkload workload) {
        Scenario scenario = workload.scenario();
        String payload = workload.payload();
        if (closed) {
            throw new RoundFailureException(scenario + " not started: round runner closed", "");
        }
        try (ServiceStack stack = ServiceStack.start(
            settings, scenario.name(), workload.mockMode(), workload.upstreamMode(), payload, scratchDir, configGuard, probe,
            this::track)) {
            long statsPid = resolver.resolve(stack.subject().pid());
            LoadResult load;
            ResourceUsage usage;
            try (ResourceSampler.Session session = sampler.start(statsPid)) {
                load = loadGenerator.run(workload, stack.endpoint(), scratchDir);
                usage = session.stop();
            }
            if (settings.requireUpstreamH2()) {
                ProtocolPurityCheck.requirePureH2(
                    scenario,
                    statsClient.fetch(settings.host(), settings.upstreamPort(), settings.h2cUpstream()),
                    stack.upstream()::diagnostics
                );
            }
            return List.of(RoundLog.loadLine(scenario, load), RoundLog.resourceLine(scenario, usage));
        } finally {
            liveProcesses.clear();
        }
    }

    private void track(ManagedProcess process) {
        liveProcesses.push(process);
        if (closed) {
            throw new LifecycleException("round runner closed while starting " + process.name(), "");
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            loadGenerator.close();
            stopLiveProcesses();
            sampler.close();
        } finally {
            http.close();
        }
    }

    private void stopLiveProcesses() {
        ManagedProcess process;
        while ((process = liveProcesses.poll()) != null) {
            try {
                process.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to stop " + process.name(), e);
            }
        }
    }
}
