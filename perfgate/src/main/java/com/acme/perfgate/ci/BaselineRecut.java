package com.acme.perfgate.ci;

import com.acme.perfgate.baseline.BaselineDocument;
import com.acme.perfgate.baseline.BaselineRow;
import com.acme.perfgate.baseline.BaselineStore;
import com.acme.perfgate.decision.MetricHistory;
import com.acme.perfgate.lifecycle.CleanupSupervisor;
import com.acme.perfgate.lifecycle.GateLock;
import com.acme.perfgate.lifecycle.TempWorkspace;
import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.report.GateReportContext;
import com.acme.perfgate.round.RoundRunner;
import com.acme.perfgate.round.ScenarioCatalog;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Measures the planned number of rounds with no baseline to compare against and writes
 * the per-scenario medians as a new baseline.
 */
public final class BaselineRecut {
    private static final Logger LOG = Logger.getLogger(BaselineRecut.class.getName());
    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final GateSettings settings;
    private final RoundRunnerFactory runnerFactory;
    private final BaselineStore store;
    private final Clock clock;

    public BaselineRecut(GateSettings settings, RoundRunnerFactory runnerFactory, BaselineStore store, Clock clock) {
        this.settings = settings;
        this.runnerFactory = runnerFactory;
        this.store = store;
        this.clock = clock;
    }

    public BaselineDocument run(Path outFile) throws Exception {
        ScenarioCatalog catalog = ScenarioCatalog.standard(settings.includeAliasRemap());
        int rounds = settings.configuration().plannedRounds();
        MetricHistory history = new MetricHistory(catalog.scenarios());
        try (CleanupSupervisor supervisor = CleanupSupervisor.installed()) {
            supervisor.register("lock", GateLock.acquire(settings.lockFile()));
            TempWorkspace workspace = supervisor.register("workspace", TempWorkspace.create("perfgate-recut-"));
            RoundRunner runner = supervisor.register("round runner",
                runnerFactory.open(settings, catalog, workspace, supervisor));
            for (int round = 1; round <= rounds; round++) {
                int current = round;
                LOG.info(() -> "[baseline] round " + current + "/" + rounds);
                history.append(round, runner.runRound(round));
            }
        }

        List<BaselineRow> rows = new ArrayList<>();
        for (Scenario scenario : catalog.scenarios()) {
            MedianMetrics m = history.medians(scenario);
            rows.add(new BaselineRow(
                new BaselineEntry(scenario, m.requestsPerSecond(), m.p99LatencyUs(), m.cpuPercent(), m.residentMemoryKb()),
                "n/a",
                "median of " + rounds + " rounds"
            ));
        }
        BaselineDocument document = new BaselineDocument(BaselineDocument.DEFAULT_TITLE, metadata(rounds), rows);
        store.write(outFile, document);
        LOG.info(() -> "[baseline] wrote " + outFile);
        return document;
    }

    private List<String> metadata(int rounds) {
        var env = settings.environment();
        return List.of(
            "Date: " + HEADER_DATE.format(clock.instant()),
            "Profile: " + GateReportContext.STANDARD_PROFILE,
            "Rounds: " + rounds,
            "Duration per scenario: " + settings.configuration().durationPerRound(),
            "Upstream transport: " + EnvVars.getOrDefault(env, GateEnvKeys.UPSTREAM_TRANSPORT, GateDefaults.DEFAULT_UPSTREAM_TRANSPORT),
            "Require upstream h2: " + (EnvVars.getBoolean(env, GateEnvKeys.REQUIRE_UPSTREAM_H2, true) ? "1" : "0"),
            "Mock scenario: " + EnvVars.getOrDefault(env, GateEnvKeys.MOCK_SCENARIO, GateDefaults.DEFAULT_MOCK_SCENARIO)
        );
    }
}
