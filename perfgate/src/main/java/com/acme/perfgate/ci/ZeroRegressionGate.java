package com.acme.perfgate.ci;

import com.acme.perfgate.baseline.BaselineDocument;
import com.acme.perfgate.baseline.BaselineStore;
import com.acme.perfgate.decision.RegressionDecisionEngine;
import com.acme.perfgate.lifecycle.CleanupSupervisor;
import com.acme.perfgate.lifecycle.GateLock;
import com.acme.perfgate.lifecycle.TempWorkspace;
import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.model.GateSetupException;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.model.ScenarioVerdict;
import com.acme.perfgate.report.GateReportContext;
import com.acme.perfgate.report.GateReportWriter;
import com.acme.perfgate.report.ReportFiles;
import com.acme.perfgate.round.RoundRunner;
import com.acme.perfgate.round.ScenarioCatalog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * One gate invocation: lock, baseline, rounds until the decision engine has no pending
 * round, verdict, report. Every resource is released through a {@link CleanupSupervisor},
 * including on JVM shutdown.
 */
public final class ZeroRegressionGate {
    private static final Logger LOG = Logger.getLogger(ZeroRegressionGate.class.getName());
    public static final String RESULT_SNAPSHOT = "zero_regression_gate_result_latest.md";

    private final GateSettings settings;
    private final RoundRunnerFactory runnerFactory;
    private final BaselineStore baselineStore;
    private final GateReportWriter reportWriter;

    public ZeroRegressionGate(GateSettings settings) {
        this(settings, RoundRunnerFactory.standard(), new BaselineStore(), new GateReportWriter());
    }

    public ZeroRegressionGate(GateSettings settings,
                              RoundRunnerFactory runnerFactory,
                              BaselineStore baselineStore,
                              GateReportWriter reportWriter) {
        this.settings = settings;
        this.runnerFactory = runnerFactory;
        this.baselineStore = baselineStore;
        this.reportWriter = reportWriter;
    }

    /**
     * @throws GateSetupException    before any round on lock contention, missing baseline
     *                               scenario or bad service setup
     * @throws RoundFailureException when a round cannot produce a complete sample set
     */
    public GateRunResult run() throws Exception {
        GateConfiguration config = settings.configuration();
        ScenarioCatalog catalog = ScenarioCatalog.standard(settings.includeAliasRemap());
        try (CleanupSupervisor supervisor = CleanupSupervisor.installed()) {
            supervisor.register("lock", GateLock.acquire(settings.lockFile()));

            BaselineDocument baseline = baselineStore.load(settings.baselineFile());
            Map<Scenario, BaselineEntry> baselines = baseline.require(catalog.scenarios());
            RegressionDecisionEngine engine = new RegressionDecisionEngine(config, catalog.scenarios(), baselines);

            TempWorkspace workspace = supervisor.register("workspace", TempWorkspace.create("perfgate-"));
            RoundRunner runner = supervisor.register("round runner",
                runnerFactory.open(settings, catalog, workspace, supervisor));

            LOG.info(() -> "[gate] start baseline=" + settings.baselineFile()
                + " rounds=" + config.plannedRounds()
                + " duration=" + config.durationPerRound()
                + " scenarios=" + catalog.scenarios());
            while (engine.hasPendingRounds()) {
                int round = engine.executedRounds() + 1;
                LOG.info(() -> "[gate] round " + round + "/" + engine.targetRounds());
                engine.recordRound(round, runner.runRound(round));
                if (engine.maybeExtend()) {
                    LOG.info(() -> "[gate] detected high RPS jitter (CV > " + config.maxCvPercent()
                        + "%), extending to " + engine.targetRounds() + " rounds");
                }
            }

            GateVerdict verdict = engine.verdict();
            logVerdict(verdict);
            ReportFiles report = reportWriter.write(
                settings.outputDir(),
                new GateReportContext(settings.baselineFile(), GateReportContext.STANDARD_PROFILE, config),
                verdict
            );
            Path snapshot = writeSnapshot(verdict);
            LOG.info(() -> "[gate] report=" + report.timestamped() + " latest=" + report.latest()
                + " pass=" + verdict.overallPass());
            return new GateRunResult(verdict, report, snapshot);
        }
    }

    private Path writeSnapshot(GateVerdict verdict) throws IOException {
        List<String> metadata = List.of(
            "Profile: " + GateReportContext.STANDARD_PROFILE,
            "Rounds: " + verdict.roundsExecuted(),
            "Duration per scenario: " + settings.configuration().durationPerRound(),
            "Source: gate run against `" + settings.baselineFile() + "`"
        );
        return baselineStore.write(
            settings.outputDir().resolve(RESULT_SNAPSHOT),
            BaselineStore.snapshotOf(verdict, "Gate Result Snapshot", metadata)
        );
    }

    private static void logVerdict(GateVerdict verdict) {
        for (ScenarioVerdict sv : verdict.scenarios()) {
            LOG.info(() -> "[gate] scenario=" + sv.scenario()
                + " pass=" + sv.overallPass()
                + " pass_rounds=" + sv.passRoundCount() + "/" + sv.roundsExecuted()
                + " required=" + verdict.requiredPassRounds()
                + " rps_cv=" + String.format(Locale.ROOT, "%.2f", sv.rpsCvPercent())
                + (sv.overallPass() ? "" : " reasons=" + sv.failureReasons()));
        }
    }
}
