package com.acme.perfgate.ci;

import com.acme.perfgate.report.DualGateSummaryWriter;
import com.acme.perfgate.report.DualGateSummaryWriter.Leg;
import com.acme.perfgate.report.DualGateSummaryWriter.LegOutcome;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the pinned gate (blocking) and then the unpinned gate (observational). Only the
 * pinned verdict decides the exit status; an unpinned failure or crash is recorded in the
 * summary and nothing more.
 */
public final class DualGateCoordinator {
    private static final Logger LOG = Logger.getLogger(DualGateCoordinator.class.getName());

    @FunctionalInterface
    public interface GateLauncher {
        GateRunResult launch(GateSettings settings) throws Exception;
    }

    public record DualGateResult(GateRunResult pinned, LegOutcome unpinned, Path summary) {
        public int exitCode() {
            return pinned.exitCode();
        }
    }

    private final Map<String, String> env;
    private final GateLauncher launcher;
    private final DualGateSummaryWriter summaryWriter;

    public DualGateCoordinator(Map<String, String> env) {
        this(env, settings -> new ZeroRegressionGate(settings).run(), new DualGateSummaryWriter());
    }

    public DualGateCoordinator(Map<String, String> env, GateLauncher launcher, DualGateSummaryWriter summaryWriter) {
        this.env = Map.copyOf(env);
        this.launcher = launcher;
        this.summaryWriter = summaryWriter;
    }

    /**
     * @throws Exception whatever aborts the pinned gate; the unpinned gate never throws
     */
    public DualGateResult run() throws Exception {
        Path outDir = Path.of(EnvVars.getOrDefault(env, GateEnvKeys.OUT_DIR, GateDefaults.DEFAULT_OUT_DIR));
        String pinnedBaseline = EnvVars.getOrDefault(env, GateEnvKeys.PINNED_BASELINE_FILE,
            EnvVars.getOrDefault(env, GateEnvKeys.BASELINE_FILE, GateDefaults.DEFAULT_BASELINE_FILE));
        String unpinnedBaseline = EnvVars.getOrDefault(env, GateEnvKeys.UNPINNED_BASELINE_FILE, pinnedBaseline);
        int pinnedRounds = EnvVars.getIntClamped(env, GateEnvKeys.PINNED_ROUNDS, GateDefaults.DEFAULT_PINNED_ROUNDS, 1, 1_000);
        int unpinnedRounds = EnvVars.getIntClamped(env, GateEnvKeys.UNPINNED_ROUNDS, GateDefaults.DEFAULT_UNPINNED_ROUNDS, 1, 1_000);
        String pinnedDuration = EnvVars.getOrDefault(env, GateEnvKeys.PINNED_DURATION, GateDefaults.DEFAULT_DURATION);
        String unpinnedDuration = EnvVars.getOrDefault(env, GateEnvKeys.UNPINNED_DURATION, pinnedDuration);
        boolean skipUnpinned = EnvVars.getBoolean(env, GateEnvKeys.SKIP_UNPINNED_OBSERVE, false);

        LOG.info("[dual-gate] pinned hard gate start");
        GateRunResult pinned = launcher.launch(GateSettings.fromEnvironment(legEnvironment(
            pinnedBaseline, pinnedRounds, pinnedDuration,
            EnvVars.getOrDefault(env, GateEnvKeys.PINNED_AUTO_PIN_CORES, "1"))));
        copy(pinned.report().latest(), outDir.resolve(DualGateSummaryWriter.PINNED_LATEST));

        LegOutcome unpinnedOutcome = LegOutcome.SKIPPED;
        String unpinnedDetail = "";
        // a report from an earlier invocation must not pass for this run's
        Files.deleteIfExists(outDir.resolve(DualGateSummaryWriter.UNPINNED_LATEST));
        if (!skipUnpinned) {
            LOG.info("[dual-gate] unpinned observe gate start (non-blocking)");
            try {
                GateRunResult unpinned = launcher.launch(GateSettings.fromEnvironment(legEnvironment(
                    unpinnedBaseline, unpinnedRounds, unpinnedDuration,
                    EnvVars.getOrDefault(env, GateEnvKeys.UNPINNED_AUTO_PIN_CORES, "0"))));
                copy(unpinned.report().latest(), outDir.resolve(DualGateSummaryWriter.UNPINNED_LATEST));
                unpinnedOutcome = unpinned.verdict().overallPass() ? LegOutcome.PASS : LegOutcome.FAIL;
            } catch (Exception e) {
                LOG.log(Level.WARNING, "[dual-gate] unpinned observe gate failed (non-blocking)", e);
                unpinnedOutcome = LegOutcome.ERROR;
                unpinnedDetail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }
        }

        Path summary = summaryWriter.write(outDir,
            new Leg(Path.of(pinnedBaseline), pinnedRounds, pinnedDuration,
                pinned.verdict().overallPass() ? LegOutcome.PASS : LegOutcome.FAIL, ""),
            new Leg(Path.of(unpinnedBaseline), unpinnedRounds, unpinnedDuration, unpinnedOutcome, unpinnedDetail));
        LegOutcome observed = unpinnedOutcome;
        LOG.info(() -> "[dual-gate] pinned_pass=" + pinned.verdict().overallPass() + " unpinned=" + observed
            + " summary=" + summary);
        return new DualGateResult(pinned, unpinnedOutcome, summary);
    }

    private Map<String, String> legEnvironment(String baseline, int rounds, String duration, String autoPin) {
        Map<String, String> leg = new HashMap<>(env);
        leg.put(GateEnvKeys.BASELINE_FILE, baseline);
        leg.put(GateEnvKeys.ROUNDS, Integer.toString(rounds));
        leg.put(GateEnvKeys.DURATION, duration);
        leg.put(GateEnvKeys.AUTO_PIN_CORES, autoPin);
        return leg;
    }

    private static void copy(Path from, Path to) throws IOException {
        Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
}
