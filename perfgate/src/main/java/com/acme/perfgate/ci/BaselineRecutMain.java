package com.acme.perfgate.ci;

import com.acme.perfgate.baseline.BaselineStore;
import com.acme.perfgate.model.GateException;
import com.acme.perfgate.model.GateExitCodes;
import com.acme.perfgate.util.EnvVars;
import com.acme.perfgate.util.GateDefaults;
import com.acme.perfgate.util.GateEnvKeys;
import com.acme.perfgate.util.GateLogging;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Re-records the baseline. Output path from {@code OUT_FILE}, or the first argument.
 */
public final class BaselineRecutMain {
    private static final Logger LOG = Logger.getLogger(BaselineRecutMain.class.getName());

    private BaselineRecutMain() {
    }

    public static void main(String[] args) {
        GateLogging.install();
        System.exit(run(System.getenv(), args));
    }

    static int run(Map<String, String> env, String[] args) {
        Path outFile = args.length > 0 && !args[0].isBlank()
            ? Path.of(args[0])
            : Path.of(EnvVars.getOrDefault(env, GateEnvKeys.OUT_FILE, GateDefaults.DEFAULT_BASELINE_FILE));
        try {
            new BaselineRecut(GateSettings.fromEnvironment(env), RoundRunnerFactory.standard(), new BaselineStore(), Clock.systemUTC())
                .run(outFile);
            return GateExitCodes.PASS;
        } catch (GateException e) {
            return ZeroRegressionGateMain.reportFatal(e);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Baseline recut aborted", e);
            return GateExitCodes.ROUND_ERROR;
        }
    }
}
