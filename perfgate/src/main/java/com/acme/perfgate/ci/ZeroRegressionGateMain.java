package com.acme.perfgate.ci;

import com.acme.perfgate.model.GateException;
import com.acme.perfgate.model.GateExitCodes;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.util.GateEnvKeys;
import com.acme.perfgate.util.GateLogging;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the single gate. Optional positional overrides: baseline file, rounds.
 * Exit status: 0 pass, 1 regression, 2 setup error, 3 round error.
 */
public final class ZeroRegressionGateMain {
    private static final Logger LOG = Logger.getLogger(ZeroRegressionGateMain.class.getName());

    private ZeroRegressionGateMain() {
    }

    public static void main(String[] args) {
        GateLogging.install();
        System.exit(run(System.getenv(), args));
    }

    static int run(Map<String, String> env, String[] args) {
        try {
            GateRunResult result = new ZeroRegressionGate(GateSettings.fromEnvironment(withOverrides(env, args))).run();
            System.out.println(Files.readString(result.report().latest(), StandardCharsets.UTF_8));
            return result.exitCode();
        } catch (GateException e) {
            return reportFatal(e);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Gate aborted", e);
            return GateExitCodes.ROUND_ERROR;
        }
    }

    static Map<String, String> withOverrides(Map<String, String> env, String[] args) {
        Map<String, String> merged = new HashMap<>(env);
        if (args.length > 0 && !args[0].isBlank()) {
            merged.put(GateEnvKeys.BASELINE_FILE, args[0]);
        }
        if (args.length > 1 && !args[1].isBlank()) {
            merged.put(GateEnvKeys.ROUNDS, args[1]);
        }
        return merged;
    }

    static int reportFatal(GateException e) {
        LOG.severe(e.getMessage());
        String diagnostics = e instanceof RoundFailureException rf ? rf.diagnostics() : "";
        if (!diagnostics.isEmpty()) {
            LOG.severe("captured output:\n" + diagnostics);
        }
        return e.exitCode();
    }
}
