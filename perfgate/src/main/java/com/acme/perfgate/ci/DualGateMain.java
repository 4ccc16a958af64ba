package com.acme.perfgate.ci;

import com.acme.perfgate.model.GateException;
import com.acme.perfgate.model.GateExitCodes;
import com.acme.perfgate.util.GateLogging;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class DualGateMain {
    private static final Logger LOG = Logger.getLogger(DualGateMain.class.getName());

    private DualGateMain() {
    }

    public static void main(String[] args) {
        GateLogging.install();
        int code;
        try {
            DualGateCoordinator.DualGateResult result = new DualGateCoordinator(System.getenv()).run();
            System.out.println(Files.readString(result.summary(), StandardCharsets.UTF_8));
            code = result.exitCode();
        } catch (GateException e) {
            code = ZeroRegressionGateMain.reportFatal(e);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Dual gate aborted", e);
            code = GateExitCodes.ROUND_ERROR;
        }
        System.exit(code);
    }
}
