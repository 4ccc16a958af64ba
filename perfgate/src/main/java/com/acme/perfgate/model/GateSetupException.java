package com.acme.perfgate.model;

/**
 * Raised before any round runs: missing binaries, lock contention, bad configuration,
 * missing baseline scenario.
 */
public class GateSetupException extends GateException {
    public GateSetupException(String message) {
        super(message);
    }

    public GateSetupException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return GateExitCodes.SETUP_ERROR;
    }
}
