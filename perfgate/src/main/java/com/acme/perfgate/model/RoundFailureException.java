package com.acme.perfgate.model;

/**
 * Raised while a round executes. Partial round data is discarded by the caller.
 */
public class RoundFailureException extends GateException {
    private final String diagnostics;

    public RoundFailureException(String message) {
        this(message, "", null);
    }

    public RoundFailureException(String message, String diagnostics) {
        this(message, diagnostics, null);
    }

    public RoundFailureException(String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    /**
     * Captured process output that explains the failure, possibly empty.
     */
    public String diagnostics() {
        return diagnostics;
    }

    @Override
    public int exitCode() {
        return GateExitCodes.ROUND_ERROR;
    }
}
