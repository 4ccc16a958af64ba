package com.acme.perfgate.model;

/**
 * Root of the fatal conditions that abort a gate invocation. A regression verdict is
 * never reported through this hierarchy.
 */
public abstract class GateException extends RuntimeException {
    protected GateException(String message) {
        super(message);
    }

    protected GateException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int exitCode();
}
