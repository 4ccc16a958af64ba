package com.acme.perfgate.lifecycle;

import com.acme.perfgate.model.RoundFailureException;

/**
 * A managed process failed to start or did not become ready in time. Carries the head of
 * the process output.
 */
public class LifecycleException extends RoundFailureException {
    public LifecycleException(String message, String diagnostics) {
        super(message, diagnostics);
    }

    public LifecycleException(String message, String diagnostics, Throwable cause) {
        super(message, diagnostics, cause);
    }
}
