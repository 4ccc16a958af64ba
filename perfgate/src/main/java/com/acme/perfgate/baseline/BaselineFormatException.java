package com.acme.perfgate.baseline;

import com.acme.perfgate.model.GateSetupException;

/**
 * The baseline snapshot is unreadable or does not cover the active scenario set.
 */
public final class BaselineFormatException extends GateSetupException {
    public BaselineFormatException(String message) {
        super(message);
    }

    public BaselineFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
