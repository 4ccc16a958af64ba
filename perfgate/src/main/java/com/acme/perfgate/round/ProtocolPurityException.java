package com.acme.perfgate.round;

import com.acme.perfgate.model.RoundFailureException;

/**
 * The subject reached the simulator over something other than pure HTTP/2.
 */
public class ProtocolPurityException extends RoundFailureException {
    public ProtocolPurityException(String message, String diagnostics) {
        super(message, diagnostics);
    }
}
