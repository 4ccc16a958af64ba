package com.acme.perfgate.model;

public final class GateExitCodes {
    public static final int PASS = 0;
    public static final int REGRESSION = 1;
    public static final int SETUP_ERROR = 2;
    public static final int ROUND_ERROR = 3;

    private GateExitCodes() {
    }
}
