package com.acme.perfgate.ci;

import com.acme.perfgate.model.GateExitCodes;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.report.ReportFiles;

import java.nio.file.Path;

public record GateRunResult(GateVerdict verdict, ReportFiles report, Path resultSnapshot) {
    public int exitCode() {
        return verdict.overallPass() ? GateExitCodes.PASS : GateExitCodes.REGRESSION;
    }
}
