package com.acme.perfgate.report;

import com.acme.perfgate.model.GateConfiguration;

import java.nio.file.Path;

/**
 * Run settings echoed in the report header.
 *
 * @param profile human label of the load profile, e.g. {@code single-core `1x8`}
 */
public record GateReportContext(Path baselineFile, String profile, GateConfiguration configuration) {
    public static final String STANDARD_PROFILE = "single-core `1x8`";
}
