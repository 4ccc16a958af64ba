package com.acme.perfgate.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes {@code zero_regression_dual_gate_latest.md}, the combined view of the pinned and
 * unpinned gate runs.
 */
public final class DualGateSummaryWriter {
    public static final String SUMMARY_FILE = "zero_regression_dual_gate_latest.md";
    public static final String PINNED_LATEST = "zero_regression_gate_pinned_latest.md";
    public static final String UNPINNED_LATEST = "zero_regression_gate_unpinned_latest.md";

    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    /**
     * Outcome of one leg as the summary presents it.
     */
    public enum LegOutcome {
        PASS,
        FAIL,
        ERROR,
        SKIPPED
    }

    public record Leg(Path baselineFile, int rounds, String duration, LegOutcome outcome, String detail) {
    }

    private final Clock clock;

    public DualGateSummaryWriter() {
        this(Clock.systemUTC());
    }

    public DualGateSummaryWriter(Clock clock) {
        this.clock = clock;
    }

    public Path write(Path outputDir, Leg pinned, Leg unpinned) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(SUMMARY_FILE);
        Files.writeString(file, render(outputDir, pinned, unpinned), StandardCharsets.UTF_8);
        return file;
    }

    String render(Path outputDir, Leg pinned, Leg unpinned) {
        StringBuilder md = new StringBuilder(1024);
        md.append("# Dual Perf Gate\n\n");
        md.append("- Date: ").append(HEADER_DATE.format(clock.instant())).append('\n');
        md.append("- Pinned baseline: `").append(pinned.baselineFile()).append("`\n");
        md.append("- Unpinned baseline: `").append(unpinned.baselineFile()).append("`\n");
        md.append("- Pinned rounds/duration: ").append(pinned.rounds()).append(" / ").append(pinned.duration()).append('\n');
        md.append("- Unpinned rounds/duration: ").append(unpinned.rounds()).append(" / ").append(unpinned.duration()).append('\n');
        md.append("- Pinned output: `").append(outputDir.resolve(PINNED_LATEST)).append("`\n");
        md.append("- Pinned verdict: ").append(pinned.outcome()).append(" (blocking)").append('\n');
        if (unpinned.outcome() == LegOutcome.SKIPPED) {
            md.append("- Unpinned output: skipped\n");
        } else if (unpinned.outcome() == LegOutcome.ERROR) {
            md.append("- Unpinned output: none (gate did not finish)\n");
            md.append("- Unpinned verdict: ERROR (observe-only, non-blocking): ").append(unpinned.detail()).append('\n');
        } else {
            md.append("- Unpinned output: `").append(outputDir.resolve(UNPINNED_LATEST)).append("`\n");
            md.append(unpinned.outcome() == LegOutcome.PASS
                ? "- Unpinned verdict: PASS (observe)\n"
                : "- Unpinned verdict: FAIL (observe-only, non-blocking)\n");
        }
        md.append("\n## Contract\n\n");
        md.append("- Pinned gate is blocking.\n");
        md.append("- Unpinned gate is observational and never blocks merge.\n");
        return md.toString();
    }
}
