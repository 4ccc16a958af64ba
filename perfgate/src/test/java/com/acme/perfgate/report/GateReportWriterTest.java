package com.acme.perfgate.report;

import com.acme.perfgate.decision.DefaultRegressionChecker;
import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.model.ScenarioVerdict;
import com.acme.perfgate.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GateReportWriterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
    private static final Scenario FORWARD = Scenario.of("forward_nonstream_wrk");
    private static final Scenario STREAM = Scenario.of("forward_stream_wrk");

    @TempDir
    Path dir;

    @Test
    void shouldWriteTimestampedLatestAndSummaryFiles() throws Exception {
        GateReportWriter writer = new GateReportWriter(CLOCK);
        ReportFiles files = writer.write(dir.resolve("out"), context(), verdict(List.of()));

        assertEquals("zero_regression_gate_20260301_101530.md", files.timestamped().getFileName().toString());
        assertEquals(Files.readString(files.timestamped()), Files.readString(files.latest()));

        String report = Files.readString(files.latest());
        assertTrue(report.contains("- Date: 2026-03-01 10:15:30 UTC\n"));
        assertTrue(report.contains("- Profile: single-core `1x8`\n"));
        assertTrue(report.contains("- Min passing rounds per scenario: 7/9 (ratio=0.7778)\n"));
        assertTrue(report.contains("| `forward_nonstream_wrk` | 1000.00 | 1100.00 | 10.00% | 1.50 | 2000.00 | 1500.00 | -25.00% "));
        assertTrue(report.contains("| 9/9 |\n"));
        assertTrue(report.contains("## Verdict\n\n" + GateReportWriter.PASS_LINE + "\n"));
        assertFalse(report.contains("## Failing Scenarios"));

        JsonNode summary = JsonCodec.readTree(Files.readString(files.summaryJson()));
        assertTrue(summary.get("pass").asBoolean());
        assertEquals(2, summary.get("scenarios").size());
        assertEquals("forward_stream_wrk", summary.get("scenarios").get(1).get("scenario").asText());
    }

    @Test
    void shouldListFailingScenariosWithReasons() {
        GateReportWriter writer = new GateReportWriter(CLOCK);
        String report = writer.render(context(), verdict(List.of(
            DefaultRegressionChecker.THROUGHPUT_BELOW_BASELINE,
            DefaultRegressionChecker.PASS_ROUNDS_BELOW_QUORUM)), "2026-03-01 10:15:30 UTC");

        assertTrue(report.contains(GateReportWriter.FAIL_LINE));
        assertTrue(report.contains("## Failing Scenarios\n\n"
            + "- `forward_stream_wrk`: throughput_below_baseline, pass_rounds_below_quorum\n"));
        assertFalse(report.contains("- `forward_nonstream_wrk`:"));
    }

    private static GateReportContext context() {
        return new GateReportContext(Path.of("artifacts/perf/baseline.md"), GateReportContext.STANDARD_PROFILE,
            GateConfiguration.defaults());
    }

    private static GateVerdict verdict(List<String> streamReasons) {
        BaselineEntry baseline = new BaselineEntry(FORWARD, 1_000d, 2_000d, 50d, 8_000d);
        ScenarioVerdict forward = new ScenarioVerdict(FORWARD, baseline,
            new MedianMetrics(1_100d, 1_500d, 45d, 7_900d), 9, 9, 1.5d, List.of());
        ScenarioVerdict stream = new ScenarioVerdict(STREAM, new BaselineEntry(STREAM, 1_000d, 2_000d, 50d, 8_000d),
            new MedianMetrics(900d, 1_500d, 45d, 7_900d), streamReasons.isEmpty() ? 9 : 2, 9, 2.0d, streamReasons);
        return new GateVerdict(List.of(forward, stream), 9, 9, 7);
    }
}
