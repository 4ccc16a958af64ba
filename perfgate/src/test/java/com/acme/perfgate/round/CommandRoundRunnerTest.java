package com.acme.perfgate.round;

import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.util.DurationSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandRoundRunnerTest {
    private static final Scenario FORWARD = ScenarioCatalog.FORWARD_NONSTREAM;

    @TempDir
    Path dir;

    @Test
    void shouldReadMetricsPrintedByCommand() throws Exception {
        String command = "echo \"starting round $ROUND for $DURATION\"; "
            + "echo \"forward_nonstream_wrk wrk_requests=10 wrk_rps=1000.50 wrk_p99=1.5ms wrk_latency_avg=n/a\"; "
            + "echo \"forward_nonstream_wrk cpu_pct=4$ROUND.00 peak_rss_kb=8000\"";
        try (CommandRoundRunner runner = new CommandRoundRunner(command, List.of(FORWARD), DurationSpec.parse("2s"), dir)) {
            Map<Scenario, MetricSample> samples = runner.runRound(2);

            MetricSample sample = samples.get(FORWARD);
            assertEquals(1_000.5d, sample.requestsPerSecond(), 1e-9);
            assertEquals(1_500d, sample.p99LatencyUs(), 1e-9);
            assertEquals(42d, sample.cpuPercent(), 1e-9);
            assertTrue(Files.readString(dir.resolve("round_2.log")).contains("starting round 2 for 2s"));
        }
    }

    @Test
    void shouldFailRoundOnNonZeroExit() {
        CommandRoundRunner runner = new CommandRoundRunner("echo boom; exit 3", List.of(FORWARD), DurationSpec.parse("1s"), dir);
        RoundFailureException e = assertThrows(RoundFailureException.class, () -> runner.runRound(1));
        assertEquals("round command exited with status 3", e.getMessage());
        assertTrue(e.diagnostics().contains("boom"));
    }

    @Test
    void shouldFailRoundWhenMetricsAreIncomplete() {
        CommandRoundRunner runner = new CommandRoundRunner(
            "echo \"forward_nonstream_wrk cpu_pct=1.00 peak_rss_kb=1\"", List.of(FORWARD), DurationSpec.parse("1s"), dir);
        RoundFailureException e = assertThrows(RoundFailureException.class, () -> runner.runRound(1));
        assertEquals("round 1 missing metrics for scenario: forward_nonstream_wrk", e.getMessage());
    }
}
