package com.acme.perfgate.ci;

import com.acme.perfgate.baseline.BaselineFormatException;
import com.acme.perfgate.baseline.BaselineStore;
import com.acme.perfgate.lifecycle.GateLock;
import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.model.GateExitCodes;
import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.report.GateReportWriter;
import com.acme.perfgate.round.RoundRunner;
import com.acme.perfgate.round.ScenarioCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZeroRegressionGateTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void shouldPassAndWriteReportsWhenEveryScenarioHolds() throws Exception {
        GateFixtures.writeBaseline(dir.resolve("baseline.md"), GateFixtures.STANDARD);
        FakeRunner runner = new FakeRunner(round -> GateFixtures.round(round, 1_100d, GateFixtures.STANDARD));

        GateRunResult result = gate(runner).run();

        assertEquals(GateExitCodes.PASS, result.exitCode());
        assertEquals(9, result.verdict().roundsExecuted());
        assertEquals(9, runner.rounds.get());
        assertTrue(runner.closed.get());
        assertTrue(Files.readString(result.report().latest()).contains(GateReportWriter.PASS_LINE));
        assertTrue(Files.exists(result.report().summaryJson()));
        assertEquals(dir.resolve("out").resolve(ZeroRegressionGate.RESULT_SNAPSHOT), result.resultSnapshot());
        assertTrue(Files.readString(result.resultSnapshot()).contains("| `forward_nonstream_wrk` | 1100.00 | 1.50ms |"));
        try (GateLock lock = GateLock.acquire(dir.resolve("gate.lock"))) {
            assertEquals(dir.resolve("gate.lock"), lock.file());
        }
    }

    @Test
    void shouldFailWhenOneScenarioRegresses() throws Exception {
        GateFixtures.writeBaseline(dir.resolve("baseline.md"), GateFixtures.STANDARD);
        FakeRunner runner = new FakeRunner(round -> {
            Map<Scenario, MetricSample> samples = GateFixtures.round(round, 1_100d, GateFixtures.STANDARD);
            Scenario slow = ScenarioCatalog.FC_INJECT_STREAM;
            samples.put(slow, new MetricSample(slow, round, 900d, 1_500d, 45d, 8_000L));
            return samples;
        });

        GateRunResult result = gate(runner).run();

        assertEquals(GateExitCodes.REGRESSION, result.exitCode());
        String report = Files.readString(result.report().latest());
        assertTrue(report.contains(GateReportWriter.FAIL_LINE));
        assertTrue(report.contains("- `fc_inject_stream_wrk`: throughput_below_baseline, pass_rounds_below_quorum"));
    }

    @Test
    void shouldExtendRunWhileThroughputJitters() throws Exception {
        GateFixtures.writeBaseline(dir.resolve("baseline.md"), GateFixtures.STANDARD);
        FakeRunner runner = new FakeRunner(
            round -> GateFixtures.round(round, round % 2 == 0 ? 1_600d : 1_100d, GateFixtures.STANDARD));

        GateRunResult result = gate(runner).run();

        assertEquals(12, result.verdict().roundsExecuted());
        assertEquals(10, result.verdict().requiredPassRounds());
        assertTrue(Files.readString(result.report().latest()).contains("- Rounds executed: 12\n"));
    }

    @Test
    void shouldAbortOnIncompleteRoundWithoutReport() throws Exception {
        GateFixtures.writeBaseline(dir.resolve("baseline.md"), GateFixtures.STANDARD);
        FakeRunner runner = new FakeRunner(round -> GateFixtures.round(round, 1_100d,
            round == 3 ? GateFixtures.STANDARD.subList(0, 3) : GateFixtures.STANDARD));

        RoundFailureException e = assertThrows(RoundFailureException.class, () -> gate(runner).run());

        assertEquals("round 3 missing metrics for scenario: fc_inject_stream_wrk", e.getMessage());
        assertEquals(GateExitCodes.ROUND_ERROR, e.exitCode());
        assertTrue(runner.closed.get());
        assertFalse(Files.exists(dir.resolve("out").resolve(GateReportWriter.LATEST_REPORT)));
    }

    @Test
    void shouldRejectBaselineWithoutActiveScenarioBeforeAnyRound() throws Exception {
        GateFixtures.writeBaseline(dir.resolve("baseline.md"), GateFixtures.STANDARD.subList(0, 3));
        AtomicBoolean opened = new AtomicBoolean(false);
        ZeroRegressionGate gate = new ZeroRegressionGate(settings(),
            (settings, catalog, workspace, supervisor) -> {
                opened.set(true);
                return round -> Map.of();
            },
            new BaselineStore(), new GateReportWriter(CLOCK));

        BaselineFormatException e = assertThrows(BaselineFormatException.class, gate::run);

        assertEquals("baseline missing scenario: fc_inject_stream_wrk", e.getMessage());
        assertEquals(GateExitCodes.SETUP_ERROR, e.exitCode());
        assertFalse(opened.get());
    }

    private ZeroRegressionGate gate(RoundRunner runner) {
        return new ZeroRegressionGate(settings(), (settings, catalog, workspace, supervisor) -> runner,
            new BaselineStore(), new GateReportWriter(CLOCK));
    }

    private GateSettings settings() {
        return new GateSettings(
            GateConfiguration.defaults(),
            dir.resolve("baseline.md"),
            dir.resolve("out"),
            dir.resolve("gate.lock"),
            false,
            Optional.empty(),
            Map.of()
        );
    }

    private static final class FakeRunner implements RoundRunner {
        final AtomicInteger rounds = new AtomicInteger();
        final AtomicBoolean closed = new AtomicBoolean(false);
        private final IntFunction<Map<Scenario, MetricSample>> source;

        FakeRunner(IntFunction<Map<Scenario, MetricSample>> source) {
            this.source = source;
        }

        @Override
        public Map<Scenario, MetricSample> runRound(int roundIndex) {
            rounds.incrementAndGet();
            return source.apply(roundIndex);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
