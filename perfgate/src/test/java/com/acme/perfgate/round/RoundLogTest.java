package com.acme.perfgate.round;

import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.process.ResourceUsage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RoundLogTest {
    private static final Scenario FORWARD = ScenarioCatalog.FORWARD_NONSTREAM;
    private static final Scenario STREAM = ScenarioCatalog.FORWARD_STREAM;

    @Test
    void shouldRenderLinesItCanReadBack() {
        String load = RoundLog.loadLine(FORWARD, new LoadResult(120_345L, 12_034.5d, 1_230d, "1.23ms", "612.34us"));
        String resource = RoundLog.resourceLine(FORWARD, new ResourceUsage(97.414d, 8_123L, 974L, 10d));
        assertEquals("forward_nonstream_wrk wrk_requests=120345 wrk_rps=12034.50 wrk_p99=1.23ms wrk_latency_avg=612.34us", load);
        assertEquals("forward_nonstream_wrk cpu_pct=97.41 peak_rss_kb=8123", resource);

        RoundLog log = new RoundLog();
        log.acceptAll("noise before\n" + load + "\nmore noise\n" + resource + "\n");
        MetricSample sample = log.samples(3, List.of(FORWARD)).get(FORWARD);
        assertEquals(3, sample.roundIndex());
        assertEquals(12_034.5d, sample.requestsPerSecond(), 1e-9);
        assertEquals(1_230d, sample.p99LatencyUs(), 1e-9);
        assertEquals(97.41d, sample.cpuPercent(), 1e-9);
        assertEquals(8_123L, sample.residentMemoryKb());
    }

    @Test
    void shouldLetLaterLinesOverwriteEarlierOnes() {
        RoundLog log = new RoundLog();
        log.accept("forward_nonstream_wrk wrk_requests=1 wrk_rps=100.00 wrk_p99=1ms wrk_latency_avg=n/a");
        log.accept("forward_nonstream_wrk wrk_requests=1 wrk_rps=200.00 wrk_p99=2ms wrk_latency_avg=n/a");
        log.accept("forward_nonstream_wrk cpu_pct=10.00 peak_rss_kb=100");
        Map<Scenario, MetricSample> samples = log.samples(1, List.of(FORWARD));
        assertEquals(200d, samples.get(FORWARD).requestsPerSecond(), 1e-9);
        assertEquals(2_000d, samples.get(FORWARD).p99LatencyUs(), 1e-9);
    }

    @Test
    void shouldRejectRoundWhenAnyScenarioIsIncomplete() {
        RoundLog log = new RoundLog();
        log.accept("forward_nonstream_wrk wrk_requests=1 wrk_rps=100.00 wrk_p99=1ms wrk_latency_avg=n/a");
        log.accept("forward_nonstream_wrk cpu_pct=10.00 peak_rss_kb=100");
        log.accept("forward_stream_wrk wrk_requests=1 wrk_rps=100.00 wrk_p99=1ms wrk_latency_avg=n/a");

        RoundFailureException e = assertThrows(RoundFailureException.class,
            () -> log.samples(2, List.of(FORWARD, STREAM)));
        assertEquals("round 2 missing metrics for scenario: forward_stream_wrk", e.getMessage());
    }
}
