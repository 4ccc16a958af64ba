package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.Scenario;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BaselineParserTest {
    private static final String SNAPSHOT = String.join("\n",
        "# Single-core 1x8 baseline",
        "",
        "- Date: 2026-03-01 10:00:00 UTC",
        "- Profile: single-core `1x8`",
        "",
        "## Environment",
        "",
        "| `forward_nonstream_wrk` | 1 | 2 | 3 | 4 | 5 | not a result |",
        "",
        "## Results",
        "",
        "| Scenario | RPS | p99 | Avg Latency | CPU | RSS | Notes |",
        "|---|---:|---:|---:|---:|---:|---|",
        "| `forward_nonstream_wrk` | 12,345.67 | 1.23ms | 640.00us | 45.50% | 8,192KB | median of 9 rounds |",
        "| `forward_stream_wrk` | 9000 | 850us | n/a | 40% | 7000 KB | |",
        "| `fc_inject_nonstream_wrk` | 8000 | 2ms | n/a | 40 | 7000KB | cpu without percent |",
        "| `fc_inject_stream_wrk` | 8000 | 2ms | n/a | 40% | 7000 | rss without unit |",
        "",
        "## Notes",
        "",
        "| `alias_remap_stream_wrk` | 1 | 1ms | n/a | 1% | 1KB | after results |",
        "");

    private final BaselineParser parser = new BaselineParser();

    @Test
    void shouldReadOnlyWellFormedRowsInsideResults() {
        BaselineDocument doc = parser.parse(SNAPSHOT);

        assertEquals("Single-core 1x8 baseline", doc.title());
        assertEquals(List.of("Date: 2026-03-01 10:00:00 UTC", "Profile: single-core `1x8`"), doc.metadata());
        assertEquals(2, doc.rows().size());

        Map<Scenario, BaselineEntry> entries = doc.entries();
        BaselineEntry forward = entries.get(Scenario.of("forward_nonstream_wrk"));
        assertEquals(12_345.67d, forward.requestsPerSecond(), 1e-9);
        assertEquals(1_230d, forward.p99LatencyUs(), 1e-9);
        assertEquals(45.5d, forward.cpuPercent(), 1e-9);
        assertEquals(8_192d, forward.residentMemoryKb(), 1e-9);
        assertEquals("640.00us", doc.rows().get(0).avgLatency());
        assertEquals("median of 9 rounds", doc.rows().get(0).notes());

        BaselineEntry stream = entries.get(Scenario.of("forward_stream_wrk"));
        assertEquals(850d, stream.p99LatencyUs(), 1e-9);
        assertEquals(7_000d, stream.residentMemoryKb(), 1e-9);
    }

    @Test
    void shouldSkipRowsOfScenariosOutsideTheGatedSet() {
        String text = String.join("\n",
            "## Results",
            "",
            "| Scenario | RPS | p99 | Avg Latency | CPU | RSS | Notes |",
            "|---|---:|---:|---:|---:|---:|---|",
            "| `forward_forwarding_h2` | 2000 | 1.1ms | n/a | 40% | 7000KB | other suite |",
            "| `forward_nonstream_wrk` | 1000 | 2ms | n/a | 50% | 9000KB | |",
            "");

        BaselineDocument doc = parser.parse(text);

        assertEquals(1, doc.rows().size());
        Map<Scenario, BaselineEntry> entries = doc.require(List.of(Scenario.of("forward_nonstream_wrk")));
        assertEquals(1_000d, entries.get(Scenario.of("forward_nonstream_wrk")).requestsPerSecond(), 1e-9);
    }

    @Test
    void shouldReportMissingScenarioAsFormatError() {
        BaselineDocument doc = parser.parse(SNAPSHOT);
        BaselineFormatException e = assertThrows(BaselineFormatException.class,
            () -> doc.require(List.of(Scenario.of("forward_nonstream_wrk"), Scenario.of("alias_remap_stream_wrk"))));
        assertEquals("baseline missing scenario: alias_remap_stream_wrk", e.getMessage());
    }

    @Test
    void shouldRejectUnparseableLatency() {
        String text = "## Results\n| `forward_nonstream_wrk` | 100 | fast | n/a | 1% | 1KB | |\n";
        BaselineFormatException e = assertThrows(BaselineFormatException.class, () -> parser.parse(text));
        assertTrue(e.getMessage().contains("p99"));
    }

    @Test
    void shouldRejectUnparseableThroughput() {
        String text = "## Results\n| `forward_nonstream_wrk` | lots | 1ms | n/a | 1% | 1KB | |\n";
        assertThrows(BaselineFormatException.class, () -> parser.parse(text));
    }

    @Test
    void shouldKeepLastRowForDuplicateScenario() {
        String text = String.join("\n",
            "## Results",
            "| `forward_nonstream_wrk` | 100 | 1ms | n/a | 1% | 1KB | first |",
            "| `forward_nonstream_wrk` | 200 | 1ms | n/a | 1% | 1KB | second |");
        BaselineDocument doc = parser.parse(text);
        assertEquals(200d, doc.entries().get(Scenario.of("forward_nonstream_wrk")).requestsPerSecond());
        assertEquals(BaselineDocument.DEFAULT_TITLE, doc.title());
    }

    @Test
    void shouldRenderParsedSnapshotToIdenticalBytes() {
        BaselineWriter writer = new BaselineWriter();
        String rendered = writer.render(parser.parse(SNAPSHOT));

        assertTrue(rendered.startsWith("# Single-core 1x8 baseline\n\n- Date: 2026-03-01 10:00:00 UTC\n"));
        assertTrue(rendered.contains(
            "| `forward_nonstream_wrk` | 12345.67 | 1.23ms | 640.00us | 45.50% | 8192KB | median of 9 rounds |\n"));
        assertEquals(rendered, writer.render(parser.parse(rendered)));
    }
}
