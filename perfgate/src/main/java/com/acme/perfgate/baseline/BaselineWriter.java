package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;

import java.util.Locale;

/**
 * Renders the canonical baseline table. Parsing a rendered document and rendering it again
 * yields the same bytes.
 */
public final class BaselineWriter {
    public static final String TABLE_HEADER = "| Scenario | RPS | p99 | Avg Latency | CPU | RSS | Notes |";
    public static final String TABLE_ALIGN = "|---|---:|---:|---:|---:|---:|---|";

    public String render(BaselineDocument document) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("# ").append(document.title()).append("\n\n");
        if (!document.metadata().isEmpty()) {
            for (String item : document.metadata()) {
                sb.append("- ").append(item).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## Results\n\n");
        sb.append(TABLE_HEADER).append('\n');
        sb.append(TABLE_ALIGN).append('\n');
        for (BaselineRow row : document.rows()) {
            appendRow(sb, row);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, BaselineRow row) {
        BaselineEntry e = row.entry();
        sb.append(String.format(Locale.ROOT,
            "| `%s` | %.2f | %s | %s | %.2f%% | %.0fKB | %s |\n",
            e.scenario().name(),
            e.requestsPerSecond(),
            LatencyUnits.formatMillis(e.p99LatencyUs()),
            row.avgLatency(),
            e.cpuPercent(),
            e.residentMemoryKb(),
            row.notes()
        ));
    }
}
