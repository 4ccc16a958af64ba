package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;

import java.util.Objects;

/**
 * One scenario row of the Results table. The average-latency cell is carried verbatim
 * because the gate never evaluates it.
 */
public record BaselineRow(BaselineEntry entry, String avgLatency, String notes) {
    public BaselineRow {
        Objects.requireNonNull(entry, "entry");
        avgLatency = avgLatency == null || avgLatency.isBlank() ? "n/a" : avgLatency.trim();
        notes = notes == null ? "" : notes.trim();
    }
}
