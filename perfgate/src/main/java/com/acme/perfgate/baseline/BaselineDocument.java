package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.Scenario;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed baseline snapshot: a title, the metadata bullet list and the Results rows in
 * file order.
 */
public record BaselineDocument(String title, List<String> metadata, List<BaselineRow> rows) {
    public static final String DEFAULT_TITLE = "Baseline Snapshot";

    public BaselineDocument {
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title.trim();
        metadata = List.copyOf(metadata);
        rows = List.copyOf(rows);
    }

    /**
     * Entries keyed by scenario; a scenario listed twice keeps its last row.
     */
    public Map<Scenario, BaselineEntry> entries() {
        Map<Scenario, BaselineEntry> out = new LinkedHashMap<>();
        for (BaselineRow row : rows) {
            out.put(row.entry().scenario(), row.entry());
        }
        return out;
    }

    /**
     * Entries for exactly the given scenarios, in their order.
     *
     * @throws BaselineFormatException when any scenario has no row
     */
    public Map<Scenario, BaselineEntry> require(List<Scenario> scenarios) {
        Objects.requireNonNull(scenarios, "scenarios");
        Map<Scenario, BaselineEntry> all = entries();
        Map<Scenario, BaselineEntry> out = new LinkedHashMap<>();
        for (Scenario scenario : scenarios) {
            BaselineEntry entry = all.get(scenario);
            if (entry == null) {
                throw new BaselineFormatException("baseline missing scenario: " + scenario);
            }
            out.put(scenario, entry);
        }
        return out;
    }
}
