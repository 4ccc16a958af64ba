package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.Scenario;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Strict reader of the Markdown baseline snapshot.
 *
 * <p>Grammar:</p>
 * <ul>
 *   <li>{@code # <title>} on the first header line, {@code - <text>} metadata bullets before
 *       the first section header;</li>
 *   <li>rows are read only between a line that is exactly {@code ## Results} and the next
 *       {@code ## } header;</li>
 *   <li>a row starts with {@code | `scenario` |} and has the columns scenario, RPS, p99,
 *       average latency, CPU, RSS, notes;</li>
 *   <li>the CPU cell must contain {@code %} and the RSS cell {@code KB}, otherwise the row
 *       belongs to some other table and is skipped.</li>
 * </ul>
 */
public final class BaselineParser {
    private static final Logger LOG = Logger.getLogger(BaselineParser.class.getName());
    private static final String RESULTS_HEADER = "## Results";
    private static final Pattern ROW_START = Pattern.compile("^\\| `[^`]+` \\|.*");
    private static final int MIN_CELLS = 7;

    public BaselineDocument parse(String text) {
        String title = null;
        List<String> metadata = new ArrayList<>();
        List<BaselineRow> rows = new ArrayList<>();
        boolean inResults = false;
        boolean seenSection = false;

        for (String line : text.split("\\R", -1)) {
            if (line.equals(RESULTS_HEADER)) {
                inResults = true;
                seenSection = true;
                continue;
            }
            if (line.startsWith("## ")) {
                inResults = false;
                seenSection = true;
                continue;
            }
            if (!seenSection) {
                if (title == null && line.startsWith("# ")) {
                    title = line.substring(2);
                } else if (line.startsWith("- ")) {
                    metadata.add(line.substring(2));
                }
                continue;
            }
            if (!inResults || !ROW_START.matcher(line).matches()) {
                continue;
            }
            BaselineRow row = parseRow(line);
            if (row != null) {
                rows.add(row);
            }
        }
        return new BaselineDocument(title, metadata, rows);
    }

    private static BaselineRow parseRow(String line) {
        // split keeps the empty cell before the leading pipe at index 0
        String[] cells = line.split("\\|", -1);
        if (cells.length < MIN_CELLS + 1) {
            LOG.fine(() -> "skipping short baseline row: " + line);
            return null;
        }
        String cpuCell = cells[5];
        String rssCell = cells[6];
        if (!cpuCell.contains("%") || !rssCell.contains("KB")) {
            LOG.fine(() -> "skipping baseline row without CPU%/KB units: " + line);
            return null;
        }

        String name = cells[1].replace("`", "").trim();
        if (!Scenario.isValidName(name)) {
            LOG.fine(() -> "skipping baseline row for foreign scenario '" + name + "': " + line);
            return null;
        }
        Scenario scenario = Scenario.of(name);

        double rps = parseNumber(strip(cells[2], ","), scenario, "RPS");
        String p99Raw = cells[3].replaceAll("\\s+", "");
        OptionalDouble p99 = LatencyUnits.toMicros(p99Raw);
        if (p99.isEmpty()) {
            throw new BaselineFormatException("failed to parse baseline p99 for " + scenario + ": " + p99Raw);
        }
        double cpu = parseNumber(strip(cpuCell, ",%"), scenario, "CPU");
        String rss = strip(rssCell, ",");
        if (rss.endsWith("KB")) {
            rss = rss.substring(0, rss.length() - 2);
        }
        double rssKb = parseNumber(rss, scenario, "RSS");
        String notes = cells.length > 7 ? cells[7] : "";

        return new BaselineRow(
            new BaselineEntry(scenario, rps, p99.getAsDouble(), cpu, rssKb),
            cells[4],
            notes
        );
    }

    private static String strip(String cell, String extraChars) {
        StringBuilder sb = new StringBuilder(cell.length());
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (Character.isWhitespace(c) || extraChars.indexOf(c) >= 0) {
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static double parseNumber(String raw, Scenario scenario, String column) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new BaselineFormatException(
                "failed to parse baseline " + column + " for " + scenario + ": '" + raw + "'", e);
        }
    }
}
