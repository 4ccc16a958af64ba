package com.acme.perfgate.baseline;

import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.ScenarioVerdict;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * File-backed access to baseline snapshots.
 */
public final class BaselineStore {
    private static final Logger LOG = Logger.getLogger(BaselineStore.class.getName());

    private final BaselineParser parser = new BaselineParser();
    private final BaselineWriter writer = new BaselineWriter();

    public BaselineDocument load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new BaselineFormatException("baseline file not found: " + file);
        }
        try {
            BaselineDocument document = parser.parse(Files.readString(file, StandardCharsets.UTF_8));
            LOG.info(() -> "Baseline loaded file=" + file + " rows=" + document.rows().size());
            return document;
        } catch (IOException e) {
            throw new BaselineFormatException("failed to read baseline " + file + ": " + e.getMessage(), e);
        }
    }

    public Path write(Path file, BaselineDocument document) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, writer.render(document), StandardCharsets.UTF_8);
        return file;
    }

    /**
     * A snapshot of the medians of a finished run, in the same shape as a baseline so it
     * can be promoted as-is.
     */
    public static BaselineDocument snapshotOf(GateVerdict verdict, String title, List<String> metadata) {
        List<BaselineRow> rows = new ArrayList<>(verdict.scenarios().size());
        for (ScenarioVerdict sv : verdict.scenarios()) {
            MedianMetrics m = sv.median();
            rows.add(new BaselineRow(
                new BaselineEntry(sv.scenario(), m.requestsPerSecond(), m.p99LatencyUs(), m.cpuPercent(), m.residentMemoryKb()),
                "n/a",
                "median of " + sv.roundsExecuted() + " rounds"
            ));
        }
        return new BaselineDocument(title, metadata, rows);
    }
}
