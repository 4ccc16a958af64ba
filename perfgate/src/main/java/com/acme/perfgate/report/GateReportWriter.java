package com.acme.perfgate.report;

import com.acme.perfgate.decision.GateMath;
import com.acme.perfgate.model.BaselineEntry;
import com.acme.perfgate.model.GateConfiguration;
import com.acme.perfgate.model.GateVerdict;
import com.acme.perfgate.model.MedianMetrics;
import com.acme.perfgate.model.ScenarioVerdict;
import com.acme.perfgate.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the Markdown verdict report ({@code zero_regression_gate_<yyyyMMdd_HHmmss>.md}),
 * overwrites {@code zero_regression_gate_latest.md} with the same content and drops a JSON
 * summary next to it.
 */
public final class GateReportWriter {
    public static final String REPORT_PREFIX = "zero_regression_gate_";
    public static final String LATEST_REPORT = REPORT_PREFIX + "latest.md";
    public static final String LATEST_SUMMARY = REPORT_PREFIX + "latest.json";
    public static final String PASS_LINE = "PASS: zero-regression contract satisfied.";
    public static final String FAIL_LINE = "FAIL: zero-regression contract violated.";
    static final String CONTRACT_PRIORITY =
        "p99 (no regression) -> throughput (no regression) -> CPU efficiency (no regression) -> memory cap";

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public GateReportWriter() {
        this(Clock.systemUTC());
    }

    public GateReportWriter(Clock clock) {
        this.clock = clock;
    }

    public ReportFiles write(Path outputDir, GateReportContext context, GateVerdict verdict) throws IOException {
        Files.createDirectories(outputDir);
        var now = clock.instant();
        Path file = outputDir.resolve(REPORT_PREFIX + FILE_STAMP.format(now) + ".md");
        Files.writeString(file, render(context, verdict, HEADER_DATE.format(now)), StandardCharsets.UTF_8);
        Path latest = outputDir.resolve(LATEST_REPORT);
        Files.copy(file, latest, StandardCopyOption.REPLACE_EXISTING);
        Path summary = outputDir.resolve(LATEST_SUMMARY);
        Files.writeString(summary, JsonCodec.writePretty(summary(context, verdict)), StandardCharsets.UTF_8);
        return new ReportFiles(file, latest, summary);
    }

    String render(GateReportContext context, GateVerdict verdict, String date) {
        GateConfiguration config = context.configuration();
        StringBuilder md = new StringBuilder(4096);
        md.append("# Zero Regression Gate Result\n\n");
        md.append("- Date: ").append(date).append('\n');
        md.append("- Baseline: `").append(context.baselineFile()).append("`\n");
        md.append("- Profile: ").append(context.profile()).append('\n');
        md.append("- Rounds planned: ").append(verdict.plannedRounds()).append('\n');
        md.append("- Rounds executed: ").append(verdict.roundsExecuted()).append('\n');
        md.append("- Extra rounds allowed: ").append(config.maxExtraRounds()).append('\n');
        md.append("- Jitter threshold (RPS CV): ").append(fmt("%.2f", config.maxCvPercent())).append("%\n");
        md.append("- Min passing rounds per scenario: ").append(verdict.requiredPassRounds()).append('/')
            .append(verdict.roundsExecuted()).append(" (ratio=").append(config.minPassRatio()).append(")\n");
        md.append("- RSS limit: ").append(config.memoryHardLimitKb()).append(" KB\n");
        md.append("- Contract priority: ").append(CONTRACT_PRIORITY).append("\n\n");

        md.append("| Scenario | Baseline RPS | Median RPS | ΔRPS% | RPS CV% | Baseline p99(us) | Median p99(us) | Δp99% "
            + "| Baseline CPU% | Median CPU% | ΔCPU% | Baseline CPU/kRPS | Median CPU/kRPS | ΔCPU/kRPS% "
            + "| Baseline RSS KB | Median RSS KB | ΔRSS% | Pass Rounds |\n");
        md.append("|---|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|---:|\n");
        for (ScenarioVerdict sv : verdict.scenarios()) {
            BaselineEntry b = sv.baseline();
            MedianMetrics m = sv.median();
            md.append(fmt("| `%s` | %.2f | %.2f | %.2f%% | %.2f | %.2f | %.2f | %.2f%% | %.2f | %.2f | %.2f%% "
                    + "| %.4f | %.4f | %.2f%% | %.0f | %.0f | %.2f%% | %d/%d |\n",
                sv.scenario(),
                b.requestsPerSecond(), m.requestsPerSecond(), GateMath.pctDelta(b.requestsPerSecond(), m.requestsPerSecond()),
                sv.rpsCvPercent(),
                b.p99LatencyUs(), m.p99LatencyUs(), GateMath.pctDelta(b.p99LatencyUs(), m.p99LatencyUs()),
                b.cpuPercent(), m.cpuPercent(), GateMath.pctDelta(b.cpuPercent(), m.cpuPercent()),
                b.cpuPerKiloRps(), m.cpuPerKiloRps(), GateMath.pctDelta(b.cpuPerKiloRps(), m.cpuPerKiloRps()),
                b.residentMemoryKb(), m.residentMemoryKb(), GateMath.pctDelta(b.residentMemoryKb(), m.residentMemoryKb()),
                sv.passRoundCount(), sv.roundsExecuted()));
        }

        md.append("\n## Verdict\n\n");
        md.append(verdict.overallPass() ? PASS_LINE : FAIL_LINE).append('\n');

        List<ScenarioVerdict> failing = verdict.scenarios().stream().filter(sv -> !sv.overallPass()).toList();
        if (!failing.isEmpty()) {
            md.append("\n## Failing Scenarios\n\n");
            for (ScenarioVerdict sv : failing) {
                md.append("- `").append(sv.scenario()).append("`: ").append(String.join(", ", sv.failureReasons())).append('\n');
            }
        }
        return md.toString();
    }

    private static Map<String, Object> summary(GateReportContext context, GateVerdict verdict) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("pass", verdict.overallPass());
        root.put("baseline", context.baselineFile().toString());
        root.put("roundsPlanned", verdict.plannedRounds());
        root.put("roundsExecuted", verdict.roundsExecuted());
        root.put("requiredPassRounds", verdict.requiredPassRounds());
        List<Map<String, Object>> scenarios = new ArrayList<>();
        for (ScenarioVerdict sv : verdict.scenarios()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("scenario", sv.scenario().name());
            s.put("pass", sv.overallPass());
            s.put("passRounds", sv.passRoundCount());
            s.put("medianRps", sv.median().requestsPerSecond());
            s.put("medianP99Us", sv.median().p99LatencyUs());
            s.put("medianCpuPercent", sv.median().cpuPercent());
            s.put("medianRssKb", sv.median().residentMemoryKb());
            s.put("rpsCvPercent", sv.rpsCvPercent());
            s.put("failureReasons", sv.failureReasons());
            scenarios.add(s);
        }
        root.put("scenarios", scenarios);
        return root;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
