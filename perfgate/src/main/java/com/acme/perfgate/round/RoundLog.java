package com.acme.perfgate.round;

import com.acme.perfgate.baseline.LatencyUnits;
import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.process.ResourceUsage;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The line-oriented round log: one load line and one resource line per scenario.
 *
 * <pre>
 * forward_nonstream_wrk wrk_requests=120345 wrk_rps=12034.50 wrk_p99=1.23ms wrk_latency_avg=0.61ms
 * forward_nonstream_wrk cpu_pct=97.41 peak_rss_kb=8123
 * </pre>
 *
 * Lines that match neither shape are ignored, so the log can be interleaved with other
 * output of an external runner.
 */
public final class RoundLog {
    private static final Pattern LOAD_LINE = Pattern.compile(
        "^([a-z_]+)\\s+wrk_requests=\\S+\\s+wrk_rps=([0-9]+(?:\\.[0-9]+)?)\\s+wrk_p99=(\\S+).*$");
    private static final Pattern RESOURCE_LINE = Pattern.compile(
        "^([a-z_]+)\\s+cpu_pct=([0-9]+(?:\\.[0-9]+)?)\\s+peak_rss_kb=([0-9]+)$");

    private final Map<Scenario, Double> rps = new HashMap<>();
    private final Map<Scenario, Double> p99Us = new HashMap<>();
    private final Map<Scenario, Double> cpu = new HashMap<>();
    private final Map<Scenario, Long> rss = new HashMap<>();

    public static String loadLine(Scenario scenario, LoadResult load) {
        return String.format(Locale.ROOT, "%s wrk_requests=%d wrk_rps=%.2f wrk_p99=%s wrk_latency_avg=%s",
            scenario, load.totalRequests(), load.requestsPerSecond(), load.p99Raw(), load.averageRaw());
    }

    public static String resourceLine(Scenario scenario, ResourceUsage usage) {
        return String.format(Locale.ROOT, "%s cpu_pct=%.2f peak_rss_kb=%d",
            scenario, usage.cpuPercent(), usage.peakRssKb());
    }

    /**
     * Records a line; later lines for the same scenario overwrite earlier ones.
     */
    public void accept(String rawLine) {
        String line = rawLine.strip();
        Matcher m = LOAD_LINE.matcher(line);
        if (m.matches()) {
            Scenario scenario = Scenario.of(m.group(1));
            rps.put(scenario, Double.parseDouble(m.group(2)));
            OptionalDouble p99 = LatencyUnits.toMicros(m.group(3));
            if (p99.isPresent()) {
                p99Us.put(scenario, p99.getAsDouble());
            }
            return;
        }
        m = RESOURCE_LINE.matcher(line);
        if (m.matches()) {
            Scenario scenario = Scenario.of(m.group(1));
            cpu.put(scenario, Double.parseDouble(m.group(2)));
            rss.put(scenario, Long.parseLong(m.group(3)));
        }
    }

    public void acceptAll(String output) {
        for (String line : output.split("\\R")) {
            accept(line);
        }
    }

    /**
     * @throws RoundFailureException when any scenario lacks one of its four metrics
     */
    public Map<Scenario, MetricSample> samples(int roundIndex, List<Scenario> scenarios) {
        Map<Scenario, MetricSample> out = new LinkedHashMap<>();
        for (Scenario scenario : scenarios) {
            if (!rps.containsKey(scenario) || !p99Us.containsKey(scenario)
                || !cpu.containsKey(scenario) || !rss.containsKey(scenario)) {
                throw new RoundFailureException("round " + roundIndex + " missing metrics for scenario: " + scenario);
            }
            out.put(scenario, new MetricSample(
                scenario, roundIndex, rps.get(scenario), p99Us.get(scenario), cpu.get(scenario), rss.get(scenario)));
        }
        return out;
    }
}
