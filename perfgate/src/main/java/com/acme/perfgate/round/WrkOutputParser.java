package com.acme.perfgate.round;

import com.acme.perfgate.baseline.LatencyUnits;
import com.acme.perfgate.model.RoundFailureException;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the summary block wrk prints with {@code --latency}.
 */
public final class WrkOutputParser {
    private static final Pattern RPS = Pattern.compile("^\\s*Requests/sec:\\s+([0-9]+(?:\\.[0-9]+)?)\\s*$");
    private static final Pattern TOTAL = Pattern.compile("^\\s*([0-9]+) requests in\\b.*$");
    private static final Pattern P99 = Pattern.compile("^\\s*99%\\s+(\\S+)\\s*$");
    private static final Pattern LATENCY_ROW = Pattern.compile("^\\s*Latency\\s+(\\S+)\\b.*$");

    /**
     * Last occurrence wins for RPS, total and p99; the first {@code Latency} row is the
     * thread-stats average.
     *
     * @throws RoundFailureException when RPS, total or a parseable p99 is missing
     */
    public LoadResult parse(String output) {
        String rps = null;
        String total = null;
        String p99 = null;
        String average = null;
        for (String line : output.split("\\R")) {
            Matcher m;
            if ((m = RPS.matcher(line)).matches()) {
                rps = m.group(1);
            } else if ((m = TOTAL.matcher(line)).matches()) {
                total = m.group(1);
            } else if ((m = P99.matcher(line)).matches()) {
                p99 = m.group(1);
            } else if (average == null && (m = LATENCY_ROW.matcher(line)).matches()) {
                average = m.group(1);
            }
        }
        if (rps == null) {
            throw new RoundFailureException("wrk output has no Requests/sec line", output);
        }
        if (total == null) {
            throw new RoundFailureException("wrk output has no request total", output);
        }
        if (p99 == null) {
            throw new RoundFailureException("wrk output has no 99% latency row", output);
        }
        OptionalDouble p99Us = LatencyUnits.toMicros(p99);
        if (p99Us.isEmpty()) {
            throw new RoundFailureException("unparseable wrk p99 latency: " + p99, output);
        }
        return new LoadResult(
            Long.parseLong(total),
            Double.parseDouble(rps),
            p99Us.getAsDouble(),
            p99,
            average == null ? "n/a" : average
        );
    }
}
