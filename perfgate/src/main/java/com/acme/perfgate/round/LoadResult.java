package com.acme.perfgate.round;

/**
 * Summary of one load-generator run.
 *
 * @param p99Raw        p99 as printed by the load generator, e.g. {@code 1.23ms}
 * @param averageRaw    average latency as printed, or {@code n/a}
 */
public record LoadResult(
    long totalRequests,
    double requestsPerSecond,
    double p99LatencyUs,
    String p99Raw,
    String averageRaw
) {
}
