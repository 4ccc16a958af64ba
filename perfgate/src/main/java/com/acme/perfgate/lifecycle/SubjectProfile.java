package com.acme.perfgate.lifecycle;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Inputs of the generated subject config.
 *
 * @param workerThreads empty lets the subject size its runtime itself
 */
public record SubjectProfile(
    String host,
    int proxyPort,
    int upstreamPort,
    boolean forceH2cUpstream,
    OptionalInt workerThreads,
    int threadStackSizeKb,
    UpstreamMode upstreamMode
) {
    public SubjectProfile {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(workerThreads, "workerThreads");
        Objects.requireNonNull(upstreamMode, "upstreamMode");
    }
}
