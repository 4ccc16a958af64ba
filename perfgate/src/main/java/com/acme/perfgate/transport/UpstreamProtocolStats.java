package com.acme.perfgate.transport;

/**
 * Request counters reported by the upstream simulator, split by HTTP protocol version.
 */
public record UpstreamProtocolStats(String mode, String scenario, String transport, long h1, long h2, long other) {

    /**
     * True when every request the subject forwarded travelled over HTTP/2.
     */
    public boolean pureH2() {
        return h2 > 0 && h1 == 0;
    }
}
