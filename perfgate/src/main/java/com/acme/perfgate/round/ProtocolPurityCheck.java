package com.acme.perfgate.round;

import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.transport.UpstreamProtocolStats;

import java.util.function.Supplier;
import java.util.logging.Logger;

public final class ProtocolPurityCheck {
    private static final Logger LOG = Logger.getLogger(ProtocolPurityCheck.class.getName());

    private ProtocolPurityCheck() {
    }

    /**
     * @param diagnostics simulator output attached to a failure
     * @throws ProtocolPurityException unless {@code h2 > 0 && h1 == 0}
     */
    public static void requirePureH2(Scenario scenario, UpstreamProtocolStats stats, Supplier<String> diagnostics) {
        if (!stats.pureH2()) {
            throw new ProtocolPurityException(scenario + " upstream protocol assertion failed: expected pure h2 traffic, got h2="
                + stats.h2() + " h1=" + stats.h1(), diagnostics.get());
        }
        LOG.info(() -> scenario + " upstream_proto_h2_ok h2=" + stats.h2() + " h1=" + stats.h1());
    }
}
