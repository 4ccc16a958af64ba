package com.acme.perfgate.process;

import java.util.OptionalLong;

/**
 * Cumulative CPU ticks and peak resident memory of a live process. Both are empty once the
 * process is gone.
 */
public interface ProcessStatsReader {
    OptionalLong cpuTicks(long pid);

    OptionalLong peakRssKb(long pid);
}
