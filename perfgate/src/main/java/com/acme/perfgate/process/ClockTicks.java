package com.acme.perfgate.process;

import com.acme.perfgate.util.GateDefaults;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Kernel clock ticks per second ({@code CLK_TCK}), the unit of {@code /proc/<pid>/stat}
 * CPU times.
 */
public final class ClockTicks {
    private static final Logger LOG = Logger.getLogger(ClockTicks.class.getName());

    private ClockTicks() {
    }

    public static long detect() {
        try {
            Process process = new ProcessBuilder("getconf", "CLK_TCK").redirectErrorStream(true).start();
            String out;
            try (InputStream in = process.getInputStream()) {
                out = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            if (process.waitFor(2, TimeUnit.SECONDS) && process.exitValue() == 0) {
                long ticks = Long.parseLong(out);
                if (ticks > 0) {
                    return ticks;
                }
            }
            process.destroyForcibly();
        } catch (IOException | NumberFormatException e) {
            LOG.log(Level.WARNING, "getconf CLK_TCK failed, assuming " + GateDefaults.DEFAULT_CLOCK_TICKS_PER_SECOND, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return GateDefaults.DEFAULT_CLOCK_TICKS_PER_SECOND;
    }
}
