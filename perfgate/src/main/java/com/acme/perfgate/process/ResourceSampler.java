package com.acme.perfgate.process;

import com.acme.perfgate.util.GateDefaults;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Samples CPU ticks and peak RSS of one process across a load phase.
 *
 * <p>Start and end readings bracket the phase. In between a poller keeps the last observed
 * tick count and the highest observed peak so a subject that dies mid-phase still yields
 * the values it reached.</p>
 */
public final class ResourceSampler implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ResourceSampler.class.getName());

    private final ProcessStatsReader reader;
    private final long clockTicksPerSecond;
    private final long pollIntervalMs;
    private final LongSupplier nanoTime;
    private final ScheduledExecutorService executor;

    public ResourceSampler(ProcessStatsReader reader, long clockTicksPerSecond) {
        this(reader, clockTicksPerSecond, GateDefaults.SAMPLER_INTERVAL_MS, System::nanoTime);
    }

    public ResourceSampler(ProcessStatsReader reader,
                           long clockTicksPerSecond,
                           long pollIntervalMs,
                           LongSupplier nanoTime) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.clockTicksPerSecond = clockTicksPerSecond;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resource-sampler");
            t.setDaemon(true);
            return t;
        });
    }

    public Session start(long pid) {
        return new Session(pid);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public final class Session implements AutoCloseable {
        private final long pid;
        private final long startNanos;
        private final OptionalLong startTicks;
        private final AtomicLong lastTicks = new AtomicLong(-1L);
        private final AtomicLong peakRssKb = new AtomicLong(0L);
        private volatile ScheduledFuture<?> poller;
        private volatile boolean processExited;

        private Session(long pid) {
            this.pid = pid;
            this.startTicks = reader.cpuTicks(pid);
            this.startNanos = nanoTime.getAsLong();
            startTicks.ifPresent(lastTicks::set);
            observeRss();
            this.poller = executor.scheduleAtFixedRate(this::poll, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        }

        public long pid() {
            return pid;
        }

        /**
         * True once the poller found the process gone; the values observed before stay.
         */
        public boolean processExited() {
            return processExited;
        }

        private void poll() {
            if (processExited) {
                return;
            }
            OptionalLong ticks = reader.cpuTicks(pid);
            if (ticks.isEmpty()) {
                processExited = true;
                LOG.fine(() -> "Sampled pid " + pid + " exited, polling stopped");
                cancelPoller();
                return;
            }
            lastTicks.set(ticks.getAsLong());
            observeRss();
        }

        private void cancelPoller() {
            ScheduledFuture<?> current = poller;
            if (current != null) {
                current.cancel(false);
            }
        }

        private void observeRss() {
            OptionalLong rss = reader.peakRssKb(pid);
            if (rss.isPresent()) {
                peakRssKb.accumulateAndGet(rss.getAsLong(), Math::max);
            }
        }

        public ResourceUsage stop() {
            cancelPoller();
            long endNanos = nanoTime.getAsLong();
            OptionalLong endTicks = reader.cpuTicks(pid);
            if (endTicks.isPresent()) {
                lastTicks.set(endTicks.getAsLong());
            }
            observeRss();
            double wallSeconds = Math.max(1e-6d, (endNanos - startNanos) / 1e9d);
            if (startTicks.isEmpty()) {
                LOG.warning("CPU ticks for pid " + pid + " were not readable at phase start, reporting 0% CPU");
                return new ResourceUsage(0d, peakRssKb.get(), 0L, wallSeconds);
            }
            long start = startTicks.getAsLong();
            long end = lastTicks.get();
            long ticks = Math.max(0L, end - start);
            return new ResourceUsage(
                ResourceUsage.cpuPercent(start, end, clockTicksPerSecond, wallSeconds),
                peakRssKb.get(),
                ticks,
                wallSeconds
            );
        }

        @Override
        public void close() {
            cancelPoller();
        }
    }
}
