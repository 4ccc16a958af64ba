package com.acme.perfgate.process;

import com.acme.perfgate.util.GateDefaults;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Finds the long-running subject process below the pid that was actually spawned.
 * Always returns a concrete pid: the walk ends at the last process it reached when the
 * strategy stops or the depth bound is hit.
 */
public final class ProcessResolver {
    private static final Logger LOG = Logger.getLogger(ProcessResolver.class.getName());

    private final ProcessTable table;
    private final ResolutionStrategy strategy;
    private final int maxDepth;

    public ProcessResolver(ProcessTable table, ResolutionStrategy strategy) {
        this(table, strategy, GateDefaults.MAX_RESOLVE_DEPTH);
    }

    public ProcessResolver(ProcessTable table, ResolutionStrategy strategy, int maxDepth) {
        this.table = Objects.requireNonNull(table, "table");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.maxDepth = Math.max(0, maxDepth);
    }

    public long resolve(long launcherPid) {
        long pid = launcherPid;
        for (int depth = 0; depth < maxDepth; depth++) {
            ResolutionStep step = strategy.step(table.describe(pid), table);
            if (step instanceof ResolutionStep.Target target) {
                pid = target.pid();
                break;
            }
            pid = ((ResolutionStep.Descend) step).candidates().get(0);
        }
        long resolved = pid;
        LOG.fine(() -> "Resolved stats pid launcher=" + launcherPid + " resolved=" + resolved);
        return resolved;
    }
}
