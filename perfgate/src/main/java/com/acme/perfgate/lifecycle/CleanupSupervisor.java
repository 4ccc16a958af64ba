package com.acme.perfgate.lifecycle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Releases registered resources in reverse registration order, either on {@link #close()}
 * or from a JVM shutdown hook when the run is interrupted. Runs at most once.
 */
public final class CleanupSupervisor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(CleanupSupervisor.class.getName());

    private final Deque<Registration> resources = new ArrayDeque<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Thread shutdownHook;

    public CleanupSupervisor() {
        this.shutdownHook = new Thread(this::runCleanup, "perfgate-cleanup-hook");
    }

    public static CleanupSupervisor installed() {
        CleanupSupervisor supervisor = new CleanupSupervisor();
        Runtime.getRuntime().addShutdownHook(supervisor.shutdownHook);
        return supervisor;
    }

    public synchronized <T extends AutoCloseable> T register(String name, T resource) {
        if (stopped.get()) {
            throw new IllegalStateException("cleanup already ran; cannot register " + name);
        }
        resources.push(new Registration(name, resource));
        return resource;
    }

    /**
     * Drops a resource that was released by its owner on the normal path.
     */
    public synchronized void forget(AutoCloseable resource) {
        resources.removeIf(r -> r.resource() == resource);
    }

    @Override
    public void close() {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException ignored) {
            // JVM is shutting down and hook is already in-flight.
        } catch (IllegalArgumentException ignored) {
            // never installed
        }
        runCleanup();
    }

    private void runCleanup() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        while (true) {
            Registration next;
            synchronized (this) {
                next = resources.poll();
            }
            if (next == null) {
                return;
            }
            try {
                next.resource().close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Cleanup: " + next.name() + " failed", e);
            }
        }
    }

    private record Registration(String name, AutoCloseable resource) {
    }
}
