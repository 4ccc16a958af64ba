package com.acme.perfgate.round;

import java.net.URI;
import java.nio.file.Path;

/**
 * Drives load against the subject for one scenario and summarizes it.
 */
public interface LoadGenerator extends AutoCloseable {
    LoadResult run(ScenarioWorkload workload, URI endpoint, Path scratchDir);

    /**
     * Stops a run in progress, if any. May be called from another thread.
     */
    @Override
    default void close() {
    }
}
