package com.acme.perfgate.process;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the host process tree.
 */
public interface ProcessTable {
    Optional<String> name(long pid);

    /**
     * Direct children in ascending pid order.
     */
    List<Long> children(long pid);

    default ProcessDescriptor describe(long pid) {
        return new ProcessDescriptor(pid, name(pid).orElse(null));
    }
}
