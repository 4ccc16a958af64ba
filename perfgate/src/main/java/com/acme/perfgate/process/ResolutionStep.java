package com.acme.perfgate.process;

import java.util.List;

/**
 * Result of inspecting one process during resolution: either the search stops at this
 * process, or it continues with the first of the ordered candidates.
 */
public sealed interface ResolutionStep permits ResolutionStep.Target, ResolutionStep.Descend {
    record Target(long pid) implements ResolutionStep {}

    record Descend(List<Long> candidates) implements ResolutionStep {
        public Descend {
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("descend needs at least one candidate");
            }
            candidates = List.copyOf(candidates);
        }
    }
}
