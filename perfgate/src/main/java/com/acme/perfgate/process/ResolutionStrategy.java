package com.acme.perfgate.process;

@FunctionalInterface
public interface ResolutionStrategy {
    ResolutionStep step(ProcessDescriptor current, ProcessTable table);
}
