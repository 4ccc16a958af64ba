package com.acme.perfgate.process;

/**
 * A process as seen by the resolver. {@code name} is the kernel's short command name and is
 * null when it could not be read (the process exited or is not visible).
 */
public record ProcessDescriptor(long pid, String name) {
    public boolean nameReadable() {
        return name != null;
    }
}
