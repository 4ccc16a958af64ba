package com.acme.perfgate.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Linux {@code /proc} backed process table. Children come from {@link ProcessHandle}, which
 * reads the same kernel data.
 */
public final class ProcfsProcessTable implements ProcessTable {
    private final Path procRoot;

    public ProcfsProcessTable() {
        this(Path.of("/proc"));
    }

    public ProcfsProcessTable(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public Optional<String> name(long pid) {
        Path comm = procRoot.resolve(Long.toString(pid)).resolve("comm");
        try {
            return Optional.of(Files.readString(comm, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<Long> children(long pid) {
        return ProcessHandle.of(pid)
            .map(handle -> handle.children()
                .map(ProcessHandle::pid)
                .sorted()
                .collect(Collectors.toList()))
            .orElse(List.of());
    }
}
