package com.acme.perfgate.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Reads {@code utime + stime} from {@code /proc/<pid>/stat} and {@code VmHWM} from
 * {@code /proc/<pid>/status}.
 */
public final class ProcfsStatsReader implements ProcessStatsReader {
    // field numbers per proc(5), counted after the parenthesised comm (field 2)
    private static final int UTIME_FIELD = 14;
    private static final int STIME_FIELD = 15;
    private static final int FIRST_FIELD_AFTER_COMM = 3;

    private final Path procRoot;

    public ProcfsStatsReader() {
        this(Path.of("/proc"));
    }

    public ProcfsStatsReader(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public OptionalLong cpuTicks(long pid) {
        String stat = read(pid, "stat");
        return stat == null ? OptionalLong.empty() : parseCpuTicks(stat);
    }

    @Override
    public OptionalLong peakRssKb(long pid) {
        String status = read(pid, "status");
        return status == null ? OptionalLong.empty() : parseVmHwmKb(status);
    }

    static OptionalLong parseCpuTicks(String stat) {
        int close = stat.lastIndexOf(')');
        if (close < 0) {
            return OptionalLong.empty();
        }
        String[] fields = stat.substring(close + 1).trim().split("\\s+");
        int utimeIdx = UTIME_FIELD - FIRST_FIELD_AFTER_COMM;
        int stimeIdx = STIME_FIELD - FIRST_FIELD_AFTER_COMM;
        if (fields.length <= stimeIdx) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(fields[utimeIdx]) + Long.parseLong(fields[stimeIdx]));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    static OptionalLong parseVmHwmKb(String status) {
        for (String line : status.split("\\R")) {
            if (!line.startsWith("VmHWM:")) {
                continue;
            }
            String[] parts = line.substring("VmHWM:".length()).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(parts[0]));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private String read(long pid, String file) {
        try {
            return Files.readString(procRoot.resolve(Long.toString(pid)).resolve(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }
}
