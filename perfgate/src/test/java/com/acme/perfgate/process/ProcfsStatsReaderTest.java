package com.acme.perfgate.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcfsStatsReaderTest {
    private static final String STAT =
        "1234 (tool ify) S 1 1234 1234 0 -1 4194560 100 0 0 0 25 17 0 0 20 0 2 0 999 12345 678\n";
    private static final String STATUS = String.join("\n",
        "Name:\ttoolify",
        "VmPeak:\t   20000 kB",
        "VmHWM:\t    8192 kB",
        "VmRSS:\t    8000 kB",
        "");

    @TempDir
    Path procRoot;

    @Test
    void shouldSumUserAndSystemTicksPastCommWithSpaces() {
        assertEquals(42L, ProcfsStatsReader.parseCpuTicks(STAT).getAsLong());
    }

    @Test
    void shouldRejectTruncatedStat() {
        assertTrue(ProcfsStatsReader.parseCpuTicks("1234 (toolify) S 1 2").isEmpty());
        assertTrue(ProcfsStatsReader.parseCpuTicks("garbage").isEmpty());
    }

    @Test
    void shouldReadPeakRssFromStatus() {
        assertEquals(8192L, ProcfsStatsReader.parseVmHwmKb(STATUS).getAsLong());
        assertTrue(ProcfsStatsReader.parseVmHwmKb("Name:\tx\n").isEmpty());
    }

    @Test
    void shouldReadFilesUnderProcRoot() throws Exception {
        Path pidDir = Files.createDirectories(procRoot.resolve("1234"));
        Files.writeString(pidDir.resolve("stat"), STAT);
        Files.writeString(pidDir.resolve("status"), STATUS);
        Files.writeString(pidDir.resolve("comm"), "toolify\n");

        ProcfsStatsReader reader = new ProcfsStatsReader(procRoot);
        assertEquals(42L, reader.cpuTicks(1234).getAsLong());
        assertEquals(8192L, reader.peakRssKb(1234).getAsLong());
        assertTrue(reader.cpuTicks(4321).isEmpty());

        assertEquals("toolify", new ProcfsProcessTable(procRoot).name(1234).orElseThrow());
        assertTrue(new ProcfsProcessTable(procRoot).name(4321).isEmpty());
    }
}
