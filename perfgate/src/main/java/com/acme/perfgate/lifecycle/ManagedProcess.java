package com.acme.perfgate.lifecycle;

import com.acme.perfgate.util.GateDefaults;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * An external process whose combined stdout/stderr goes to a log file and which is
 * terminated together with its descendants when closed: TERM first, forced kill after
 * the grace period.
 */
public final class ManagedProcess implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ManagedProcess.class.getName());

    private final String name;
    private final Process process;
    private final Path logFile;
    private final Duration stopGrace;

    private ManagedProcess(String name, Process process, Path logFile, Duration stopGrace) {
        this.name = name;
        this.process = process;
        this.logFile = logFile;
        this.stopGrace = stopGrace;
    }

    public static ManagedProcess start(String name,
                                       List<String> command,
                                       Map<String, String> extraEnv,
                                       Path workingDir,
                                       Path logFile) {
        return start(name, command, extraEnv, workingDir, logFile, Duration.ofMillis(GateDefaults.PROCESS_STOP_GRACE_MS));
    }

    /**
     * @throws LifecycleException when the command cannot be spawned
     */
    public static ManagedProcess start(String name,
                                       List<String> command,
                                       Map<String, String> extraEnv,
                                       Path workingDir,
                                       Path logFile,
                                       Duration stopGrace) {
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        builder.environment().putAll(extraEnv);
        try {
            Process process = builder.start();
            LOG.fine(() -> "Started " + name + " pid=" + process.pid() + " command=" + String.join(" ", command));
            return new ManagedProcess(name, process, logFile, stopGrace);
        } catch (IOException e) {
            throw new LifecycleException("failed to start " + name + ": " + e.getMessage(), "", e);
        }
    }

    public String name() {
        return name;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public Path logFile() {
        return logFile;
    }

    /**
     * First {@code maxLines} lines of the captured output; empty when nothing was written.
     */
    public String logHead(int maxLines) {
        if (!Files.isRegularFile(logFile)) {
            return "";
        }
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            return reader.lines().limit(maxLines).collect(Collectors.joining("\n"));
        } catch (IOException | UncheckedIOException e) {
            return "<unreadable log " + logFile + ": " + e.getMessage() + ">";
        }
    }

    public String diagnostics() {
        return logHead(GateDefaults.CAPTURED_LOG_LINES);
    }

    @Override
    public void close() {
        // Snapshot first: children are re-parented once the launcher exits.
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroy();
        descendants.forEach(ProcessHandle::destroy);

        boolean exited = awaitExit(process.toHandle(), stopGrace);
        for (ProcessHandle child : descendants) {
            exited &= awaitExit(child, Duration.ZERO);
        }
        if (!exited) {
            LOG.warning("Process " + name + " pid=" + process.pid() + " ignored TERM; killing");
            descendants.forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            awaitExit(process.toHandle(), stopGrace);
        }
    }

    private static boolean awaitExit(ProcessHandle handle, Duration timeout) {
        if (!handle.isAlive()) {
            return true;
        }
        try {
            handle.onExit().get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.isAlive();
        } catch (Exception e) {
            return !handle.isAlive();
        }
    }
}
