package com.acme.perfgate.round;

import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.model.Scenario;
import com.acme.perfgate.util.DurationSpec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Delegates a round to an external shell command and reads the round-log lines it prints.
 * The command sees {@code ROUND} and {@code DURATION} in its environment.
 */
public final class CommandRoundRunner implements RoundRunner {
    private static final Logger LOG = Logger.getLogger(CommandRoundRunner.class.getName());

    private final String command;
    private final List<Scenario> scenarios;
    private final DurationSpec duration;
    private final Path scratchDir;

    public CommandRoundRunner(String command, List<Scenario> scenarios, DurationSpec duration, Path scratchDir) {
        this.command = command;
        this.scenarios = List.copyOf(scenarios);
        this.duration = duration;
        this.scratchDir = scratchDir;
    }

    @Override
    public Map<Scenario, MetricSample> runRound(int roundIndex) {
        Path output = scratchDir.resolve("round_" + roundIndex + ".log");
        ProcessBuilder builder = new ProcessBuilder("sh", "-c", command)
            .redirectErrorStream(true)
            .redirectOutput(output.toFile());
        builder.environment().put("ROUND", Integer.toString(roundIndex));
        builder.environment().put("DURATION", duration.raw());
        int exit;
        try {
            exit = builder.start().waitFor();
        } catch (IOException e) {
            throw new RoundFailureException("failed to run round command: " + e.getMessage(), "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoundFailureException("interrupted while running round " + roundIndex);
        }
        String text;
        try {
            text = Files.readString(output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RoundFailureException("failed to read round output " + output + ": " + e.getMessage(), "", e);
        }
        if (exit != 0) {
            throw new RoundFailureException("round command exited with status " + exit, text);
        }
        text.lines().forEach(line -> LOG.fine(line));
        RoundLog roundLog = new RoundLog();
        roundLog.acceptAll(text);
        return roundLog.samples(roundIndex, scenarios);
    }
}
