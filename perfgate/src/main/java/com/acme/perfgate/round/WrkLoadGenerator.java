package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.CorePinning;
import com.acme.perfgate.lifecycle.ServiceSettings;
import com.acme.perfgate.lifecycle.SubjectConfigRenderer;
import com.acme.perfgate.model.RoundFailureException;
import com.acme.perfgate.util.DurationSpec;
import com.acme.perfgate.util.GateDefaults;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs {@code wrk} with a generated Lua script that POSTs the scenario payload.
 */
public final class WrkLoadGenerator implements LoadGenerator {
    private static final Logger LOG = Logger.getLogger(WrkLoadGenerator.class.getName());

    private final ServiceSettings settings;
    private final DurationSpec duration;
    private final WrkOutputParser parser = new WrkOutputParser();
    private volatile Process running;

    public WrkLoadGenerator(ServiceSettings settings, DurationSpec duration) {
        this.settings = settings;
        this.duration = duration;
    }

    @Override
    public LoadResult run(ScenarioWorkload workload, URI endpoint, Path scratchDir) {
        String label = workload.scenario().name();
        Path script = scratchDir.resolve(label + "_wrk.lua");
        Path output = scratchDir.resolve(label + "_wrk.out");
        try {
            Files.writeString(script, luaScript(workload.payload()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RoundFailureException("failed to write wrk script " + script + ": " + e.getMessage(), "", e);
        }

        List<String> command = CorePinning.wrap(command(script, endpoint), settings.pinning().loadGeneratorCore());
        LOG.fine(() -> label + " running " + String.join(" ", command));
        long timeoutMs = duration.duration().toMillis() + GateDefaults.LOAD_GENERATOR_SLACK_MS;
        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        } catch (IOException e) {
            throw new RoundFailureException("failed to start wrk: " + e.getMessage(), "", e);
        }
        running = process;
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RoundFailureException(label + " wrk did not finish within " + timeoutMs + "ms", read(output));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RoundFailureException(label + " interrupted while running wrk", read(output), e);
        } finally {
            running = null;
        }
        String text = read(output);
        if (process.exitValue() != 0) {
            throw new RoundFailureException(label + " wrk exited with status " + process.exitValue(), text);
        }
        return parser.parse(text);
    }

    @Override
    public void close() {
        Process process = running;
        if (process != null && process.isAlive()) {
            LOG.warning("Stopping wrk pid=" + process.pid());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    List<String> command(Path script, URI endpoint) {
        return List.of(
            settings.loadGeneratorBinary(),
            "-t" + settings.loadGeneratorThreads(),
            "-c" + settings.connections(),
            "-d" + duration.raw(),
            "--timeout", settings.loadGeneratorTimeout().raw(),
            "--latency",
            "-s", script.toString(),
            endpoint.toString()
        );
    }

    static String luaScript(String payload) {
        String quoted = payload.replace("\\", "\\\\").replace("'", "\\'");
        return "wrk.method = \"POST\"\n"
            + "wrk.headers[\"Authorization\"] = \"Bearer " + SubjectConfigRenderer.CLIENT_KEY + "\"\n"
            + "wrk.headers[\"Content-Type\"] = \"application/json\"\n"
            + "wrk.body = '" + quoted + "'\n";
    }

    private static String read(Path output) {
        try {
            return Files.isRegularFile(output) ? Files.readString(output, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            return "<unreadable " + output + ": " + e.getMessage() + ">";
        }
    }
}
