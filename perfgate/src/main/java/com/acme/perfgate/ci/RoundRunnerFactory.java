package com.acme.perfgate.ci;

import com.acme.perfgate.lifecycle.CleanupSupervisor;
import com.acme.perfgate.lifecycle.ServiceSettings;
import com.acme.perfgate.lifecycle.SubjectConfigGuard;
import com.acme.perfgate.lifecycle.TempWorkspace;
import com.acme.perfgate.round.CommandRoundRunner;
import com.acme.perfgate.round.ManagedRoundRunner;
import com.acme.perfgate.round.RoundRunner;
import com.acme.perfgate.round.ScenarioCatalog;

import java.util.logging.Logger;

/**
 * Opens the round runner for an invocation. Resources it needs beyond the runner itself are
 * registered with the supervisor so they are released on every exit path.
 */
@FunctionalInterface
public interface RoundRunnerFactory {
    RoundRunner open(GateSettings settings, ScenarioCatalog catalog, TempWorkspace workspace, CleanupSupervisor supervisor);

    /**
     * {@code GATE_ROUND_COMMAND} when set, otherwise the managed subject/simulator/wrk stack.
     */
    static RoundRunnerFactory standard() {
        return (settings, catalog, workspace, supervisor) -> {
            Logger log = Logger.getLogger(RoundRunnerFactory.class.getName());
            if (settings.roundCommand().isPresent()) {
                log.info(() -> "Using external round command: " + settings.roundCommand().get());
                return new CommandRoundRunner(
                    settings.roundCommand().get(),
                    catalog.scenarios(),
                    settings.configuration().durationPerRound(),
                    workspace.root()
                );
            }
            ServiceSettings services = ServiceSettings.fromEnvironment(settings.environment());
            services.verifyBinaries(settings.environment());
            log.info(() -> "Service profile " + services.describe());
            SubjectConfigGuard guard = supervisor.register("subject config",
                SubjectConfigGuard.open(services.subjectConfigFile(), workspace.root()));
            return ManagedRoundRunner.create(services, catalog, settings.configuration().durationPerRound(), workspace.root(), guard);
        };
    }
}
