package io.github.hide212131.langchain4j.atelier.app.cli;

import io.github.hide212131.langchain4j.atelier.infra.config.RuntimeConfig;
import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.infra.observability.ObservabilityConfig;
import io.github.hide212131.langchain4j.atelier.runtime.config.SessionConfigLoader;
import io.github.hide212131.langchain4j.atelier.runtime.config.SessionConfigurationException;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import io.github.hide212131.langchain4j.atelier.runtime.persistence.InMemoryCreditLedger;
import io.github.hide212131.langchain4j.atelier.runtime.persistence.InMemorySessionRepository;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealth;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealthProbe;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealthTracker;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderRegistry;
import io.github.hide212131.langchain4j.atelier.runtime.session.RoundScheduler;
import io.github.hide212131.langchain4j.atelier.runtime.session.SessionOutcome;
import io.github.hide212131.langchain4j.atelier.runtime.session.SessionState;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.NdjsonSessionEventWriter;
import io.github.hide212131.langchain4j.atelier.runtime.session.event.SessionEventPublisher;
import io.github.hide212131.langchain4j.atelier.runtime.usage.CreditEstimate;
import io.github.hide212131.langchain4j.atelier.runtime.usage.UsageMeter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Runs one session and streams its events as newline-delimited JSON.
 */
@Command(name = "run", description = "Run a refinement session from a session file.", mixinStandardHelpOptions = true)
final class RunCommand implements Callable<Integer> {

    private static final WorkflowLogger LOGGER = new WorkflowLogger(RunCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--session", required = true, paramLabel = "FILE", description = "Session definition (YAML or JSON)")
    private Path sessionFile;

    @Option(names = "--dry-run", description = "Use offline models that answer in the evaluation format")
    private boolean dryRun;

    @Option(names = "--balance", paramLabel = "CREDITS", description = "Credit balance available to the session")
    private Integer balance;

    @Option(names = "--events", paramLabel = "FILE", description = "Write the event stream to FILE instead of stdout")
    private Path eventsFile;

    RunCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        SessionConfig config;
        RuntimeConfig runtimeConfig;
        ProviderRegistry providers;
        ObservabilityConfig observability;
        ProviderHealthTracker healthTracker = new ProviderHealthTracker();
        try {
            config = new SessionConfigLoader().load(sessionFile);
            runtimeConfig = new RuntimeConfig();
            providers = ProviderRegistries.create(dryRun, healthTracker);
            observability = ObservabilityConfig.fromEnvironment();
        } catch (SessionConfigurationException | IllegalStateException | IllegalArgumentException e) {
            LOGGER.error("Cannot start session: {}", e.getMessage());
            err.println(e.getMessage());
            err.flush();
            return AtelierCliApp.EXIT_CONFIGURATION_ERROR;
        }

        CreditEstimate estimate = UsageMeter.estimateSession(config);
        if (balance != null && !estimate.hasSufficientCredits(balance)) {
            err.printf("Estimated %d credits exceed the balance of %d%n", estimate.totalCredits(), balance);
            err.flush();
            observability.close();
            return AtelierCliApp.EXIT_INSUFFICIENT_CREDITS;
        }

        InMemoryCreditLedger ledger = new InMemoryCreditLedger();
        Integer budget = balance;
        if (balance != null && config.optionalUserId().isPresent()) {
            ledger.grant(config.optionalUserId().get(), balance);
            budget = null;
        }
        RoundScheduler scheduler = RoundScheduler.builder(providers)
                .repository(new InMemorySessionRepository())
                .ledger(ledger)
                .runtimeConfig(runtimeConfig)
                .tracer(observability.sessionTracer())
                .build();
        SessionState state = new SessionState(config, budget);

        SessionOutcome outcome;
        try (observability;
                ProviderHealthProbe probe = startHealthProbe(providers, runtimeConfig);
                SessionEventPublisher publisher = openPublisher()) {
            outcome = scheduler.run(state, publisher);
        } catch (IOException e) {
            err.println("Cannot open event file " + eventsFile + ": " + e.getMessage());
            err.flush();
            return AtelierCliApp.EXIT_CONFIGURATION_ERROR;
        }

        printSummary(err, outcome, healthTracker);
        return outcome.status() == SessionStatus.FAILED ? AtelierCliApp.EXIT_EXECUTION_ERROR : CommandLine.ExitCode.OK;
    }

    /** Keeps the shared health tracker fresh while the session runs; closing the probe stops it. */
    private static ProviderHealthProbe startHealthProbe(ProviderRegistry providers, RuntimeConfig runtimeConfig) {
        if (!runtimeConfig.healthProbeEnabled()) {
            return null;
        }
        ProviderHealthProbe probe = new ProviderHealthProbe(providers, runtimeConfig.healthProbeInterval());
        probe.start();
        return probe;
    }

    private SessionEventPublisher openPublisher() throws IOException {
        if (eventsFile == null) {
            return new NdjsonSessionEventWriter(spec.commandLine().getOut(), false);
        }
        Path parent = eventsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new NdjsonSessionEventWriter(Files.newBufferedWriter(eventsFile, StandardCharsets.UTF_8), true);
    }

    private static void printSummary(PrintWriter err, SessionOutcome outcome, ProviderHealthTracker healthTracker) {
        err.println("Status: " + outcome.status().id());
        err.println("Reason: " + (outcome.reason() == null ? "-" : outcome.reason()));
        err.printf(
                "Rounds: %d, turns: %d, credits: %d%n",
                outcome.roundsCompleted(),
                outcome.turns().size(),
                outcome.creditsUsed());
        outcome.optionalRemainingBalance().ifPresent(remaining -> err.println("Remaining balance: " + remaining));
        if (!outcome.settledInFull()) {
            err.println("Unsettled credits: " + outcome.creditShortfall());
        }
        for (ProviderHealth health : healthTracker.snapshot().values()) {
            if (health.recentCalls() > 0) {
                err.printf(
                        "Provider %s: %s (%.1f%% of %d calls)%n",
                        health.provider().id(),
                        health.status().id(),
                        health.successRatePercent(),
                        health.recentCalls());
            }
        }
        err.println("Final document:");
        err.println(outcome.finalDocument());
        err.flush();
    }
}
