package io.github.hide212131.langchain4j.atelier.app.cli;

import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealth;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealthProbe;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealthTracker;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderRegistry;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Pings every configured backend once and prints the resulting health. */
@Command(name = "health", description = "Probe the configured providers.", mixinStandardHelpOptions = true)
final class HealthCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--dry-run", description = "Probe the offline models instead of real providers")
    private boolean dryRun;

    HealthCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        ProviderHealthTracker healthTracker = new ProviderHealthTracker();
        ProviderRegistry registry;
        try {
            registry = ProviderRegistries.create(dryRun, healthTracker);
        } catch (IllegalStateException e) {
            spec.commandLine().getErr().println(e.getMessage());
            spec.commandLine().getErr().flush();
            return AtelierCliApp.EXIT_CONFIGURATION_ERROR;
        }
        int healthy;
        try (ProviderHealthProbe probe = new ProviderHealthProbe(registry)) {
            healthy = probe.probeAll();
        }
        PrintWriter out = spec.commandLine().getOut();
        for (ProviderHealth health : healthTracker.snapshot().values()) {
            if (!registry.types().contains(health.provider())) {
                continue;
            }
            out.printf(
                    "%-10s %-9s %5.1f%%  %s%n",
                    health.provider().id(),
                    health.status().id(),
                    health.successRatePercent(),
                    health.lastError() == null ? "" : health.lastError());
        }
        out.printf("%d of %d providers answered%n", healthy, registry.types().size());
        out.flush();
        return healthy == registry.types().size() ? CommandLine.ExitCode.OK : AtelierCliApp.EXIT_EXECUTION_ERROR;
    }
}
