package io.github.hide212131.langchain4j.atelier.app.cli;

import io.github.hide212131.langchain4j.atelier.runtime.config.SessionConfigLoader;
import io.github.hide212131.langchain4j.atelier.runtime.config.SessionConfigurationException;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.usage.AgentEstimate;
import io.github.hide212131.langchain4j.atelier.runtime.usage.CreditEstimate;
import io.github.hide212131.langchain4j.atelier.runtime.usage.UsageMeter;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Prints the pre-session credit estimate. */
@Command(name = "estimate", description = "Estimate the credits a session will use.", mixinStandardHelpOptions = true)
final class EstimateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--session", required = true, paramLabel = "FILE", description = "Session definition (YAML or JSON)")
    private Path sessionFile;

    @Option(names = "--balance", paramLabel = "CREDITS", description = "Check the estimate against this balance")
    private Integer balance;

    EstimateCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        SessionConfig config;
        try {
            config = new SessionConfigLoader().load(sessionFile);
        } catch (SessionConfigurationException e) {
            spec.commandLine().getErr().println(e.getMessage());
            spec.commandLine().getErr().flush();
            return AtelierCliApp.EXIT_CONFIGURATION_ERROR;
        }
        CreditEstimate estimate = UsageMeter.estimateSession(config);
        out.printf("%-20s %-32s %5s %6s %10s %10s %8s%n", "AGENT", "MODEL", "PHASE", "RUNS", "IN/RUN", "OUT/RUN", "CREDITS");
        for (AgentEstimate agent : estimate.agents()) {
            out.printf(
                    "%-20s %-32s %5d %6d %10d %10d %8.2f%n",
                    agent.agentId(),
                    agent.model(),
                    agent.phase().number(),
                    agent.runs(),
                    agent.inputTokensPerRun(),
                    agent.outputTokensPerRun(),
                    agent.credits());
        }
        out.println("Total: " + estimate.totalCredits() + " credits");
        if (balance == null) {
            out.flush();
            return CommandLine.ExitCode.OK;
        }
        boolean sufficient = estimate.hasSufficientCredits(balance);
        out.println(sufficient
                ? "Balance " + balance + " is sufficient"
                : "Balance " + balance + " is insufficient");
        out.flush();
        return sufficient ? CommandLine.ExitCode.OK : AtelierCliApp.EXIT_INSUFFICIENT_CREDITS;
    }
}
