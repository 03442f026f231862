package io.github.hide212131.langchain4j.atelier.app.cli;

import io.github.hide212131.langchain4j.atelier.runtime.model.EvaluationCriterion;
import io.github.hide212131.langchain4j.atelier.runtime.roster.WorkflowRole;
import io.github.hide212131.langchain4j.atelier.runtime.roster.WorkflowRoles;
import java.io.PrintWriter;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(name = "roles", description = "List the built-in roles usable in session files.", mixinStandardHelpOptions = true)
final class RolesCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    RolesCommand() {
        // for picocli
    }

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        for (WorkflowRole role : WorkflowRoles.all()) {
            out.printf(
                    "%-15s phase %d  %-22s %s%s%n",
                    role.id(),
                    role.phase().number(),
                    role.name(),
                    role.description(),
                    role.required() ? " (required)" : "");
            out.println("    criteria: " + role.evaluationCriteria().stream()
                    .map(EvaluationCriterion::name)
                    .collect(Collectors.joining(", ")));
        }
        out.flush();
    }
}
