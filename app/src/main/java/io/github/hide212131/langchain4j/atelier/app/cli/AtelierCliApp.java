package io.github.hide212131.langchain4j.atelier.app.cli;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Root command of the atelier CLI. */
@Command(
        name = "atelier",
        description = "Refine a document through rounds of writer, editor and synthesizer agents.",
        mixinStandardHelpOptions = true,
        subcommands = {RunCommand.class, EstimateCommand.class, RolesCommand.class, HealthCommand.class})
public final class AtelierCliApp {

    static final int EXIT_EXECUTION_ERROR = 3;
    static final int EXIT_CONFIGURATION_ERROR = 4;
    static final int EXIT_INSUFFICIENT_CREDITS = 5;

    public AtelierCliApp() {
        // for picocli
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AtelierCliApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = new CommandLine(new AtelierCliApp());
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }
}
