package com.air.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for AIR.
 * Routes to subcommands: serve, review, status, list, summary, health.
 */
@Command(
        name = "air",
        mixinStandardHelpOptions = true,
        version = "AIR 0.1.0",
        description = "Automated patch review: queue, prepare, and review git patches",
        subcommands = {
                ServeCommand.class,
                ReviewCommand.class,
                StatusCommand.class,
                ListCommand.class,
                SummaryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AirCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
