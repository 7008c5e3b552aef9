package com.routewise.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Routewise.
 */
@Command(
        name = "routewise",
        mixinStandardHelpOptions = true,
        version = "Routewise 0.1.0",
        description = "Learning capability router for natural-language requests",
        subcommands = {
                RouteCommand.class,
                RecommendCommand.class,
                FallbackCommand.class,
                StatsCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RoutewiseCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
