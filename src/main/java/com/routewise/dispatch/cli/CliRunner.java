package com.routewise.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;

/**
 * Runs the {@code routewise} command line inside the Spring context and
 * hands its exit code back to {@link com.routewise.RoutewiseApplication}.
 * Skipped entirely when the application was started with {@code serve}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final RoutewiseCommand routewiseCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(RoutewiseCommand routewiseCommand, IFactory factory) {
        this.routewiseCommand = routewiseCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        List<String> arguments = List.of(args);
        if (arguments.contains("serve")) {
            log.debug("Serve mode; routing API handled by the web server");
            return;
        }

        String subcommand = arguments.isEmpty() ? "(none)" : arguments.get(0);
        log.debug("Running CLI command '{}'", subcommand);
        exitCode = new CommandLine(routewiseCommand, factory).execute(args);
        if (exitCode != 0) {
            log.info("CLI command '{}' finished with exit code {}", subcommand, exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
