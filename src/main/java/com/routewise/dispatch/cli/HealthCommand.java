package com.routewise.dispatch.cli;

import com.routewise.core.health.HealthCheckService;
import com.routewise.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: routewise health
 * <p>
 * Runs every health check and prints the results. Exit code 1 if any
 * component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check router health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthCheckService.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.info("Overall: degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
