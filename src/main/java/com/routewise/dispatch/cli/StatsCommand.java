package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.LearningStatistics;
import com.routewise.core.model.LearningWeight;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Comparator;

/**
 * CLI command: routewise stats
 * <p>
 * Prints the learning statistics: totals, status distribution and one row per
 * provider weight.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show learning statistics")
@Component
public class StatsCommand implements Runnable {

    private final RoutingEngine routingEngine;

    public StatsCommand(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        LearningStatistics stats = routingEngine.statistics();
        if (stats.totalRecords() == 0) {
            ConsoleOutput.info("No execution records yet.");
            return;
        }

        ConsoleOutput.info(String.format("%d records, %.1f%% successful",
                stats.totalRecords(), stats.overallSuccessRate() * 100));
        stats.statusCounts().forEach((status, count) ->
                System.out.printf("  %-20s %d%n", status.wireName(), count));

        System.out.println();
        System.out.printf("  %-18s %6s %8s %7s %10s%n", "PROVIDER", "USES", "SUCCESS", "SCORE", "LATENCY");
        System.out.println("  " + "-".repeat(53));
        stats.perProviderWeights().values().stream()
                .sorted(Comparator.comparing(LearningWeight::providerId))
                .forEach(w -> System.out.printf("  %-18s %6d %7.0f%% %7.2f %10s%n",
                        w.providerId(), w.useCount(), w.successRate() * 100, w.averageScore(),
                        ConsoleOutput.formatDuration(Math.round(w.averageLatencyMillis()))));
    }
}
