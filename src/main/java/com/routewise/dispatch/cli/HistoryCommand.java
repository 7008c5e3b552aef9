package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.ExecutionRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: routewise history
 * <p>
 * Lists the latest execution records as a table:
 * Chain | Status | Score | Providers | Request (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent execution records")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--chain", "-c"}, description = "Only records of this request chain")
    private String chainId;

    private final RoutingEngine routingEngine;

    public HistoryCommand(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ExecutionRecord> records = chainId == null
                ? routingEngine.recentRecords(limit)
                : routingEngine.chainRecords(chainId, limit);
        if (records.isEmpty()) {
            ConsoleOutput.info("No execution records found.");
            return;
        }

        ConsoleOutput.info("Execution records (" + records.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-20s %-6s %-24s %s%n", "CHAIN", "STATUS", "SCORE", "PROVIDERS", "REQUEST");
        System.out.println("  " + "-".repeat(90));

        for (ExecutionRecord record : records) {
            System.out.printf("  %-14s %-20s %-6.2f %-24s %s%n",
                    ConsoleOutput.truncate(record.request().chainId(), 14),
                    record.status().wireName(),
                    record.score(),
                    ConsoleOutput.truncate(String.join(",", record.providersUsed()), 24),
                    ConsoleOutput.truncate(record.request().text(), 30));
        }
    }
}
