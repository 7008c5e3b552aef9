package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.FallbackDecision;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: routewise fallback &lt;chain-id&gt; --failed a,b
 * <p>
 * Evaluates a chain's stored records and prints the escalation decision.
 * Needs a persistent record store to see records from other processes.
 */
@Command(name = "fallback", mixinStandardHelpOptions = true, description = "Check whether a request chain should fall back")
@Component
public class FallbackCommand implements Runnable {

    @Parameters(index = "0", description = "Request chain ID")
    private String chainId;

    @Option(names = {"--failed", "-f"}, split = ",", description = "Provider ids that failed")
    private List<String> failed = new ArrayList<>();

    private final RoutingEngine routingEngine;

    public FallbackCommand(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        FallbackDecision decision = routingEngine.checkFallback(chainId, failed);
        ConsoleOutput.fallback(decision);
    }
}
