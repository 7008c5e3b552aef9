package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.Request;
import com.routewise.core.model.SelectionPlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: routewise route &lt;text&gt;
 * <p>
 * Classifies a request and prints the plan the router would issue for it.
 * Exit code 1 when no provider could be resolved.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Select providers for a request")
@Component
public class RouteCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Request text")
    private List<String> words;

    @Option(names = {"--chain", "-c"}, description = "Continue an existing request chain")
    private String chainId;

    private final RoutingEngine routingEngine;

    public RouteCommand(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String text = String.join(" ", words);
        Request request = chainId == null
                ? Request.of(text)
                : Request.inChain(chainId, text, null);

        SelectionPlan plan = routingEngine.route(request);
        ConsoleOutput.info("Request " + request.requestId() + " (chain " + request.chainId() + ")");
        ConsoleOutput.plan(plan);
        return plan.isResolved() ? 0 : 1;
    }
}
