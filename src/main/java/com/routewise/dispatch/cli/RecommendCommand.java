package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.model.Recommendation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: routewise recommend &lt;context&gt;
 */
@Command(name = "recommend", mixinStandardHelpOptions = true,
        description = "Suggest providers whose keywords match a failure context")
@Component
public class RecommendCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Failure context text")
    private List<String> words;

    @Option(names = {"--exclude", "-x"}, split = ",", description = "Provider ids to leave out")
    private List<String> exclude = new ArrayList<>();

    private final RoutingEngine routingEngine;

    public RecommendCommand(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Recommendation> recommendations = routingEngine.recommend(String.join(" ", words), exclude);
        if (recommendations.isEmpty()) {
            ConsoleOutput.info("No matching providers.");
            return;
        }
        ConsoleOutput.info("Recommendations (" + recommendations.size() + "):");
        recommendations.forEach(ConsoleOutput::recommendation);
    }
}
