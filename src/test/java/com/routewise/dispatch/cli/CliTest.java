package com.routewise.dispatch.cli;

import com.routewise.core.engine.RoutingEngine;
import com.routewise.core.health.HealthCheckService;
import com.routewise.core.health.HealthStatus;
import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.EscalationLevel;
import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.LearningStatistics;
import com.routewise.core.model.LearningWeight;
import com.routewise.core.model.Recommendation;
import com.routewise.core.model.Request;
import com.routewise.core.model.ResultStatus;
import com.routewise.core.model.SelectionPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for the Routewise CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static HealthCheckService healthService(HealthStatus.Status catalogStatus) {
        HealthCheckService mockHealth = mock(HealthCheckService.class);
        when(mockHealth.checkAll()).thenReturn(List.of(
                new HealthStatus("catalog", catalogStatus, "catalog check", Map.of()),
                new HealthStatus("records", HealthStatus.Status.UP, "In-memory record store (0 records)", Map.of())));
        return mockHealth;
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory(RoutingEngine engine, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RouteCommand.class) {
                    return (K) new RouteCommand(engine);
                }
                if (cls == RecommendCommand.class) {
                    return (K) new RecommendCommand(engine);
                }
                if (cls == FallbackCommand.class) {
                    return (K) new FallbackCommand(engine);
                }
                if (cls == StatsCommand.class) {
                    return (K) new StatsCommand(engine);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(RoutingEngine.class), healthService(HealthStatus.Status.UP), args);
    }

    private CliResult execute(RoutingEngine engine, String... args) {
        return execute(engine, healthService(HealthStatus.Status.UP), args);
    }

    private CliResult execute(RoutingEngine engine, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new RoutewiseCommand(), createFactory(engine, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static SelectionPlan resolvedPlan(String requestId) {
        return new SelectionPlan("PLAN-0001", requestId, ComplexityClass.MEDIUM, "webagent",
                List.of("claude"), List.of("webagent", "claude"), 0.85);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String name : List.of("route", "recommend", "fallback", "stats", "history", "health", "serve", "help")) {
                assertTrue(output.contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Routewise 0.1.0"));
        }

        @Test
        @DisplayName("route --help shows the chain option")
        void routeHelpOutput() {
            CliResult result = execute("route", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Select providers for a request"));
            assertTrue(result.output().contains("--chain"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ROUTEWISE v0.1.0"));
            assertTrue(result.output().contains("Usage: routewise"));
        }
    }

    // =====================================================================
    //  Command execution tests
    // =====================================================================

    @Nested
    @DisplayName("route")
    class RouteTests {

        @Test
        @DisplayName("prints the plan and exits 0 when resolved")
        void routeResolved() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.route(any(Request.class)))
                    .thenAnswer(inv -> resolvedPlan(inv.<Request>getArgument(0).requestId()));

            CliResult result = execute(engine, "route", "What", "is", "the", "latest", "inflation", "rate?");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("webagent -> claude"));
            assertTrue(result.output().contains("MEDIUM"));
            verify(engine).route(argThat(r -> r.text().equals("What is the latest inflation rate?")));
        }

        @Test
        @DisplayName("exits 1 when no provider could be resolved")
        void routeUnresolved() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.route(any(Request.class))).thenAnswer(inv -> SelectionPlan.unresolved(
                    "PLAN-0002", inv.<Request>getArgument(0).requestId(), ComplexityClass.COMPLEX));

            CliResult result = execute(engine, "route", "analyze", "and", "compare");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No provider available"));
        }

        @Test
        @DisplayName("--chain continues the given chain")
        void routeWithChain() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.route(any(Request.class)))
                    .thenAnswer(inv -> resolvedPlan(inv.<Request>getArgument(0).requestId()));

            CliResult result = execute(engine, "route", "--chain", "CHAIN-9", "search", "again");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("chain CHAIN-9"));
        }

        @Test
        @DisplayName("route without text fails to parse")
        void routeRequiresText() {
            CliResult result = execute("route");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("recommend and fallback")
    class RecoveryTests {

        @Test
        @DisplayName("recommend passes exclusions and lists matches")
        void recommend() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.recommend("timeout fetching news", List.of("webagent", "claude")))
                    .thenReturn(List.of(new Recommendation("newsbot", 0.5, Set.of("news"), "newsbot provider", 0.6)));

            CliResult result = execute(engine, "recommend", "timeout", "fetching", "news", "-x", "webagent,claude");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("newsbot"));
        }

        @Test
        @DisplayName("recommend with no matches says so")
        void recommendNone() {
            CliResult result = execute("recommend", "nothing", "matches");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No matching providers"));
        }

        @Test
        @DisplayName("fallback prints level, tools and services")
        void fallback() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.checkFallback("CHAIN-1", List.of("webagent"))).thenReturn(new FallbackDecision(true,
                    EscalationLevel.CONSTRUCT_TOOL, "Build a tool after 3 consecutive unacceptable results",
                    List.of("coder"), List.of("aci.dev")));

            CliResult result = execute(engine, "fallback", "CHAIN-1", "--failed", "webagent");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("LEVEL 3"));
            assertTrue(result.output().contains("coder"));
            assertTrue(result.output().contains("aci.dev"));
        }

        @Test
        @DisplayName("fallback on a healthy chain reports no fallback")
        void fallbackNone() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.checkFallback("CHAIN-2", List.of())).thenReturn(FallbackDecision.none());

            CliResult result = execute(engine, "fallback", "CHAIN-2");

            assertTrue(result.output().contains("No fallback needed"));
        }
    }

    @Nested
    @DisplayName("stats and history")
    class ReportingTests {

        @Test
        @DisplayName("stats with no records")
        void statsEmpty() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.statistics()).thenReturn(new LearningStatistics(0, 0.0, Map.of(), Map.of()));

            CliResult result = execute(engine, "stats");

            assertTrue(result.output().contains("No execution records yet"));
        }

        @Test
        @DisplayName("stats lists provider weights")
        void statsWithWeights() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.statistics()).thenReturn(new LearningStatistics(4, 0.75,
                    Map.of(ResultStatus.SUCCESS_PERFECT, 3L, ResultStatus.FAILURE_SYSTEM, 1L),
                    Map.of("webagent", new LearningWeight("webagent", 4, 3, 0.72, 1500.0))));

            CliResult result = execute(engine, "stats");

            assertTrue(result.output().contains("4 records, 75.0% successful"));
            assertTrue(result.output().contains("failure_system"));
            assertTrue(result.output().contains("webagent"));
            assertTrue(result.output().contains("1s"));
        }

        @Test
        @DisplayName("history --chain shows that chain's records")
        void historyForChain() {
            RoutingEngine engine = mock(RoutingEngine.class);
            var request = Request.inChain("CHAIN-1", "latest inflation rate", Map.of());
            var record = new ExecutionRecord("REC-1", request, resolvedPlan(request.requestId()),
                    ResultStatus.FAILURE_RESOURCE, 0.0, Duration.ofMillis(30_000), List.of("webagent"),
                    "timeout", null, Instant.now());
            when(engine.chainRecords("CHAIN-1", 5)).thenReturn(List.of(record));

            CliResult result = execute(engine, "history", "--chain", "CHAIN-1", "-n", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("failure_resource"));
            assertTrue(result.output().contains("latest inflation rate"));
        }

        @Test
        @DisplayName("history with no records")
        void historyEmpty() {
            RoutingEngine engine = mock(RoutingEngine.class);
            when(engine.recentRecords(10)).thenReturn(List.of());

            CliResult result = execute(engine, "history");

            assertTrue(result.output().contains("No execution records found"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("exits 0 when all components are UP")
        void healthUp() {
            CliResult result = execute(mock(RoutingEngine.class), healthService(HealthStatus.Status.UP), "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("exits 1 when a component is DOWN")
        void healthDown() {
            CliResult result = execute(mock(RoutingEngine.class), healthService(HealthStatus.Status.DOWN), "health");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("one or more components down"));
        }
    }

    @Nested
    @DisplayName("CliRunner")
    class RunnerTests {

        @Test
        @DisplayName("reports the exit code of the executed command")
        void propagatesExitCode() throws Exception {
            var runner = new CliRunner(new RoutewiseCommand(),
                    createFactory(mock(RoutingEngine.class), healthService(HealthStatus.Status.DOWN)));
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(new ByteArrayOutputStream(), true));
            try {
                runner.run("health");
            } finally {
                System.setOut(originalOut);
            }
            assertEquals(1, runner.getExitCode());
        }

        @Test
        @DisplayName("leaves serve mode to the web server")
        void skipsServe() throws Exception {
            RoutingEngine engine = mock(RoutingEngine.class);
            HealthCheckService health = healthService(HealthStatus.Status.DOWN);
            var runner = new CliRunner(new RoutewiseCommand(), createFactory(engine, health));

            runner.run("serve");

            assertEquals(0, runner.getExitCode());
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("ConsoleOutput helpers")
    class ConsoleOutputTests {

        @Test
        @DisplayName("formatDuration picks a readable unit")
        void formatDuration() {
            assertEquals("250ms", ConsoleOutput.formatDuration(250));
            assertEquals("12s", ConsoleOutput.formatDuration(12_000));
            assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
        }

        @Test
        @DisplayName("truncate shortens long text and marks empty text")
        void truncate() {
            assertEquals("abcdefg...", ConsoleOutput.truncate("abcdefghijklmnop", 10));
            assertEquals("short", ConsoleOutput.truncate("short", 10));
            assertEquals("-", ConsoleOutput.truncate(null, 10));
        }
    }
}
