package com.routewise.dispatch.cli;

import com.routewise.core.model.FallbackDecision;
import com.routewise.core.model.Recommendation;
import com.routewise.core.model.SelectionPlan;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Routewise CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROUTEWISE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUTEWISE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(SelectionPlan plan) {
        if (!plan.isResolved()) {
            error("No provider available for " + plan.complexity() + " request (plan " + plan.planId() + ")");
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Plan|@ " + plan.planId() + "  @|fg(yellow) " + plan.complexity() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Primary:    @|fg(green) " + plan.primaryProviderId() + "|@"));
        if (!plan.secondaryProviderIds().isEmpty()) {
            System.out.println("  Secondary:  " + String.join(", ", plan.secondaryProviderIds()));
        }
        System.out.println("  Order:      " + String.join(" -> ", plan.executionOrder()));
        System.out.printf("  Confidence: %.2f%n", plan.confidence());
    }

    public static void recommendation(Recommendation r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|fg(green) %-16s|@ match %.2f  confidence %.2f  %s",
                r.providerId(), r.matchScore(), r.confidence(), r.matchedKeywords())));
    }

    public static void fallback(FallbackDecision decision) {
        if (!decision.shouldFallback()) {
            success("No fallback needed");
            return;
        }
        String color = decision.level().isUserVisible() ? "fg(red)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + color + " [LEVEL " + decision.level().rank() + "]|@ " + decision.description()));
        if (!decision.recommendedTools().isEmpty()) {
            System.out.println("  Tools:    " + String.join(", ", decision.recommendedTools()));
        }
        if (!decision.recommendedServices().isEmpty()) {
            System.out.println("  Services: " + String.join(", ", decision.recommendedServices()));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
