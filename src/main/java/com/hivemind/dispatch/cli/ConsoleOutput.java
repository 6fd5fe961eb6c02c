package com.hivemind.dispatch.cli;

import com.hivemind.core.model.Decision;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.execution.WaveOutcome;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [QUEEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String role, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + role + "]|@ " + message));
    }

    public static void task(String taskId, String status, String content, String assignee) {
        String color = switch (status) {
            case "COMPLETED" -> "fg(green)";
            case "FAILED", "CANCELLED" -> "fg(red)";
            case "IN_PROGRESS" -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + status + "|@ " + taskId + " " + content
                        + (assignee != null ? " @|faint (" + assignee + ")|@" : "")));
    }

    public static void plan(ExecutionPlan plan) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Strategy:|@ " + plan.strategy() + " (" + plan.waves().size() + " waves)"));
        for (ExecutionPlan.Wave wave : plan.waves()) {
            String roles = wave.assignments().stream()
                    .map(a -> a.role().tag() + "×" + a.taskIds().size())
                    .collect(Collectors.joining(", "));
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) [WAVE " + wave.number() + "]|@ " + roles));
        }
        if (!plan.unplannedTaskIds().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) unplanned:|@ " + String.join(", ", plan.unplannedTaskIds())));
        }
    }

    public static void waveComplete(WaveOutcome outcome) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [WAVE " + outcome.waveNumber() + " COMPLETE]|@ " +
                "@|fg(green) " + outcome.completed() + " completed|@" +
                (outcome.remediated() > 0 ? ", @|fg(cyan) " + outcome.remediated() + " remediated|@" : "") +
                (outcome.failed() > 0 ? ", @|fg(red) " + outcome.failed() + " failed|@" : "")));
    }

    public static void progress(ProgressReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Progress:|@ " + String.format("%.1f%%", report.overallProgress())
                        + "  ETA " + report.estimatedCompletion()));
        for (String issue : report.blockingIssues()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) -|@ " + issue));
        }
    }

    public static void decision(Decision decision) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) Decision:|@ " + decision.chosenOption()
                        + " (confidence " + String.format("%.2f", decision.confidence()) + ")"));
        System.out.println("  " + decision.reasoning());
    }
}
