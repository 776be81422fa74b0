package com.reflow.dispatch.cli;

import com.reflow.core.engine.RunSummary;
import com.reflow.core.events.RecoveryEvent;
import com.reflow.core.model.TaskOutcome;
import com.reflow.core.model.TaskResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Reflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) REFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** One line per event for --watch. */
    public static void event(RecoveryEvent event) {
        String step = event.stepIndex() != null ? " step " + event.stepIndex() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + event.eventType() + "]|@ " + event.taskId() + step + " " + event.payload()));
    }

    public static void taskResult(TaskResult result) {
        String color = switch (result.outcome()) {
            case SUCCESS -> "fg(green)";
            case ESCALATED -> "fg(yellow)";
            case FAILED, UNHANDLED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-10s", result.outcome()) + "|@ "
                        + String.format("%-24s", result.taskId()) + " " + result.reason()
                        + (result.consistent() ? "" : " @|fg(red) [inconsistent]|@")));
    }

    public static void summary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run Summary|@ (" + summary.strategy().code() + ", seed " + summary.seed() + ")"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + summary.count(TaskOutcome.SUCCESS) + " succeeded|@, @|fg(yellow) "
                        + summary.count(TaskOutcome.ESCALATED) + " escalated|@, @|fg(red) "
                        + summary.count(TaskOutcome.FAILED) + " failed|@, @|fg(red) "
                        + summary.count(TaskOutcome.UNHANDLED) + " unhandled|@"));
        System.out.printf("  Handled: %.1f%% | Inconsistent: %d | Diagnosis calls: %d | Memory hits: %d%n",
                summary.handledRate() * 100, summary.inconsistentTasks(),
                summary.diagnosisCalls(), summary.memoryHits());
    }
}
