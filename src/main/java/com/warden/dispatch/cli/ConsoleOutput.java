package com.warden.dispatch.cli;

import com.warden.core.confirmation.ConfirmationSnapshot;
import com.warden.core.model.PlanReflection;
import com.warden.core.model.PlanSummary;
import com.warden.core.model.StalledTask;
import com.warden.core.risk.RiskTier;
import picocli.CommandLine;

import java.io.PrintStream;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Renders a pending confirmation the way an approval dialog would.
     */
    public static void confirmation(PrintStream out, ConfirmationSnapshot request) {
        String tier = request.riskTier() == RiskTier.DANGER
                ? "@|bold,fg(red) [DANGER]|@"
                : "@|bold,fg(yellow) [WARNING]|@";
        out.println();
        out.println(CommandLine.Help.Ansi.AUTO.string(tier + " Confirmation " + request.id()));
        out.println("  " + request.description());
        for (String line : request.formattedDetails().split("\n")) {
            if (!line.isBlank()) {
                out.println("    " + line);
            }
        }
        out.println("  Times out in " + request.timeoutSeconds() + "s");
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "plan.created", "plan.started" -> "@|fg(cyan) [PLAN]|@";
            case "task.started", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "confirmation.requested", "confirmation.resolved" -> "@|fg(magenta) [CONFIRM]|@";
            case "plan.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "plan.stalled" -> "@|fg(yellow),bold [STALLED]|@";
            case "plan.cancelled" -> "@|fg(red),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void summary(PlanSummary s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Plan Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + s.total() + " total, @|fg(green) " + s.completed() + " completed|@, @|fg(red) "
                        + s.failed() + " failed|@" + (s.cancelled() > 0 ? ", " + s.cancelled() + " cancelled" : "")
                        + (s.pending() > 0 ? ", " + s.pending() + " pending" : "")));
        System.out.println("  Progress: " + s.progressPercent() + "%");
        if (s.durationMs() != null) {
            System.out.println("  Duration: " + formatDuration(s.durationMs()));
        }
        for (StalledTask stalled : s.stalled()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) stalled|@ " + stalled.taskId() + ": " + stalled.reason()));
        }
    }

    public static void reflection(PlanReflection r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Reflection|@ success rate " + Math.round(r.successRate() * 100) + "%"));
        for (String recommendation : r.recommendations()) {
            System.out.println("  - " + recommendation);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
