package com.assetdiffbot.dispatch.cli;

import com.assetdiffbot.core.events.JobEvent;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ASSET DIFF BOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ASSETDIFF]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void queueEntry(String id, String type, String detail) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) " + id + "|@ " + type + (detail == null ? "" : " " + detail)));
    }

    public static void jobEvent(JobEvent event) {
        String prefix = switch (event.eventType()) {
            case JobEvent.QUEUED -> "@|fg(cyan) [QUEUED]|@";
            case JobEvent.STARTED -> "@|fg(blue) [STARTED]|@";
            case JobEvent.COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case JobEvent.FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.jobId() + formatPayload(event.payload())));
    }

    private static String formatPayload(Map<String, Object> payload) {
        if (payload.isEmpty()) return "";
        return payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
