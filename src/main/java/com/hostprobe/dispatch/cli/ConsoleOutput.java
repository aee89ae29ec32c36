package com.hostprobe.dispatch.cli;

import com.hostprobe.core.exec.ExecutionResult;
import com.hostprobe.core.security.Rejection;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the hostprobe CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HOSTPROBE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HOSTPROBE]|@ " + message));
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

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + label + ":|@ " + (value == null ? "-" : value)));
    }

    public static void rejection(Rejection rejection) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red),bold [REJECTED " + rejection.kind() + "]|@ " + rejection.detail()));
    }

    public static void execution(ExecutionResult result) {
        String outcome = switch (result.outcome()) {
            case COMPLETED -> result.exitCode() != null && result.exitCode() == 0
                    ? "@|fg(green) COMPLETED|@" : "@|fg(yellow) COMPLETED|@";
            case TIMED_OUT -> "@|fg(red),bold TIMED OUT|@";
            case SPAWN_FAILED -> "@|fg(red),bold SPAWN FAILED|@";
        };
        var line = new StringBuilder(outcome);
        if (result.exitCode() != null) {
            line.append(" exit=").append(result.exitCode());
        }
        if (result.signal() != null) {
            line.append(" signal=").append(result.signal());
        }
        line.append(" (").append(formatDuration(result.durationMillis())).append(")");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
        if (result.error() != null) {
            error(result.error());
        }
        printStream("stdout", result.stdout(), result.stdoutTruncated());
        printStream("stderr", result.stderr(), result.stderrTruncated());
    }

    private static void printStream(String name, String text, boolean truncated) {
        if (text == null || text.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint --- " + name + " ---|@"));
        System.out.print(text);
        if (!text.endsWith("\n")) {
            System.out.println();
        }
        if (truncated) {
            warn(name + " truncated at the output cap");
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String formatBytes(long bytes) {
        if (bytes < 0) return "N/A";
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        if (bytes < 1024L * 1024 * 1024) return String.format("%.1f MB", bytes / (1024.0 * 1024));
        return String.format("%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
