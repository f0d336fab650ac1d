package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.events.LoreEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Lorekeeper CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LOREKEEPER v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LOREKEEPER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tentative(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [TENTATIVE]|@ " + message));
    }

    public static void curation(CurationReport report) {
        if (report == null) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Curation|@ " + report.taskId()
                + ": @|fg(green) " + report.promoted().size() + " promoted|@"
                + ", " + report.dismissed().size() + " dismissed"
                + (report.disputed().isEmpty() ? "" : ", @|fg(red) " + report.disputed().size() + " disputed|@")
                + (report.leftPending().isEmpty() ? "" : ", " + report.leftPending().size() + " left pending")));
        for (String installed : report.canonVersionsInstalled()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) canon|@ " + installed));
        }
    }

    public static void watchEvent(LoreEvent event) {
        String prefix = switch (event.eventType()) {
            case LoreEvent.SESSION_OPENED, LoreEvent.SESSION_CLOSED -> "@|fg(cyan) [SESSION]|@";
            case LoreEvent.DISPATCH_REQUESTED, LoreEvent.DISPATCH_COMPLETED -> "@|fg(blue) [DISPATCH]|@";
            case LoreEvent.DISPATCH_FAILED -> "@|fg(red) [DISPATCH]|@";
            case LoreEvent.DISPATCH_DECLINED -> "@|fg(yellow) [DECLINED]|@";
            case LoreEvent.BUFFER_APPENDED -> "@|fg(yellow) [BUFFER]|@";
            case LoreEvent.CANON_INSTALLED -> "@|fg(green),bold [CANON]|@";
            case LoreEvent.DISPUTE_OPENED, LoreEvent.DISPUTE_RESOLVED -> "@|fg(magenta) [DISPUTE]|@";
            case LoreEvent.CURATION_COMPLETED -> "@|fg(green) [CURATOR]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String who = event.agentId() == null ? "" : event.agentId() + " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + who + event.payload()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String abbreviate(String s, int max) {
        if (s == null) return "";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
