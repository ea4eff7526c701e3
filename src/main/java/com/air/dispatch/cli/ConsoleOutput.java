package com.air.dispatch.cli;

import com.air.core.model.PatchRecord;
import com.air.core.model.ReviewRecord;
import com.air.core.model.ReviewStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AIR CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AIR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AIR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(ReviewStatus status) {
        switch (status) {
            case DONE -> success("Status: " + status.label());
            case ERROR -> error("Status: " + status.label());
            default -> info("Status: " + status.label());
        }
    }

    public static void review(ReviewRecord r) {
        System.out.println();
        System.out.println("REVIEW " + r.id());
        System.out.println("Owner:  " + r.owner());
        System.out.println("Tree:   " + r.tree() + (r.branch() != null ? " (" + r.branch() + ")" : ""));
        System.out.println("Origin: " + r.origin());
        status(r.status());
        if (r.message() != null) {
            info("Message: " + r.message());
        }
    }

    public static void patches(ReviewRecord r) {
        if (r.patches().isEmpty()) {
            return;
        }
        System.out.println();
        System.out.printf("  %-5s %-14s %-9s %-8s %s%n", "PATCH", "COMMIT", "STATE", "ATTEMPTS", "RESULT");
        System.out.println("  " + "-".repeat(64));
        for (PatchRecord p : r.patches()) {
            String detail = p.result() != null ? p.result() : p.error() != null ? p.error() : "-";
            String line = String.format("  %-5d %-14s %-9s %-8d %s",
                    p.index(), truncate(p.commit(), 12), p.state().label(), p.attempts(), truncate(detail, 60));
            String color = switch (p.state()) {
                case DONE -> "fg(green)";
                case ERROR -> "fg(red)";
                case SKIPPED -> "faint";
                default -> "fg(white)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + line + "|@"));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
