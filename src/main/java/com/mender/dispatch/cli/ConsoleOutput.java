package com.mender.dispatch.cli;

import com.mender.core.model.Fix;
import com.mender.core.model.MissionStats;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Mender CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MENDER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MENDER]|@ " + message));
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

    public static void stats(MissionStats s) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Mission Statistics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Missions: " + s.total() + " total, @|fg(green) " + s.completed() + " completed|@, @|fg(red) "
                        + s.failed() + " failed|@, " + s.active() + " active"));
        System.out.println("  Avg fix confidence: " + String.format(Locale.ROOT, "%.1f%%", s.avgConfidence()));
    }

    public static void fix(Fix fix) {
        String status = switch (fix.status()) {
            case APPLIED, TESTED, DEPLOYED -> "@|fg(green) " + fix.status().value() + "|@";
            case FAILED, REVERTED -> "@|fg(red) " + fix.status().value() + "|@";
            case GENERATED -> "@|fg(yellow) " + fix.status().value() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + fix.id() + " [" + fix.riskAssessment().level().value() + " risk] "
                        + fix.description()));
        fix.changes().forEach(c -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(cyan) " + c.operation().value() + "|@ " + c.path())));
    }
}
