package com.prioritymind.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Prioritymind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PRIORITYMIND v0.1.0|@"));
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PRIORITYMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }
}
