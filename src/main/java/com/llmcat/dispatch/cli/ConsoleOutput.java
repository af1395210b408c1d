package com.llmcat.dispatch.cli;

import picocli.CommandLine;

import java.io.PrintStream;

/**
 * ANSI-colored status output for the llmcat CLI. Everything goes to stderr;
 * stdout is reserved for the document itself.
 */
public class ConsoleOutput {

    private static final String CAT =
            "\n"
            + "      |\\      _,,,---,,_\n"
            + "ZZZzz /,`.-'`'    -.  ;-;;,_\n"
            + "     |,4-  ) )-,_. ,\\ (  `'-'\n"
            + "    '---''(_/--'  `-'\\_)\n";

    private ConsoleOutput() {
        // utility class
    }

    private static PrintStream err() {
        return System.err;
    }

    public static void info(String message) {
        err().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LLMCAT]|@ " + message));
    }

    public static void error(String message) {
        err().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Recap after --count-tokens. {@code files} is printed when non-negative. */
    public static void tokenCount(long tokens, int files) {
        cat();
        meow("Token count: " + tokens);
        processed(files);
    }

    public static void written(String path, long tokens) {
        cat();
        meow("Content written to " + path);
        err().println("Token count: " + tokens);
    }

    public static void copied(long tokens, int files) {
        cat();
        meow("Content copied to clipboard!");
        err().println("Token count: " + tokens);
        processed(files);
    }

    public static void failedTasks(int failed) {
        if (failed > 0) {
            err().println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) !|@ " + failed + " target" + (failed != 1 ? "s" : "")
                            + " could not be read; see inline errors"));
        }
    }

    private static void cat() {
        err().print(CAT);
    }

    private static void meow(String message) {
        err().println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) Meow!|@ " + message));
    }

    private static void processed(int files) {
        if (files >= 0) {
            err().println("Processed " + files + " files");
        }
    }
}
