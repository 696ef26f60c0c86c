package com.anton.dispatch.cli;

import com.anton.core.progress.ProgressEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Anton CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ANTON v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ANTON]|@ " + message));
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
     * Prints one progress notification. Text is preformatted; only the prefix is styled.
     */
    public static void progress(ProgressEvent event) {
        String prefix = switch (event.type()) {
            case RUN_START -> "@|bold,fg(cyan) [RUN]|@";
            case STAGE -> "@|fg(magenta) [STAGE]|@";
            case TASK_START, TASK_END -> "@|fg(blue) [TASK]|@";
            case TASK_SKIP -> "@|fg(yellow) [SKIP]|@";
            case HEARTBEAT -> "@|faint [..]|@";
            case LOOP -> "@|fg(red) [LOOP]|@";
            case RUN_COMPLETE -> "@|bold,fg(green) [DONE]|@";
        };
        // Event text is user content and may carry @| markers; keep it out of the markup.
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix) + " " + event.message());
    }
}
