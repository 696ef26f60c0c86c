package com.anton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Anton.
 */
@Command(
        name = "anton",
        mixinStandardHelpOptions = true,
        version = "Anton 0.1.0",
        description = "Works through a markdown checklist with a coding agent, one verified commit per task",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AntonCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
