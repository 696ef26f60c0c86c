package com.anton.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle. Subcommands are Spring beans created through
 * the picocli-spring factory; the command's exit code becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final AntonCommand antonCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AntonCommand antonCommand, IFactory factory) {
        this.antonCommand = antonCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(antonCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parsed) -> {
                    log.error("Command '{}' failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                    return RunCommand.EXIT_FAILURE;
                })
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
