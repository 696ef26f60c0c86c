package com.anton.dispatch.cli;

import com.anton.core.model.TaskFile;
import com.anton.core.progress.ProgressReporter;
import com.anton.core.tasks.TaskFileException;
import com.anton.core.tasks.TaskFileParser;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: anton plan &lt;taskFile&gt;
 * <p>
 * Parses the task file and prints the pending plan. Takes no lock and touches nothing.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the pending tasks in a task file")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Markdown task file")
    private Path taskFile;

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        TaskFile file;
        try {
            file = TaskFileParser.parse(taskFile.toAbsolutePath());
        } catch (TaskFileException e) {
            ConsoleOutput.error(e.getMessage());
            return RunCommand.EXIT_FAILURE;
        }
        System.out.println(ProgressReporter.dryRunPlan(file));
        return RunCommand.EXIT_OK;
    }
}
