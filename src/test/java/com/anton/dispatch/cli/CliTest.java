package com.anton.dispatch.cli;

import com.anton.config.AntonProperties;
import com.anton.config.RunControllerFactory;
import com.anton.core.engine.RunController;
import com.anton.core.lock.LockManager;
import com.anton.core.model.RunResult;
import com.anton.core.model.StopReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Anton CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    @TempDir
    Path dir;

    private record CliResult(int exitCode, String output) {}

    private static RunResult result(StopReason reason) {
        return RunResult.aborted("r1", reason, null, Duration.ZERO);
    }

    private CommandLine.IFactory createFactory(RunControllerFactory controllers, LockManager locks) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(controllers);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(locks);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(RunControllerFactory controllers, LockManager locks, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AntonCommand(),
                    createFactory(controllers, locks != null ? locks : new LockManager(dir.resolve("state"))));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(RunControllerFactory.class), null, args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("plan"));
            assertTrue(result.output().contains("status"));
            assertTrue(result.output().contains("one verified commit per task"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Anton 0.1.0"));
        }

        @Test
        @DisplayName("run --help documents the overrides")
        void runHelp() {
            CliResult result = execute("run", "--help");

            assertTrue(result.output().contains("--skip-on-fail"));
            assertTrue(result.output().contains("--dry-run"));
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("passes only the flags given on the command line as overrides")
        void overrides() {
            RunControllerFactory controllers = mock(RunControllerFactory.class);
            RunController controller = mock(RunController.class);
            when(controllers.create(any(), any(), any())).thenReturn(controller);
            when(controller.start(any())).thenReturn(result(StopReason.ALL_DONE));

            CliResult result = execute(controllers, null, "run", "TASKS.md", "-C", dir.toString(),
                    "--no-auto-commit", "--skip-on-fail");

            assertEquals(RunCommand.EXIT_OK, result.exitCode());
            ArgumentCaptor<AntonProperties.RunOverrides> overrides =
                    ArgumentCaptor.forClass(AntonProperties.RunOverrides.class);
            verify(controllers).create(eq(dir), overrides.capture(), any());
            assertEquals(new AntonProperties.RunOverrides(null, false, true, null, null, false), overrides.getValue());
            verify(controller).start(Path.of("TASKS.md"));
        }

        @Test
        @DisplayName("lock contention and dirty trees have their own exit codes")
        void exitCodes() {
            assertEquals(RunCommand.EXIT_OK, RunCommand.exitCode(result(StopReason.ALL_DONE)));
            assertEquals(RunCommand.EXIT_OK, RunCommand.exitCode(result(StopReason.ABORTED)));
            assertEquals(RunCommand.EXIT_OK, RunCommand.exitCode(result(StopReason.TOTAL_TIMEOUT)));
            assertEquals(RunCommand.EXIT_LOCKED, RunCommand.exitCode(result(StopReason.LOCK_CONTENTION)));
            assertEquals(RunCommand.EXIT_DIRTY, RunCommand.exitCode(result(StopReason.DIRTY_TREE)));
            assertEquals(RunCommand.EXIT_FAILURE, RunCommand.exitCode(result(StopReason.TASK_FAILED)));
        }

        @Test
        @DisplayName("a missing task file argument is a usage error")
        void missingArgument() {
            CliResult result = execute("run");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("prints the pending tasks")
        void printsPlan() throws IOException {
            Path tasks = dir.resolve("TASKS.md");
            Files.writeString(tasks, "# Phase\n- [x] Done already\n- [ ] Add cache\n- [ ] Add metrics\n");

            CliResult result = execute("plan", tasks.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 pending tasks"));
            assertTrue(result.output().contains("• Add cache"));
            assertFalse(result.output().contains("• Done already"));
        }

        @Test
        @DisplayName("a missing file fails with exit code 1")
        void missingFile() {
            CliResult result = execute("plan", dir.resolve("nope.md").toString());

            assertEquals(1, result.exitCode());
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("reports no run when the lock is free")
        void idle() {
            CliResult result = execute("status");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No run in progress."));
        }

        @Test
        @DisplayName("shows the holder of a live lock")
        void held() {
            LockManager locks = new LockManager(dir.resolve("state"), Duration.ofHours(1), Clock.systemUTC(),
                    pid -> true, 777);
            locks.acquire("/work/TASKS.md", "/work");

            CliResult result = execute(mock(RunControllerFactory.class), locks, "status");

            assertTrue(result.output().contains("Run in progress"));
            assertTrue(result.output().contains("PID:       777"));
            assertTrue(result.output().contains("/work/TASKS.md"));
        }
    }

    @Test
    @DisplayName("no arguments prints banner and usage")
    void noArgs() {
        CliResult result = execute();

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("Usage: anton"));
        assertTrue(result.output().contains("ANTON v0.1.0"));
    }
}
