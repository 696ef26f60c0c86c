package com.anton.dispatch.cli;

import com.anton.config.AntonProperties;
import com.anton.config.RunControllerFactory;
import com.anton.core.engine.RunController;
import com.anton.core.model.RunResult;
import com.anton.core.model.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: anton run &lt;taskFile&gt;
 * <p>
 * Works through the task file until every task is resolved or the run stops. Ctrl-C is an
 * intentional stop: the in-flight turn is cancelled and the lock released before exit.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the agent through a task file")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_LOCKED = 2;
    static final int EXIT_DIRTY = 3;
    static final long SHUTDOWN_GRACE_SECONDS = 30;

    @Parameters(index = "0", description = "Markdown task file")
    private Path taskFile;

    @Option(names = {"--project-dir", "-C"}, description = "Project working tree (default: current directory)")
    private Path projectDir;

    @Option(names = "--preflight", description = "Run discovery and requirements review before each task")
    private boolean preflight;

    @Option(names = "--no-auto-commit", description = "Leave verified changes uncommitted")
    private boolean noAutoCommit;

    @Option(names = "--skip-on-fail", description = "Skip tasks that exhaust their retries instead of stopping")
    private boolean skipOnFail;

    @Option(names = "--rollback-on-fail", description = "Revert the edits of failed attempts")
    private boolean rollbackOnFail;

    @Option(names = "--branch", description = "Create a fresh branch before the first task")
    private boolean branch;

    @Option(names = "--dry-run", description = "Print the plan without running any task")
    private boolean dryRun;

    private final RunControllerFactory controllerFactory;

    public RunCommand(RunControllerFactory controllerFactory) {
        this.controllerFactory = controllerFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path project = projectDir != null ? projectDir : Path.of("").toAbsolutePath();
        AntonProperties.RunOverrides overrides = new AntonProperties.RunOverrides(
                preflight ? Boolean.TRUE : null,
                noAutoCommit ? Boolean.FALSE : null,
                skipOnFail ? Boolean.TRUE : null,
                rollbackOnFail ? Boolean.TRUE : null,
                branch ? Boolean.TRUE : null,
                dryRun);
        RunController controller = controllerFactory.create(project, overrides, ConsoleOutput::progress);

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            controller.stop();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Run did not stop within {}s of the interrupt", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "anton-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        RunResult result;
        try {
            result = controller.start(taskFile);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
        return exitCode(result);
    }

    static int exitCode(RunResult result) {
        StopReason reason = result.stopReason();
        if (reason == StopReason.LOCK_CONTENTION) {
            return EXIT_LOCKED;
        }
        if (reason == StopReason.DIRTY_TREE) {
            return EXIT_DIRTY;
        }
        return reason.isFailure() ? EXIT_FAILURE : EXIT_OK;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress, keeping hook");
        }
    }
}
