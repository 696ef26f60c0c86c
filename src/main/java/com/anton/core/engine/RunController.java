package com.anton.core.engine;

import com.anton.core.knowledge.KnowledgeStore;
import com.anton.core.lock.LockContentionException;
import com.anton.core.lock.LockException;
import com.anton.core.lock.LockHandle;
import com.anton.core.lock.LockManager;
import com.anton.core.logging.MdcContext;
import com.anton.core.metrics.AntonMetrics;
import com.anton.core.model.AgentResult;
import com.anton.core.model.AttemptStatus;
import com.anton.core.model.LoopEvent;
import com.anton.core.model.LoopEventKind;
import com.anton.core.model.PreflightRecord;
import com.anton.core.model.ProgressSnapshot;
import com.anton.core.model.RunConfig;
import com.anton.core.model.RunResult;
import com.anton.core.model.RunState;
import com.anton.core.model.StopReason;
import com.anton.core.model.Task;
import com.anton.core.model.TaskAttempt;
import com.anton.core.model.TaskFile;
import com.anton.core.progress.ProgressChannel;
import com.anton.core.progress.ProgressEvent;
import com.anton.core.progress.ProgressEventType;
import com.anton.core.progress.ProgressListener;
import com.anton.core.progress.ProgressReporter;
import com.anton.core.progress.Stage;
import com.anton.core.prompt.PromptBuilder;
import com.anton.core.prompt.PromptRequest;
import com.anton.core.prompt.ResultParser;
import com.anton.core.prompt.TokenEstimator;
import com.anton.core.session.AgentSession;
import com.anton.core.session.AgentSessionException;
import com.anton.core.session.AgentSessionFactory;
import com.anton.core.session.SessionConfigBuilder;
import com.anton.core.session.SessionDefaults;
import com.anton.core.session.ToolLoopException;
import com.anton.core.tasks.TaskFileException;
import com.anton.core.tasks.TaskFileParser;
import com.anton.core.tasks.TaskLedger;
import com.anton.core.vcs.DirtyWorkingTreeException;
import com.anton.core.vcs.GitSafetyNet;
import com.anton.core.vcs.VcsException;
import com.anton.core.verify.TaskVerifier;
import com.anton.core.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Drives one run over a task file: picks the next runnable task, prompts a fresh agent
 * session, applies the outcome policy (commit, retry, skip, decompose, rollback) and reports
 * progress until the list is exhausted, a budget runs out or a stop is requested.
 *
 * <p>{@link #start} runs synchronously on the caller's thread. {@link #stop} and
 * {@link #status} are safe from any thread. Tasks execute strictly one at a time.
 */
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    static final int RETRY_CONTEXT_TRIM = 1000;
    static final Duration MIN_HEARTBEAT = Duration.ofSeconds(5);
    private static final Duration HEARTBEAT_SHUTDOWN_WAIT = Duration.ofSeconds(2);
    static final String COMMIT_PREFIX = "Anton: ";

    private final RunConfigResolver configResolver;
    private final LockManager lockManager;
    private final AgentSessionFactory sessionFactory;
    private final SessionDefaults sessionDefaults;
    private final TaskVerifier verifier;
    private final AntonMetrics metrics;
    private final Function<Path, GitSafetyNet> gitFactory;
    private final Function<RunConfig, KnowledgeStore> knowledgeFactory;
    private final ProgressListener listener;
    private final Clock clock;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile TurnRunner turns;
    private volatile ProgressSnapshot snapshot = ProgressSnapshot.empty();
    private volatile Instant startedAt;
    private volatile LoopEvent lastLoopEvent;
    private volatile RunResult lastResult;

    public RunController(RunConfigResolver configResolver, LockManager lockManager,
                         AgentSessionFactory sessionFactory, SessionDefaults sessionDefaults,
                         TaskVerifier verifier, AntonMetrics metrics,
                         Function<Path, GitSafetyNet> gitFactory,
                         Function<RunConfig, KnowledgeStore> knowledgeFactory,
                         ProgressListener listener, Clock clock) {
        this.configResolver = configResolver;
        this.lockManager = lockManager;
        this.sessionFactory = sessionFactory;
        this.sessionDefaults = sessionDefaults;
        this.verifier = verifier;
        this.metrics = metrics;
        this.gitFactory = gitFactory;
        this.knowledgeFactory = knowledgeFactory;
        this.listener = listener;
        this.clock = clock;
    }

    // --- Control surface ---

    /**
     * Runs the task file to completion on the calling thread.
     *
     * @throws IllegalStateException if this controller already has a run in flight
     */
    public RunResult start(Path taskFile) {
        RunState current = state.get();
        if (current == RunState.RUNNING || current == RunState.STOPPING
                || !state.compareAndSet(current, RunState.RUNNING)) {
            throw new IllegalStateException("A run is already in progress");
        }
        stopRequested.set(false);
        lastLoopEvent = null;
        snapshot = ProgressSnapshot.empty();
        startedAt = clock.instant();
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        log.info("Run {} starting for {}", runId, taskFile);

        RunResult result = null;
        try (ProgressChannel channel = new ProgressChannel(); TurnRunner turnRunner = new TurnRunner()) {
            if (listener != null) {
                channel.subscribe(listener);
            }
            turns = turnRunner;
            result = execute(runId, taskFile, channel);
            metrics.recordDroppedProgressEvents(channel.droppedCount());
            return result;
        } finally {
            turns = null;
            lastResult = result;
            state.set(finalState(result));
            MdcContext.clear();
        }
    }

    /**
     * Requests a cooperative stop. The in-flight turn, if any, is cancelled through its
     * session; the run ends at the next task boundary. A no-op when no run is active.
     */
    public void stop() {
        if (state.get() != RunState.RUNNING || !stopRequested.compareAndSet(false, true)) {
            return;
        }
        state.compareAndSet(RunState.RUNNING, RunState.STOPPING);
        log.info("Stop requested");
        TurnRunner runner = turns;
        if (runner != null) {
            runner.cancelInFlight();
        }
    }

    public RunStatus status() {
        return new RunStatus(state.get(), liveSnapshot(), lastLoopEvent, lastResult);
    }

    // --- Run lifecycle ---

    private RunResult execute(String runId, Path taskFile, ProgressChannel channel) {
        RunConfig config;
        try {
            config = configResolver.resolve(taskFile);
        } catch (RuntimeException e) {
            log.error("Could not resolve run configuration: {}", e.getMessage(), e);
            return finish(RunResult.aborted(runId, StopReason.FATAL_ERROR, e.getMessage(), elapsed()), null);
        }
        ActiveRun run = new ActiveRun(runId, config, channel, gitFactory.apply(config.projectDir()));

        try {
            if (config.dryRun()) {
                return dryRun(run);
            }
            try {
                run.git.ensureClean();
            } catch (DirtyWorkingTreeException e) {
                log.warn("Refusing to start: {}", e.getMessage());
                return finish(RunResult.aborted(runId, StopReason.DIRTY_TREE, e.getMessage(), elapsed()), run);
            }

            LockHandle handle;
            try {
                handle = lockManager.acquire(config.taskFile().toString(), config.projectDir().toString());
            } catch (LockContentionException e) {
                log.warn("Refusing to start: {}", e.getMessage());
                return finish(RunResult.aborted(runId, StopReason.LOCK_CONTENTION, e.getMessage(), elapsed()), run);
            }

            ScheduledExecutorService heartbeat = startHeartbeat(run, handle);
            try {
                return finish(mainLoop(run), run);
            } finally {
                stopHeartbeat(heartbeat);
                lockManager.release(handle);
            }
        } catch (TaskFileException e) {
            log.error("Task file unreadable: {}", e.getMessage());
            return finish(RunResult.aborted(runId, StopReason.TASK_FILE_ERROR, e.getMessage(), elapsed()), run);
        } catch (VcsException e) {
            log.error("Version control failure: {}", e.getMessage(), e);
            return finish(RunResult.aborted(runId, StopReason.VCS_ERROR, e.getMessage(), elapsed()), run);
        } catch (LockException e) {
            log.error("Lock failure: {}", e.getMessage(), e);
            return finish(RunResult.aborted(runId, StopReason.FATAL_ERROR, e.getMessage(), elapsed()), run);
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly", runId, e);
            return finish(RunResult.aborted(runId, StopReason.FATAL_ERROR, String.valueOf(e.getMessage()),
                    elapsed()), run);
        }
    }

    private RunResult dryRun(ActiveRun run) {
        TaskFile file = TaskFileParser.parse(run.config.taskFile());
        TaskLedger ledger = new TaskLedger(file);
        run.channel.publish(ProgressEvent.of(ProgressEventType.RUN_COMPLETE, run.runId,
                ProgressReporter.dryRunPlan(file), liveSnapshot()));
        RunResult result = new RunResult(run.runId, StopReason.ALL_DONE, "dry run", file.totalCount(),
                ledger.initialCompleted(), List.of(), List.of(), List.of(), List.of(), ledger.remainingCount(),
                List.of(), List.of(), List.of(), elapsed());
        metrics.recordRunResult(result.stopReason());
        return result;
    }

    private RunResult mainLoop(ActiveRun run) {
        RunConfig config = run.config;
        TaskFile file = TaskFileParser.parse(config.taskFile());
        run.ledger = new TaskLedger(file);
        run.displayPath = displayPath(config.projectDir(), config.taskFile());
        run.gitAvailable = run.git.isInsideWorkTree();
        if (!run.gitAvailable) {
            log.warn("{} is not a git work tree; commits and rollback are disabled", config.projectDir());
        }
        if (config.branch() != null && !config.branch().isBlank() && run.gitAvailable) {
            run.git.createBranch(config.branch());
        }
        run.prompts = new PromptBuilder(knowledgeFactory.apply(config));
        run.preflight = new PreflightRunner(sessionFactory, sessionDefaults, turns, metrics,
                (stage, message) -> stage(run, stage, message), clock);

        publish(run, ProgressEventType.RUN_START, ProgressReporter.runStart(file));
        updateSnapshot(run, null, 0);

        StopReason stop;
        String detail = null;
        try {
            while (true) {
                Optional<Stop> limit = checkLimits(run);
                if (limit.isPresent()) {
                    stop = limit.get().reason();
                    detail = limit.get().detail();
                    break;
                }
                Optional<Task> next = run.ledger.nextRunnable();
                if (next.isEmpty()) {
                    stop = StopReason.ALL_DONE;
                    break;
                }
                Stop halted = runTask(run, next.get());
                if (halted != null) {
                    stop = halted.reason();
                    detail = halted.detail();
                    break;
                }
            }
        } catch (TaskFileException e) {
            log.error("Task file became unreadable: {}", e.getMessage());
            stop = StopReason.TASK_FILE_ERROR;
            detail = e.getMessage();
        } catch (VcsException e) {
            log.error("Version control failure, halting: {}", e.getMessage(), e);
            stop = StopReason.VCS_ERROR;
            detail = e.getMessage();
        }
        return summarize(run, stop, detail);
    }

    /**
     * Stop conditions evaluated between tasks. Re-reads the task file so edits made during the
     * run are merged before the next pick.
     */
    private Optional<Stop> checkLimits(ActiveRun run) {
        RunConfig config = run.config;
        if (stopRequested.get()) {
            return Optional.of(new Stop(StopReason.ABORTED, null));
        }
        if (config.totalTimeout() != null && elapsed().compareTo(config.totalTimeout()) >= 0) {
            return Optional.of(new Stop(StopReason.TOTAL_TIMEOUT,
                    "ran for " + ProgressReporter.formatDuration(elapsed())));
        }
        if (run.iterations >= config.maxTotalIterations()) {
            return Optional.of(new Stop(StopReason.MAX_ITERATIONS, run.iterations + " attempts dispatched"));
        }
        run.ledger.refresh(TaskFileParser.parse(config.taskFile()));
        if (run.ledger.totalCount() > config.maxTotalTasks()) {
            return Optional.of(new Stop(StopReason.MAX_TASKS_EXCEEDED,
                    run.ledger.totalCount() + " tasks exceed the limit of " + config.maxTotalTasks()));
        }
        return Optional.empty();
    }

    // --- One task ---

    private Stop runTask(ActiveRun run, Task task) {
        RunConfig config = run.config;
        int attemptNo = run.attemptsByTask.merge(task.key(), 1, Integer::sum);
        run.iterations++;
        MdcContext.setTask(task.key(), attemptNo);
        try {
            updateSnapshot(run, task, attemptNo);
            publish(run, ProgressEventType.TASK_START, ProgressReporter.taskStart(task, attemptNo, snapshot));

            if (config.preflight().enabled() && attemptNo == 1) {
                stage(run, Stage.RUNTIME_PREFLIGHT, task.text());
                Instant preflightStart = clock.instant();
                PreflightOutcome preflight = run.preflight.run(task, config, run.displayPath, run.git);
                run.preflightRecords.addAll(preflight.records());
                switch (preflight.kind()) {
                    case ALREADY_COMPLETE -> {
                        run.autoCompleted.add(task.text());
                        markDone(run, task);
                        return null;
                    }
                    case PLANNED -> run.plans.put(task.key(), preflight.planFile());
                    case FAILED -> {
                        TaskAttempt failed = new TaskAttempt(task.key(), task.text(), attemptNo,
                                preflight.failureStatus(), preflight.reason(),
                                Duration.between(preflightStart, clock.instant()), null, null);
                        return afterAttempt(run, task, new AttemptOutcome(failed, List.of(), false, Set.of()));
                    }
                }
            }

            stage(run, Stage.EXECUTING, "Implementation: executing vetted plan...");
            return afterAttempt(run, task, attempt(run, task, attemptNo));
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * One implementation attempt on a fresh session. Never throws for task-level problems;
     * version-control failures propagate and halt the run.
     */
    private AttemptOutcome attempt(ActiveRun run, Task task, int attemptNo) {
        RunConfig config = run.config;
        Instant start = clock.instant();
        Set<String> untrackedBefore = config.rollbackOnFail() && run.gitAvailable
                ? Set.copyOf(run.git.untrackedFiles()) : Set.of();
        AttemptBuilder result = new AttemptBuilder(task, attemptNo, start, untrackedBefore);

        boolean mayDecompose = config.decompose() && task.depth() < config.maxDecomposeDepth();
        PromptRequest request = new PromptRequest(task, children(run, task), run.displayPath,
                run.ledger.initialCompleted() + run.ledger.completedCount(), run.ledger.totalCount(),
                retryContext(run, task), planPath(run, task), config.decompose(), config.maxDecomposeDepth(),
                config.maxContextTokens());
        String prompt = fitPromptBudget(run, request);
        if (prompt == null) {
            int estimated = TokenEstimator.estimate(run.prompts.build(request.withRetryContext(null)));
            return result.exhausted(AttemptStatus.FAILED,
                    "prompt-budget-exceeded: estimated=%d max=%d".formatted(estimated, config.maxPromptTokens()));
        }

        AgentSession session = null;
        try {
            session = sessionFactory.create(SessionConfigBuilder.forImplementation(sessionDefaults, config));
            String output = askWithLoopRecovery(run, session, task, prompt, result);
            if (output == null) {
                return result.build(AttemptStatus.FAILED, "tool-loop: " + result.loopEvent.message());
            }

            AgentResult parsed = ResultParser.parse(output);
            if (parsed.malformed()) {
                log.info("Result block unusable ({}), asking for it once more", parsed.reason());
                String recovered = turns.ask(session, PromptBuilder.formatRecovery(parsed.reason()),
                        config.taskTimeout(), "Format recovery").text();
                AgentResult second = ResultParser.parse(recovered);
                if (second.malformed()) {
                    return result.build(AttemptStatus.FAILED, "structured-result-parse-failure: " + second.reason());
                }
                parsed = second;
            }

            switch (parsed.status()) {
                case BLOCKED:
                    return result.build(AttemptStatus.BLOCKED,
                            parsed.reason() == null || parsed.reason().isBlank() ? "blocked" : parsed.reason());
                case DECOMPOSE:
                    if (!mayDecompose) {
                        return result.build(AttemptStatus.BLOCKED,
                                "decomposition not allowed at depth " + task.depth());
                    }
                    if (parsed.subtasks().isEmpty()) {
                        return result.build(AttemptStatus.FAILED, "decompose result listed no subtasks");
                    }
                    return result.decomposed(parsed.subtasks());
                case DONE:
                default:
                    return completeTask(run, task, session, result);
            }
        } catch (TurnTimeoutException e) {
            result.loopEvent = recordLoop(run, LoopEventKind.FINAL_FAILURE, task, e.getMessage());
            return result.build(AttemptStatus.TIMEOUT, e.getMessage());
        } catch (ToolLoopException e) {
            result.loopEvent = recordLoop(run, LoopEventKind.FINAL_FAILURE, task, e.getMessage());
            return result.build(AttemptStatus.FAILED, "tool-loop: " + e.getMessage());
        } catch (AgentSessionException e) {
            log.warn("Agent session failed on '{}': {}", task.text(), e.getMessage());
            return result.build(AttemptStatus.ERROR, e.isCancelled() ? TaskAttempt.CANCELLED : e.getMessage());
        } finally {
            if (session != null) {
                session.close();
            }
        }
    }

    /**
     * Sends the prompt, continuing the same session after each tool-call loop until the
     * continuation budget is spent.
     *
     * @return the agent's output, or null when the loop budget ran out
     */
    private String askWithLoopRecovery(ActiveRun run, AgentSession session, Task task, String prompt,
                                       AttemptBuilder result) {
        int max = run.config.toolLoopMaxRetries();
        String next = prompt;
        for (int retries = 0; ; retries++) {
            try {
                return turns.ask(session, next, run.config.taskTimeout(), "Task attempt").text();
            } catch (ToolLoopException e) {
                if (retries < max && !stopRequested.get()) {
                    result.loopEvent = recordLoop(run, LoopEventKind.AUTO_RECOVERED, task,
                            "Auto-recovered by continuing (retry %d/%d)".formatted(retries + 1, max));
                    next = PromptBuilder.loopContinuation(e.getMessage());
                    continue;
                }
                result.loopEvent = recordLoop(run, LoopEventKind.FINAL_FAILURE, task,
                        "Final loop failure after %d/%d auto-retries: %s".formatted(retries, max, e.getMessage()));
                return null;
            }
        }
    }

    /**
     * The agent reported done: check scope, commit, then have the diff reviewed. A rejected
     * review gets one fix turn; the fix is folded into the task's commit.
     */
    private AttemptOutcome completeTask(ActiveRun run, Task task, AgentSession session, AttemptBuilder result) {
        RunConfig config = run.config;
        if (run.gitAvailable) {
            VerificationResult scope = verifier.checkScope(task, run.git, config);
            if (!scope.passed()) {
                return result.build(AttemptStatus.FAILED, scope.summary());
            }
        }

        String hash = null;
        if (config.autoCommit() && run.gitAvailable) {
            hash = run.git.commitAll(COMMIT_PREFIX + task.text()).orElse(null);
        }

        VerificationResult review = verifier.reviewDiff(task, diffFor(run, hash), config);
        if (!review.passed()) {
            log.info("Review rejected '{}': {}. Asking for a fix", task.text(), review.aiReason());
            try {
                turns.ask(session, PromptBuilder.verificationFix(review.aiReason()), config.taskTimeout(),
                        "Verification fix");
            } catch (TurnTimeoutException | ToolLoopException | AgentSessionException e) {
                log.warn("Verification fix turn for '{}' failed: {}", task.text(), e.getMessage());
            }
            if (hash != null) {
                hash = run.git.amend();
            }
            review = verifier.reviewDiff(task, diffFor(run, hash), config);
        }
        if (!review.passed()) {
            if (hash != null && config.rollbackOnFail()) {
                run.git.dropLastCommit();
                hash = null;
            } else if (hash != null) {
                run.commits.add(hash);
                metrics.recordCommit();
            }
            result.commitHash = hash;
            return result.build(AttemptStatus.FAILED, review.summary());
        }
        if (hash != null) {
            run.commits.add(hash);
            metrics.recordCommit();
        }
        result.commitHash = hash;
        return result.build(AttemptStatus.PASSED, null);
    }

    /**
     * Applies outcome policy to a finished attempt.
     *
     * @return a stop when the run must end, null to continue
     */
    private Stop afterAttempt(ActiveRun run, Task task, AttemptOutcome outcome) {
        RunConfig config = run.config;
        TaskAttempt attempt = outcome.attempt();
        run.attempts.add(attempt);
        run.lastAttempt.put(task.key(), attempt);
        metrics.recordAttempt(attempt.status(), attempt.duration());
        publish(run, ProgressEventType.TASK_END, ProgressReporter.taskEnd(attempt));

        switch (attempt.status()) {
            case PASSED -> {
                run.streak.reset();
                markDone(run, task);
                return null;
            }
            case DECOMPOSED -> {
                run.streak.reset();
                List<Task> subtasks = run.ledger.decompose(task, outcome.subtasks());
                metrics.recordDecomposition(subtasks.size());
                updateSnapshot(run, null, 0);
                return null;
            }
            default -> {
                // failure handling below
            }
        }

        if (config.rollbackOnFail() && run.gitAvailable) {
            log.info("Rolling back changes from failed attempt {} of '{}'", attempt.attempt(), task.text());
            run.git.rollback(outcome.untrackedBefore(), config.aggressiveClean());
        }
        if (stopRequested.get()) {
            return null;
        }

        int streak = run.streak.record(attempt.reason());
        if (streak > config.maxIdenticalFailures()) {
            return new Stop(StopReason.IDENTICAL_FAILURES,
                    "same failure %d times in a row: %s".formatted(streak, attempt.reason()));
        }

        if (attempt.status() == AttemptStatus.BLOCKED) {
            if (config.skipOnBlocked()) {
                skip(run, task, attempt.reason());
                return null;
            }
            return new Stop(StopReason.TASK_BLOCKED, task.text() + ": " + attempt.reason());
        }

        boolean exhausted = outcome.exhaustRetries()
                || run.attemptsByTask.getOrDefault(task.key(), 0) >= config.maxRetries();
        if (!exhausted) {
            return null;
        }
        if (config.skipOnFail()) {
            skip(run, task, attempt.reason());
            return null;
        }
        return new Stop(StopReason.TASK_FAILED, task.text() + ": " + attempt.reason());
    }

    private void markDone(ActiveRun run, Task task) {
        for (Task resolved : run.ledger.markDone(task)) {
            log.info("'{}' resolved through its subtasks", resolved.text());
        }
        updateSnapshot(run, null, 0);
    }

    private void skip(ActiveRun run, Task task, String reason) {
        run.ledger.markSkipped(task, reason);
        metrics.recordSkip();
        publish(run, ProgressEventType.TASK_SKIP, ProgressReporter.taskSkip(task.text(), reason));
        updateSnapshot(run, null, 0);
    }

    // --- Prompt inputs ---

    private List<PromptRequest.ChildStatus> children(ActiveRun run, Task task) {
        List<PromptRequest.ChildStatus> children = new ArrayList<>(task.children().size());
        for (Task child : task.children()) {
            children.add(new PromptRequest.ChildStatus(child.text(), run.ledger.isComplete(child)));
        }
        return children;
    }

    private static String retryContext(ActiveRun run, Task task) {
        TaskAttempt last = run.lastAttempt.get(task.key());
        if (last == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Previous attempt #").append(last.attempt()).append(" result: ")
          .append(last.status().name().toLowerCase(Locale.ROOT));
        if (last.reason() != null) {
            sb.append("\nError: ").append(last.reason());
        }
        return sb.toString();
    }

    private static String planPath(ActiveRun run, Task task) {
        Path plan = run.plans.get(task.key());
        return plan == null ? null : displayPath(run.config.projectDir(), plan);
    }

    /**
     * Builds the prompt within the token budget, trimming then dropping the retry context.
     *
     * @return the prompt, or null when even the smallest form is over budget
     */
    private String fitPromptBudget(ActiveRun run, PromptRequest request) {
        int max = run.config.maxPromptTokens();
        String prompt = run.prompts.build(request);
        if (max <= 0 || TokenEstimator.estimate(prompt) <= max) {
            return prompt;
        }
        String retry = request.retryContext();
        if (retry != null && retry.length() > RETRY_CONTEXT_TRIM) {
            prompt = run.prompts.build(request.withRetryContext(retry.substring(0, RETRY_CONTEXT_TRIM) + "\n[truncated]"));
            if (TokenEstimator.estimate(prompt) <= max) {
                return prompt;
            }
        }
        if (retry != null) {
            prompt = run.prompts.build(request.withRetryContext(null));
            if (TokenEstimator.estimate(prompt) <= max) {
                return prompt;
            }
        }
        log.warn("Prompt for '{}' exceeds {} tokens", request.task().text(), max);
        return null;
    }

    private static String diffFor(ActiveRun run, String hash) {
        if (!run.gitAvailable) {
            return "";
        }
        return hash != null ? run.git.commitDiff(hash) : run.git.workingDiff();
    }

    // --- Progress ---

    private LoopEvent recordLoop(ActiveRun run, LoopEventKind kind, Task task, String message) {
        LoopEvent event = new LoopEvent(kind, task.text(), message, clock.instant());
        lastLoopEvent = event;
        metrics.recordLoopEvent(kind);
        log.info("Loop event {} on '{}': {}", kind.label(), task.text(), message);
        publish(run, ProgressEventType.LOOP, ProgressReporter.loopEvent(event));
        return event;
    }

    private void stage(ActiveRun run, Stage stage, String message) {
        publish(run, ProgressEventType.STAGE, ProgressReporter.stage(stage, message));
    }

    private void publish(ActiveRun run, ProgressEventType type, String message) {
        if (run.config.progressEvents() || type == ProgressEventType.RUN_COMPLETE) {
            run.channel.publish(ProgressEvent.of(type, run.runId, message, liveSnapshot()));
        }
    }

    private void updateSnapshot(ActiveRun run, Task current, int attemptNo) {
        Duration elapsed = elapsed();
        int completed = run.ledger.completedCount();
        int skipped = run.ledger.skippedCount();
        int total = run.ledger.plannedCount();
        snapshot = new ProgressSnapshot(total, completed, skipped, run.iterations,
                current == null ? null : current.text(), attemptNo, elapsed,
                ProgressSnapshot.estimateRemaining(elapsed, completed + skipped, total));
    }

    private ProgressSnapshot liveSnapshot() {
        Instant started = startedAt;
        return started == null ? snapshot : snapshot.withElapsed(Duration.between(started, clock.instant()));
    }

    private ScheduledExecutorService startHeartbeat(ActiveRun run, LockHandle handle) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anton-heartbeat");
            t.setDaemon(true);
            return t;
        });
        Duration interval = run.config.heartbeatInterval() == null
                || run.config.heartbeatInterval().compareTo(MIN_HEARTBEAT) < 0
                ? MIN_HEARTBEAT : run.config.heartbeatInterval();
        String runId = run.runId;
        scheduler.scheduleAtFixedRate(() -> {
            MdcContext.setRun(runId);
            try {
                lockManager.touch(handle);
                publish(run, ProgressEventType.HEARTBEAT, ProgressReporter.heartbeat(liveSnapshot()));
            } catch (RuntimeException e) {
                log.warn("Heartbeat failed: {}", e.getMessage());
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        return scheduler;
    }

    private static void stopHeartbeat(ScheduledExecutorService heartbeat) {
        heartbeat.shutdownNow();
        try {
            if (!heartbeat.awaitTermination(HEARTBEAT_SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Heartbeat still running at release");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Summary ---

    private RunResult summarize(ActiveRun run, StopReason stop, String detail) {
        TaskLedger ledger = run.ledger;
        List<String> failed = new ArrayList<>();
        for (TaskAttempt last : run.lastAttempt.values()) {
            if (!last.status().isSuccess() && !last.cancelled() && !ledger.isResolved(last.taskKey())) {
                failed.add(last.taskText());
            }
        }
        return new RunResult(run.runId, stop, detail, ledger.totalCount(), ledger.initialCompleted(),
                ledger.completedTexts(), run.autoCompleted, ledger.skippedTasks(), failed,
                ledger.remainingCount(), run.attempts, run.preflightRecords, run.commits, elapsed());
    }

    private RunResult finish(RunResult result, ActiveRun run) {
        metrics.recordRunResult(result.stopReason());
        if (result.stopReason().isFailure()) {
            log.warn("Run {} ended: {} ({})", result.runId(), result.stopReason().description(), result.detail());
        } else {
            log.info("Run {} ended: {}", result.runId(), result.stopReason().description());
        }
        if (run != null) {
            publish(run, ProgressEventType.RUN_COMPLETE, ProgressReporter.runSummary(result));
        }
        return result;
    }

    private static RunState finalState(RunResult result) {
        if (result == null || result.stopReason().isFailure()) {
            return RunState.FAILED;
        }
        return result.stopReason() == StopReason.ABORTED ? RunState.IDLE : RunState.COMPLETED;
    }

    private Duration elapsed() {
        Instant started = startedAt;
        return started == null ? Duration.ZERO : Duration.between(started, clock.instant());
    }

    private static String displayPath(Path projectDir, Path file) {
        Path project = projectDir.toAbsolutePath().normalize();
        Path target = file.toAbsolutePath().normalize();
        return target.startsWith(project) ? project.relativize(target).toString() : target.toString();
    }

    // --- Per-run state ---

    private record Stop(StopReason reason, String detail) {
    }

    /** Mutable state of one run, confined to the controller thread. */
    private static final class ActiveRun {
        final String runId;
        final RunConfig config;
        final ProgressChannel channel;
        final GitSafetyNet git;
        final Map<String, Integer> attemptsByTask = new HashMap<>();
        final Map<String, TaskAttempt> lastAttempt = new LinkedHashMap<>();
        final Map<String, Path> plans = new HashMap<>();
        final List<TaskAttempt> attempts = new ArrayList<>();
        final List<PreflightRecord> preflightRecords = new ArrayList<>();
        final List<String> autoCompleted = new ArrayList<>();
        final List<String> commits = new ArrayList<>();
        final FailureStreak streak = new FailureStreak();
        TaskLedger ledger;
        PromptBuilder prompts;
        PreflightRunner preflight;
        String displayPath;
        boolean gitAvailable;
        int iterations;

        ActiveRun(String runId, RunConfig config, ProgressChannel channel, GitSafetyNet git) {
            this.runId = runId;
            this.config = config;
            this.channel = channel;
            this.git = git;
        }
    }

    /** Collects the pieces of an attempt record as the attempt progresses. */
    private final class AttemptBuilder {
        final Task task;
        final int attemptNo;
        final Instant start;
        final Set<String> untrackedBefore;
        LoopEvent loopEvent;
        String commitHash;

        AttemptBuilder(Task task, int attemptNo, Instant start, Set<String> untrackedBefore) {
            this.task = task;
            this.attemptNo = attemptNo;
            this.start = start;
            this.untrackedBefore = untrackedBefore;
        }

        AttemptOutcome build(AttemptStatus status, String reason) {
            return new AttemptOutcome(record(status, reason), List.of(), false, untrackedBefore);
        }

        AttemptOutcome exhausted(AttemptStatus status, String reason) {
            return new AttemptOutcome(record(status, reason), List.of(), true, untrackedBefore);
        }

        AttemptOutcome decomposed(List<String> subtasks) {
            return new AttemptOutcome(record(AttemptStatus.DECOMPOSED, null), subtasks, false, untrackedBefore);
        }

        private TaskAttempt record(AttemptStatus status, String reason) {
            return new TaskAttempt(task.key(), task.text(), attemptNo, status, reason,
                    Duration.between(start, clock.instant()), commitHash, loopEvent);
        }
    }
}
