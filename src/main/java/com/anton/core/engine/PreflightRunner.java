package com.anton.core.engine;

import com.anton.core.metrics.AntonMetrics;
import com.anton.core.model.AttemptStatus;
import com.anton.core.model.PreflightRecord;
import com.anton.core.model.RunConfig;
import com.anton.core.model.Task;
import com.anton.core.model.TaskAttempt;
import com.anton.core.progress.Stage;
import com.anton.core.prompt.PreflightDecision;
import com.anton.core.prompt.PreflightParseException;
import com.anton.core.prompt.PreflightPrompts;
import com.anton.core.session.AgentReply;
import com.anton.core.session.AgentSession;
import com.anton.core.session.AgentSessionException;
import com.anton.core.session.AgentSessionFactory;
import com.anton.core.session.SessionConfig;
import com.anton.core.session.SessionConfigBuilder;
import com.anton.core.session.SessionDefaults;
import com.anton.core.session.SessionPurpose;
import com.anton.core.session.ToolLoopException;
import com.anton.core.vcs.GitSafetyNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Two-phase mode: a discovery session decides whether a task is already done and, if not,
 * writes a plan file; an optional review session refines that plan. Both sessions may write
 * only inside the plan directory.
 */
class PreflightRunner {

    private static final Logger log = LoggerFactory.getLogger(PreflightRunner.class);

    static final String DISCOVERY = "discovery";
    static final String REVIEW = "requirements-review";
    private static final int SHORT_ERROR = 180;

    private final AgentSessionFactory sessionFactory;
    private final SessionDefaults sessionDefaults;
    private final TurnRunner turns;
    private final AntonMetrics metrics;
    private final BiConsumer<Stage, String> stages;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    PreflightRunner(AgentSessionFactory sessionFactory, SessionDefaults sessionDefaults, TurnRunner turns,
                    AntonMetrics metrics, BiConsumer<Stage, String> stages, Clock clock) {
        this.sessionFactory = sessionFactory;
        this.sessionDefaults = sessionDefaults;
        this.turns = turns;
        this.metrics = metrics;
        this.stages = stages;
        this.clock = clock;
    }

    PreflightOutcome run(Task task, RunConfig run, String taskFilePath, GitSafetyNet git) {
        List<PreflightRecord> records = new ArrayList<>();
        Path planDir = run.planDir().toAbsolutePath().normalize();
        Path plannedFile = planDir.resolve(newPlanFileName());
        try {
            Files.createDirectories(planDir);
        } catch (IOException e) {
            return PreflightOutcome.failed(AttemptStatus.ERROR,
                    "preflight-error(plan-dir): " + e.getMessage(), records);
        }
        Set<String> changedBefore = git.isInsideWorkTree() ? Set.copyOf(git.changedFiles()) : null;

        SessionConfig discoveryConfig = SessionConfigBuilder.forPreflight(sessionDefaults, run,
                SessionPurpose.DISCOVERY, run.preflight().discoveryTimeout());
        SessionConfig reviewConfig = SessionConfigBuilder.forPreflight(sessionDefaults, run,
                SessionPurpose.REVIEW, run.preflight().reviewTimeout());
        int maxRetries = Math.max(0, run.preflight().maxRetries());

        AgentSession session = null;
        try {
            // Stage 1: discovery
            Path plan = null;
            boolean usedFallback = false;
            String retryHint = null;
            for (int tryNo = 0; tryNo <= maxRetries && plan == null; tryNo++) {
                Instant stageStart = clock.instant();
                stages.accept(Stage.PLANNING, "Discovery: checking if already done...");
                try {
                    if (session == null) {
                        session = sessionFactory.create(discoveryConfig);
                    }
                    String prompt = PreflightPrompts.discovery(task, taskFilePath, run.projectDir(), planDir,
                            plannedFile, retryHint);
                    AgentReply reply = turns.ask(session, prompt, discoveryConfig.timeout(), "Discovery");
                    PreflightDecision decision = decide(session, reply.text(), discoveryConfig.timeout(), planDir,
                            true);
                    guardWrites(git, changedBefore, run, records, task);

                    if (decision.isComplete()) {
                        records.add(record(task, DISCOVERY, "complete", null, stageStart, null, run));
                        stages.accept(Stage.PLANNING, "Discovery confirmed already complete: " + task.text());
                        return PreflightOutcome.complete(records);
                    }

                    Path named = decision.planFile();
                    String problem = planProblem(named);
                    if (problem != null && reply.toolCalls() == 0) {
                        problem = "file was never written (no tool calls)";
                    }
                    if (problem != null) {
                        named = rewrite(session, named, problem, "incomplete", discoveryConfig.timeout(), planDir, true);
                        guardWrites(git, changedBefore, run, records, task);
                    }
                    if (planProblem(named) != null) {
                        bootstrap(named, task, DISCOVERY);
                        usedFallback = true;
                        stages.accept(Stage.RUNTIME_PREFLIGHT,
                                "Discovery did not write a valid plan. Created fallback plan file: " + named);
                    }
                    records.add(record(task, DISCOVERY, "incomplete", named, stageStart, null, run));
                    plan = named;
                    stages.accept(Stage.PLANNING, "Discovery plan file: " + named);
                } catch (PreflightParseException e) {
                    records.add(record(task, DISCOVERY, "error", null, stageStart, e.getMessage(), run));
                    bootstrap(plannedFile, task, DISCOVERY);
                    usedFallback = true;
                    plan = plannedFile;
                    stages.accept(Stage.RUNTIME_PREFLIGHT, "Discovery returned invalid output ("
                            + shorten(e.getMessage()) + "). Continuing with fallback plan: " + plannedFile);
                } catch (TurnTimeoutException | AgentSessionException | ToolLoopException e) {
                    boolean timeout = e instanceof TurnTimeoutException;
                    records.add(record(task, DISCOVERY, timeout ? "timeout" : "error", null, stageStart,
                            e.getMessage(), run));
                    if (e instanceof AgentSessionException ase && ase.isCancelled()) {
                        return PreflightOutcome.failed(AttemptStatus.ERROR, TaskAttempt.CANCELLED, records);
                    }
                    closeQuietly(session);
                    session = null;
                    guardWrites(git, changedBefore, run, records, task);
                    String shortMsg = shorten(e.getMessage());
                    retryHint = "Previous discovery attempt failed: " + shortMsg + ". Do not edit source files. Only update "
                            + plannedFile + " and return strict JSON.";
                    if (tryNo < maxRetries) {
                        stages.accept(Stage.RUNTIME_PREFLIGHT, "Discovery failed (%d/%d): %s. Retrying discovery..."
                                .formatted(tryNo + 1, maxRetries + 1, shortMsg));
                        continue;
                    }
                    bootstrap(plannedFile, task, DISCOVERY);
                    usedFallback = true;
                    plan = plannedFile;
                    stages.accept(Stage.RUNTIME_PREFLIGHT, "Discovery failed after %d tries (%s). Continuing with fallback plan: %s"
                            .formatted(maxRetries + 1, shortMsg, plannedFile));
                }
            }

            if (!run.preflight().requirementsReview()) {
                return PreflightOutcome.planned(plan, records);
            }

            // Stage 2: requirements review of the same plan file
            for (int tryNo = 0; tryNo <= maxRetries; tryNo++) {
                Instant stageStart = clock.instant();
                stages.accept(Stage.PLANNING, "Requirements review: refining plan...");
                try {
                    if (session == null) {
                        session = sessionFactory.create(reviewConfig);
                    }
                    AgentReply reply = turns.ask(session, PreflightPrompts.requirementsReview(plan),
                            reviewConfig.timeout(), "Requirements review");
                    PreflightDecision decision = decide(session, reply.text(), reviewConfig.timeout(), planDir, false);
                    guardWrites(git, changedBefore, run, records, task);

                    Path reviewed = decision.planFile();
                    String problem = planProblem(reviewed);
                    if (problem != null) {
                        reviewed = rewrite(session, reviewed, problem, "ready", reviewConfig.timeout(), planDir, false);
                        guardWrites(git, changedBefore, run, records, task);
                    }
                    if (planProblem(reviewed) != null) {
                        bootstrap(reviewed, task, REVIEW);
                    }
                    records.add(record(task, REVIEW, "ready", reviewed, stageStart, null, run));
                    stages.accept(Stage.PLANNING, "Requirements review ready: " + reviewed);
                    return PreflightOutcome.planned(reviewed, records);
                } catch (PreflightParseException e) {
                    records.add(record(task, REVIEW, "error", null, stageStart, e.getMessage(), run));
                    if (!usedFallback) {
                        if (planProblem(plan) != null) {
                            bootstrap(plan, task, REVIEW);
                        }
                        stages.accept(Stage.RUNTIME_PREFLIGHT, "Requirements review returned invalid output ("
                                + shorten(e.getMessage()) + "). Continuing with existing plan: " + plan);
                        return PreflightOutcome.planned(plan, records);
                    }
                    stages.accept(Stage.RUNTIME_PREFLIGHT,
                            "Discovery used a fallback plan, so a valid review is required. Retrying...");
                    closeQuietly(session);
                    session = null;
                    guardWrites(git, changedBefore, run, records, task);
                    if (tryNo == maxRetries) {
                        return PreflightOutcome.failed(AttemptStatus.ERROR,
                                "preflight-error(requirements-review): " + e.getMessage(), records);
                    }
                } catch (TurnTimeoutException | AgentSessionException | ToolLoopException e) {
                    boolean timeout = e instanceof TurnTimeoutException;
                    records.add(record(task, REVIEW, timeout ? "timeout" : "error", null, stageStart,
                            e.getMessage(), run));
                    if (e instanceof AgentSessionException ase && ase.isCancelled()) {
                        return PreflightOutcome.failed(AttemptStatus.ERROR, TaskAttempt.CANCELLED, records);
                    }
                    closeQuietly(session);
                    session = null;
                    guardWrites(git, changedBefore, run, records, task);
                    if (tryNo == maxRetries) {
                        return PreflightOutcome.failed(timeout ? AttemptStatus.TIMEOUT : AttemptStatus.ERROR,
                                "preflight-error(requirements-review): " + e.getMessage(), records);
                    }
                    stages.accept(Stage.RUNTIME_PREFLIGHT, "Requirements review failed (%d/%d): %s. Retrying review..."
                            .formatted(tryNo + 1, maxRetries + 1, shorten(e.getMessage())));
                }
            }
            return PreflightOutcome.failed(AttemptStatus.ERROR, "preflight-error(requirements-review): exhausted",
                    records);
        } finally {
            closeQuietly(session);
        }
    }

    /**
     * Parses a stage reply; an unparseable reply gets one forced-decision turn.
     */
    private PreflightDecision decide(AgentSession session, String raw, Duration limit, Path planDir,
                                     boolean discovery) {
        try {
            return parse(raw, planDir, discovery);
        } catch (PreflightParseException e) {
            log.info("{} reply unparseable ({}), requesting forced decision", discovery ? "Discovery" : "Review",
                    e.getMessage());
            stages.accept(Stage.PLANNING, (discovery ? "Discovery" : "Review")
                    + " output invalid, requesting forced decision...");
            String prompt = discovery ? PreflightPrompts.forceDiscoveryDecision() : PreflightPrompts.forceReviewDecision();
            AgentReply forced = turns.ask(session, prompt, limit, "Forced decision");
            return parse(forced.text(), planDir, discovery);
        }
    }

    private Path rewrite(AgentSession session, Path planFile, String problem, String status, Duration limit,
                         Path planDir, boolean discovery) {
        stages.accept(Stage.RUNTIME_PREFLIGHT,
                "Plan file is invalid (" + problem + "). Asking the agent to rewrite it...");
        AgentReply reply = turns.ask(session, PreflightPrompts.rewritePlan(planFile, problem, status), limit,
                "Plan rewrite");
        try {
            PreflightDecision rewritten = parse(reply.text(), planDir, discovery);
            if (rewritten.planFile() != null) {
                return rewritten.planFile();
            }
        } catch (PreflightParseException e) {
            log.debug("Rewrite reply unparseable, keeping {}: {}", planFile, e.getMessage());
        }
        return planFile;
    }

    private static PreflightDecision parse(String raw, Path planDir, boolean discovery) {
        return discovery ? PreflightPrompts.parseDiscovery(raw, planDir) : PreflightPrompts.parseReview(raw, planDir);
    }

    /**
     * Reverts anything a preflight session changed outside the plan directory.
     */
    private void guardWrites(GitSafetyNet git, Set<String> changedBefore, RunConfig run,
                             List<PreflightRecord> records, Task task) {
        if (changedBefore == null) {
            return;
        }
        Path project = run.projectDir().toAbsolutePath().normalize();
        Path plans = run.planDir().toAbsolutePath().normalize();
        List<String> outside = new ArrayList<>();
        for (String file : git.changedFiles()) {
            if (changedBefore.contains(file)) {
                continue;
            }
            if (!project.resolve(file).normalize().startsWith(plans)) {
                outside.add(file);
            }
        }
        if (outside.isEmpty()) {
            return;
        }
        log.warn("Preflight session wrote outside the plan directory, reverting: {}", outside);
        git.restorePaths(outside);
        records.add(new PreflightRecord(task.key(), "write-guard", "reverted", null, Duration.ZERO,
                "preflight-write-outside-plan-dir: " + String.join(", ", outside)));
        stages.accept(Stage.RUNTIME_PREFLIGHT, "Reverted preflight edits outside the plan directory: " + outside);
    }

    /** Null when the plan file exists as a regular, non-empty file. */
    static String planProblem(Path planFile) {
        if (planFile == null || !Files.exists(planFile)) {
            return "missing file";
        }
        if (!Files.isRegularFile(planFile)) {
            return "not a regular file";
        }
        try {
            return Files.readString(planFile, StandardCharsets.UTF_8).isBlank() ? "empty file" : null;
        } catch (IOException e) {
            return e.getMessage();
        }
    }

    /** Writes the fallback plan unless a usable plan is already there. */
    static void bootstrap(Path planFile, Task task, String stage) {
        if (planProblem(planFile) == null) {
            return;
        }
        try {
            Files.createDirectories(planFile.getParent());
            Files.writeString(planFile, PreflightPrompts.fallbackPlan(task, stage), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PreflightParseException("preflight-plan-bootstrap-failed: " + e.getMessage(), e);
        }
    }

    private PreflightRecord record(Task task, String stage, String status, Path planFile, Instant start,
                                   String detail, RunConfig run) {
        metrics.recordPreflight(stage, status);
        String shown = null;
        if (planFile != null) {
            Path project = run.projectDir().toAbsolutePath().normalize();
            shown = planFile.startsWith(project) ? project.relativize(planFile).toString() : planFile.toString();
        }
        return new PreflightRecord(task.key(), stage, status, shown, Duration.between(start, clock.instant()), detail);
    }

    private String newPlanFileName() {
        byte[] bytes = new byte[6];
        random.nextBytes(bytes);
        return clock.millis() + "-" + HexFormat.of().formatHex(bytes) + ".md";
    }

    private static String shorten(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() > SHORT_ERROR ? message.substring(0, SHORT_ERROR - 3) + "..." : message;
    }

    private static void closeQuietly(AgentSession session) {
        if (session != null) {
            session.close();
        }
    }
}
