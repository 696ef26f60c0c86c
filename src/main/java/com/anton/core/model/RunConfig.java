package com.anton.core.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable, run-scoped policy. Resolved once at run start from configuration properties.
 *
 * @param taskFile checklist document driving the run
 * @param projectDir working tree the agent edits
 * @param planDir directory preflight sessions may write to
 * @param taskTimeout budget for one implementation attempt
 * @param totalTimeout wall-clock budget for the whole run
 * @param taskMaxIterations configured iteration cap for implementation sessions, null when unset
 * @param maxTotalIterations attempts allowed across the whole run
 * @param maxRetries attempts allowed per task
 * @param maxIdenticalFailures consecutive identical failures tolerated before the run aborts
 * @param decompose whether agents may split tasks
 * @param maxDecomposeDepth deepest depth a task may be split at
 * @param maxTotalTasks task count above which the run refuses to continue
 * @param autoCommit commit after each verified task
 * @param verifyAi review the diff with a verification session before committing
 * @param skipOnBlocked continue past blocked tasks instead of halting
 * @param skipOnFail continue past tasks that exhaust their retries
 * @param rollbackOnFail revert an attempt's edits when it fails
 * @param aggressiveClean remove every untracked file on rollback, not just new ones
 * @param scopeGuard changed-file check mode
 * @param approvalMode approval mode handed to the agent session
 * @param heartbeatInterval progress heartbeat period
 * @param progressEvents whether progress events are emitted
 * @param maxContextTokens budget for the retrieved-context prompt section
 * @param maxPromptTokens budget for the whole prompt
 * @param toolLoopMaxRetries continuations allowed after a tool-call loop
 * @param branch branch to create before the first task, null to stay on the current one
 * @param dryRun parse and report the plan without running any task
 * @param preflight two-phase mode policy
 */
public record RunConfig(
    Path taskFile,
    Path projectDir,
    Path planDir,
    Duration taskTimeout,
    Duration totalTimeout,
    Double taskMaxIterations,
    int maxTotalIterations,
    int maxRetries,
    int maxIdenticalFailures,
    boolean decompose,
    int maxDecomposeDepth,
    int maxTotalTasks,
    boolean autoCommit,
    boolean verifyAi,
    boolean skipOnBlocked,
    boolean skipOnFail,
    boolean rollbackOnFail,
    boolean aggressiveClean,
    ScopeGuardMode scopeGuard,
    String approvalMode,
    Duration heartbeatInterval,
    boolean progressEvents,
    int maxContextTokens,
    int maxPromptTokens,
    int toolLoopMaxRetries,
    String branch,
    boolean dryRun,
    Preflight preflight
) {

    /**
     * Two-phase (discovery then implementation) policy.
     *
     * @param enabled run discovery before the first implementation attempt of each task
     * @param requirementsReview refine the discovery plan in a second session
     * @param discoveryTimeout budget for the discovery session
     * @param reviewTimeout budget for the review session
     * @param sessionTimeout upper bound applied to every preflight session
     * @param maxRetries retries per preflight stage
     * @param sessionMaxIterations configured iteration cap for preflight sessions, null when unset
     */
    public record Preflight(
        boolean enabled,
        boolean requirementsReview,
        Duration discoveryTimeout,
        Duration reviewTimeout,
        Duration sessionTimeout,
        int maxRetries,
        Double sessionMaxIterations
    ) {
    }
}
