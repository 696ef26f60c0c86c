package com.anton.core.model;

import java.time.Duration;

/**
 * Record of one attempt at a task.
 *
 * @param taskKey key of the task attempted
 * @param taskText task text
 * @param attempt 1-based attempt number for this task
 * @param status attempt outcome
 * @param reason failure or blocked reason, null on success
 * @param duration wall-clock time spent
 * @param commitHash short hash of the commit produced, null if none
 * @param loopEvent loop condition observed during the attempt, null if none
 */
public record TaskAttempt(
    String taskKey,
    String taskText,
    int attempt,
    AttemptStatus status,
    String reason,
    Duration duration,
    String commitHash,
    LoopEvent loopEvent
) {

    /** Reason recorded when a stop request cancelled the attempt's session. */
    public static final String CANCELLED = "cancelled";

    /** Whether the attempt ended because the run was stopped, not because the task failed. */
    public boolean cancelled() {
        return status == AttemptStatus.ERROR && CANCELLED.equals(reason);
    }
}
