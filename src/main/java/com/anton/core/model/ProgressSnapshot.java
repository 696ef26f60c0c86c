package com.anton.core.model;

import java.time.Duration;

/**
 * Point-in-time view of a run, rebuilt by the controller and read by the heartbeat.
 *
 * @param totalTasks tasks pending when the run started plus any added by decomposition
 * @param completed tasks completed so far in this run
 * @param skipped tasks skipped so far in this run
 * @param iterationsUsed attempts dispatched so far
 * @param currentTask text of the task in flight, null between tasks
 * @param currentAttempt attempt number of the task in flight
 * @param elapsed time since the run started
 * @param eta linear estimate of the remaining time, null until a task has resolved
 */
public record ProgressSnapshot(
    int totalTasks,
    int completed,
    int skipped,
    int iterationsUsed,
    String currentTask,
    int currentAttempt,
    Duration elapsed,
    Duration eta
) {

    public static ProgressSnapshot empty() {
        return new ProgressSnapshot(0, 0, 0, 0, null, 0, Duration.ZERO, null);
    }

    /** The same snapshot observed at a later elapsed time, with the estimate recomputed. */
    public ProgressSnapshot withElapsed(Duration now) {
        return new ProgressSnapshot(totalTasks, completed, skipped, iterationsUsed, currentTask, currentAttempt, now,
                estimateRemaining(now, resolved(), totalTasks));
    }

    public int resolved() {
        return completed + skipped;
    }

    /**
     * Estimates the remaining time from the average time per resolved task.
     */
    public static Duration estimateRemaining(Duration elapsed, int resolved, int total) {
        if (resolved <= 0 || total <= resolved) {
            return resolved > 0 ? Duration.ZERO : null;
        }
        return elapsed.dividedBy(resolved).multipliedBy(total - resolved);
    }
}
