package com.anton.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Final summary of a run.
 *
 * @param runId identifier used in logs
 * @param stopReason why the run ended
 * @param detail human-readable detail for failure stops, null otherwise
 * @param totalTasks tasks in the document at start
 * @param preCompleted tasks already checked in the document at start
 * @param completed task texts completed in this run, in completion order
 * @param autoCompleted task texts discovery reported as already implemented
 * @param skipped tasks given up on, with reasons
 * @param failed task texts whose final attempt did not succeed and were not skipped
 * @param remaining tasks left unresolved
 * @param attempts every attempt made, in order
 * @param preflightRecords preflight stage outcomes
 * @param commits short hashes of commits made, in order
 * @param duration wall-clock run time
 */
public record RunResult(
    String runId,
    StopReason stopReason,
    String detail,
    int totalTasks,
    int preCompleted,
    List<String> completed,
    List<String> autoCompleted,
    List<SkippedTask> skipped,
    List<String> failed,
    int remaining,
    List<TaskAttempt> attempts,
    List<PreflightRecord> preflightRecords,
    List<String> commits,
    Duration duration
) {

    public RunResult {
        completed = List.copyOf(completed);
        autoCompleted = List.copyOf(autoCompleted);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
        attempts = List.copyOf(attempts);
        preflightRecords = List.copyOf(preflightRecords);
        commits = List.copyOf(commits);
    }

    /** A run that ended before any task was considered. */
    public static RunResult aborted(String runId, StopReason reason, String detail, Duration duration) {
        return new RunResult(runId, reason, detail, 0, 0, List.of(), List.of(), List.of(), List.of(),
                0, List.of(), List.of(), List.of(), duration);
    }

    public boolean completedAll() {
        return remaining == 0 && failed.isEmpty() && !stopReason.isFailure();
    }
}
