package com.anton.core.model;

import java.time.Duration;

/**
 * Outcome of one preflight stage for a task.
 *
 * @param taskKey task the stage ran for
 * @param stage "discovery" or "requirements-review"
 * @param status "complete", "incomplete", "ready", "fallback" or "error"
 * @param planFile plan file path relative to the project, null if none
 * @param duration wall-clock time spent
 * @param detail error detail, null on success
 */
public record PreflightRecord(
    String taskKey,
    String stage,
    String status,
    String planFile,
    Duration duration,
    String detail
) {
}
