package com.anton.core.progress;

import com.anton.core.model.ProgressSnapshot;

import java.time.Instant;

/**
 * A formatted progress message together with the run state it was rendered from.
 *
 * @param type      event kind
 * @param runId     the run this event belongs to
 * @param message   human-readable line, already formatted by {@link ProgressReporter}
 * @param snapshot  run progress at the time of the event
 * @param timestamp when the event was produced
 */
public record ProgressEvent(
    ProgressEventType type,
    String runId,
    String message,
    ProgressSnapshot snapshot,
    Instant timestamp
) {

    public static ProgressEvent of(ProgressEventType type, String runId, String message,
                                   ProgressSnapshot snapshot) {
        return new ProgressEvent(type, runId, message, snapshot, Instant.now());
    }
}
