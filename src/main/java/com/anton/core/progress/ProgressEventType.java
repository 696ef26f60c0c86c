package com.anton.core.progress;

/**
 * Kinds of progress event emitted while a run is in flight.
 */
public enum ProgressEventType {
    RUN_START,
    STAGE,
    TASK_START,
    TASK_END,
    TASK_SKIP,
    HEARTBEAT,
    LOOP,
    RUN_COMPLETE
}
