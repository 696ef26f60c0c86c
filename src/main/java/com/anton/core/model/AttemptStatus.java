package com.anton.core.model;

/**
 * Outcome of a single attempt at a task.
 */
public enum AttemptStatus {
    PASSED,
    DECOMPOSED,
    BLOCKED,
    FAILED,
    TIMEOUT,
    ERROR;

    public boolean isSuccess() {
        return this == PASSED || this == DECOMPOSED;
    }
}
