package com.anton.core.model;

/**
 * Lifecycle of the run controller.
 */
public enum RunState {
    IDLE,
    RUNNING,
    STOPPING,
    COMPLETED,
    FAILED
}
