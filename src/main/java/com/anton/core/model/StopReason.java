package com.anton.core.model;

/**
 * Why a run ended. Intentional stops are distinguished from unexpected failures.
 */
public enum StopReason {
    ALL_DONE("all tasks resolved", false),
    ABORTED("stopped on request", false),
    TOTAL_TIMEOUT("total run timeout reached", false),
    MAX_ITERATIONS("maximum iterations reached", false),
    MAX_TASKS_EXCEEDED("maximum task count exceeded", false),
    IDENTICAL_FAILURES("repeated identical failures", true),
    TASK_BLOCKED("task blocked and skip-on-blocked is off", true),
    TASK_FAILED("task failed and skip-on-fail is off", true),
    LOCK_CONTENTION("another run is in progress", true),
    DIRTY_TREE("working tree is not clean", true),
    TASK_FILE_ERROR("task file unreadable", true),
    VCS_ERROR("version control failure", true),
    FATAL_ERROR("unexpected error", true);

    private final String description;
    private final boolean failure;

    StopReason(String description, boolean failure) {
        this.description = description;
        this.failure = failure;
    }

    public String description() {
        return description;
    }

    /** True when the run ended because something went wrong rather than by policy or request. */
    public boolean isFailure() {
        return failure;
    }
}
