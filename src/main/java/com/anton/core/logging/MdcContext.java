package com.anton.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Anton-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_KEY = "taskKey";
    public static final String ATTEMPT = "attempt";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String taskKey, int attempt) {
        MDC.put(TASK_KEY, taskKey);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static void clearTask() {
        MDC.remove(TASK_KEY);
        MDC.remove(ATTEMPT);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        clearTask();
    }
}
