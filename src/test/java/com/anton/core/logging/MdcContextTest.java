package com.anton.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("run-42");
        assertEquals("run-42", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTask puts taskKey and attempt in MDC")
    void setTask() {
        MdcContext.setTask("a1b2c3", 2);
        assertEquals("a1b2c3", MDC.get("taskKey"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clearTask keeps the run id")
    void clearTask() {
        MdcContext.setRun("run-42");
        MdcContext.setTask("a1b2c3", 1);
        MdcContext.clearTask();
        assertEquals("run-42", MDC.get("runId"));
        assertNull(MDC.get("taskKey"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes all anton MDC keys")
    void clear() {
        MdcContext.setRun("run-42");
        MdcContext.setTask("a1b2c3", 1);
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskKey"));
    }
}
