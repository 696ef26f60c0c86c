package com.anton.core.metrics;

import com.anton.core.model.AttemptStatus;
import com.anton.core.model.LoopEventKind;
import com.anton.core.model.StopReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AntonMetricsTest {

    private SimpleMeterRegistry registry;
    private AntonMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AntonMetrics(registry);
    }

    @Test
    @DisplayName("recordAttempt times and counts by status")
    void recordAttempt() {
        metrics.recordAttempt(AttemptStatus.PASSED, Duration.ofSeconds(3));
        metrics.recordAttempt(AttemptStatus.PASSED, Duration.ofSeconds(5));
        metrics.recordAttempt(AttemptStatus.TIMEOUT, Duration.ofMinutes(10));

        var passed = registry.find("anton.attempt.duration").tag("status", "passed").timer();
        assertNotNull(passed);
        assertEquals(2, passed.count());
        assertEquals(1.0, registry.find("anton.attempts.total").tag("status", "timeout").counter().count());
    }

    @Test
    @DisplayName("commit and skip counters increment")
    void counters() {
        metrics.recordCommit();
        metrics.recordCommit();
        metrics.recordSkip();

        assertEquals(2.0, registry.find("anton.commits.total").counter().count());
        assertEquals(1.0, registry.find("anton.tasks.skipped").counter().count());
    }

    @Test
    @DisplayName("loop events are tagged by kind")
    void loopEvents() {
        metrics.recordLoopEvent(LoopEventKind.AUTO_RECOVERED);
        metrics.recordLoopEvent(LoopEventKind.FINAL_FAILURE);
        metrics.recordLoopEvent(LoopEventKind.AUTO_RECOVERED);

        assertEquals(2.0, registry.find("anton.loop.events").tag("kind", "auto-recovered").counter().count());
        assertEquals(1.0, registry.find("anton.loop.events").tag("kind", "final-failure").counter().count());
    }

    @Test
    @DisplayName("run results are tagged by stop reason")
    void runResult() {
        metrics.recordRunResult(StopReason.ALL_DONE);

        assertNotNull(registry.find("anton.runs.total").tag("stop_reason", "all_done").counter());
    }

    @Test
    @DisplayName("decomposition records subtask counts")
    void decomposition() {
        metrics.recordDecomposition(3);

        var summary = registry.find("anton.decompose.subtasks").summary();
        assertNotNull(summary);
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("zero dropped events registers nothing")
    void droppedEvents() {
        metrics.recordDroppedProgressEvents(0);
        assertNull(registry.find("anton.progress.dropped").counter());

        metrics.recordDroppedProgressEvents(4);
        assertEquals(4.0, registry.find("anton.progress.dropped").counter().count());
    }
}
