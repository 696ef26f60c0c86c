package com.anton.core.metrics;

import com.anton.core.model.AttemptStatus;
import com.anton.core.model.LoopEventKind;
import com.anton.core.model.StopReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for Anton runs.
 */
@Service
public class AntonMetrics {

    private final MeterRegistry registry;

    public AntonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAttempt(AttemptStatus status, Duration duration) {
        String tag = status.name().toLowerCase(Locale.ROOT);
        Timer.builder("anton.attempt.duration")
                .tag("status", tag)
                .register(registry)
                .record(duration);
        Counter.builder("anton.attempts.total")
                .tag("status", tag)
                .register(registry)
                .increment();
    }

    public void recordCommit() {
        Counter.builder("anton.commits.total")
                .register(registry)
                .increment();
    }

    public void recordSkip() {
        Counter.builder("anton.tasks.skipped")
                .register(registry)
                .increment();
    }

    public void recordLoopEvent(LoopEventKind kind) {
        Counter.builder("anton.loop.events")
                .description("Tool-call loops, handled or abandoned")
                .tag("kind", kind.label())
                .register(registry)
                .increment();
    }

    /**
     * @param subtaskCount number of subtasks the agent split a task into
     */
    public void recordDecomposition(int subtaskCount) {
        DistributionSummary.builder("anton.decompose.subtasks")
                .register(registry)
                .record(subtaskCount);
    }

    public void recordPreflight(String stage, String status) {
        Counter.builder("anton.preflight.stages")
                .tag("stage", stage)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRunResult(StopReason reason) {
        Counter.builder("anton.runs.total")
                .tag("stop_reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordDroppedProgressEvents(long count) {
        if (count > 0) {
            Counter.builder("anton.progress.dropped")
                    .register(registry)
                    .increment(count);
        }
    }
}
