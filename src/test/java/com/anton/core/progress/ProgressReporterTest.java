package com.anton.core.progress;

import com.anton.core.model.AttemptStatus;
import com.anton.core.model.LoopEvent;
import com.anton.core.model.LoopEventKind;
import com.anton.core.model.ProgressSnapshot;
import com.anton.core.model.RunResult;
import com.anton.core.model.SkippedTask;
import com.anton.core.model.StopReason;
import com.anton.core.model.Task;
import com.anton.core.model.TaskAttempt;
import com.anton.core.model.TaskFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private static Task task(String text) {
        return new Task(text, text, 1, List.of(), 0, false, null, List.of());
    }

    @Nested
    @DisplayName("heartbeat")
    class Heartbeat {

        @Test
        @DisplayName("names the task, attempt, counts and an ETA")
        void content() {
            ProgressSnapshot snapshot = new ProgressSnapshot(10, 3, 1, 12, "Add cache", 2, Duration.ZERO, null)
                    .withElapsed(Duration.ofMinutes(2));

            String line = ProgressReporter.heartbeat(snapshot);

            assertTrue(Pattern.compile("still working", Pattern.CASE_INSENSITIVE).matcher(line).find());
            assertTrue(Pattern.compile("attempt 2", Pattern.CASE_INSENSITIVE).matcher(line).find());
            assertTrue(Pattern.compile("\\[.*\\] 4/10").matcher(line).find());
            assertTrue(line.contains("ETA ~3m"));
            assertTrue(line.contains("elapsed 2m"));
        }

        @Test
        @DisplayName("ETA is unknown before anything resolved")
        void unknownEta() {
            ProgressSnapshot snapshot = new ProgressSnapshot(5, 0, 0, 0, null, 0, Duration.ZERO, null)
                    .withElapsed(Duration.ofSeconds(20));

            String line = ProgressReporter.heartbeat(snapshot);

            assertTrue(line.contains("ETA unknown"));
            assertFalse(line.contains("attempt"));
        }
    }

    @Test
    @DisplayName("durations render in seconds, minutes and hours")
    void formatDuration() {
        assertEquals("45s", ProgressReporter.formatDuration(Duration.ofSeconds(45)));
        assertEquals("2m 30s", ProgressReporter.formatDuration(Duration.ofSeconds(150)));
        assertEquals("3m", ProgressReporter.formatDuration(Duration.ofMinutes(3)));
        assertEquals("1h 5m", ProgressReporter.formatDuration(Duration.ofMinutes(65)));
        assertEquals("2h", ProgressReporter.formatDuration(Duration.ofHours(2)));
        assertEquals("?", ProgressReporter.formatDuration(null));
    }

    @Test
    @DisplayName("progress bar is fixed width and clamps overflow")
    void progressBar() {
        assertEquals("[██████████░░░░░░░░░░] 5/10 (50%)", ProgressReporter.progressBar(5, 10));
        assertEquals("[░░░░░░░░░░░░░░░░░░░░] 0/0 (0%)", ProgressReporter.progressBar(0, 0));
        assertTrue(ProgressReporter.progressBar(12, 10).startsWith("[" + "█".repeat(20) + "]"));
    }

    @Test
    @DisplayName("loop events say whether they were recovered or final")
    void loopEvents() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        String recovered = ProgressReporter.loopEvent(
                new LoopEvent(LoopEventKind.AUTO_RECOVERED, "Fix parser", "continuing (1/3)", now));
        String fatal = ProgressReporter.loopEvent(
                new LoopEvent(LoopEventKind.FINAL_FAILURE, "Fix parser", "retries exhausted", now));

        assertTrue(recovered.contains("auto-recovered on \"Fix parser\": continuing (1/3)"));
        assertTrue(fatal.contains("Final loop failure on \"Fix parser\": retries exhausted"));
    }

    @Test
    @DisplayName("stage lines use the stage label")
    void stages() {
        assertEquals("🧭 Pre-flight: discovery", ProgressReporter.stage(Stage.RUNTIME_PREFLIGHT, "discovery"));
        assertEquals("🧭 Executing", ProgressReporter.stage(Stage.EXECUTING, null));
        assertEquals(Stage.EXECUTING, Stage.fromId("bogus"));
        assertEquals(Stage.PLANNING, Stage.fromId(" Planning "));
    }

    @Test
    @DisplayName("task end shows status, duration, commit and failure reason")
    void taskEnd() {
        String passed = ProgressReporter.taskEnd(new TaskAttempt("k", "Add cache", 1, AttemptStatus.PASSED, null,
                Duration.ofSeconds(42), "abc123", null));
        String failed = ProgressReporter.taskEnd(new TaskAttempt("k", "Add cache", 2, AttemptStatus.FAILED,
                "tests red", Duration.ofSeconds(5), null, null));

        assertEquals("✅ Add cache — passed (42s, abc123)", passed);
        assertEquals("❌ Add cache — failed (5s): tests red", failed);
    }

    @Test
    @DisplayName("run summary lists counts, stop reason and skipped tasks")
    void runSummary() {
        RunResult result = new RunResult("r1", StopReason.ALL_DONE, null, 4, 0, List.of("a", "b"), List.of("c"),
                List.of(new SkippedTask("d", "Deploy", "blocked: no credentials")), List.of(), 0, List.of(),
                List.of(), List.of("h1", "h2"), Duration.ofSeconds(90));

        String summary = ProgressReporter.runSummary(result);

        assertTrue(summary.contains("2 tasks completed"));
        assertTrue(summary.contains("1 already implemented"));
        assertTrue(summary.contains("1 tasks skipped"));
        assertTrue(summary.contains("2 commits"));
        assertTrue(summary.contains("1m 30s"));
        assertTrue(summary.contains("Stop: all_done"));
        assertTrue(summary.contains("Deploy: blocked: no credentials"));
    }

    @Test
    @DisplayName("dry-run plan previews at most ten pending tasks")
    void dryRunPlan() {
        List<Task> pending = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            pending.add(task("Task " + i));
        }
        TaskFile file = new TaskFile(Path.of("TASKS.md"), pending, pending, List.of(), 12, "hash");

        String plan = ProgressReporter.dryRunPlan(file);

        assertTrue(plan.contains("12 pending tasks"));
        assertTrue(plan.contains("  • Task 10"));
        assertFalse(plan.contains("Task 11"));
        assertTrue(plan.contains("... and 2 more tasks"));
    }
}
