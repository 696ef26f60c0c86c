package com.anton.core.progress;

import com.anton.core.model.AttemptStatus;
import com.anton.core.model.LoopEvent;
import com.anton.core.model.LoopEventKind;
import com.anton.core.model.ProgressSnapshot;
import com.anton.core.model.RunResult;
import com.anton.core.model.Task;
import com.anton.core.model.TaskAttempt;
import com.anton.core.model.TaskFile;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders progress notifications as display strings.
 * <p>
 * The controller never builds user-facing text itself; every line shown on a surface is
 * produced here so that formats stay stable for observers that match on them.
 */
public final class ProgressReporter {

    static final int BAR_WIDTH = 20;
    static final int DRY_RUN_PREVIEW = 10;

    private ProgressReporter() {
        // utility class
    }

    /**
     * Human-readable duration: "45s", "2m 30s", "1h 5m".
     */
    public static String formatDuration(Duration duration) {
        if (duration == null) {
            return "?";
        }
        long sec = Math.round(duration.toMillis() / 1000.0);
        if (sec < 60) {
            return sec + "s";
        }
        long min = sec / 60;
        long remainSec = sec % 60;
        if (min < 60) {
            return remainSec > 0 ? min + "m " + remainSec + "s" : min + "m";
        }
        long hr = min / 60;
        long remainMin = min % 60;
        return remainMin > 0 ? hr + "h " + remainMin + "m" : hr + "h";
    }

    /**
     * Fixed-width bar: {@code [████████░░░░░░░░░░░░] 8/20 (40%)}.
     */
    public static String progressBar(int completed, int total) {
        int percent = total > 0 ? (int) Math.round(completed * 100.0 / total) : 0;
        int filled = total > 0 ? (int) Math.round(Math.min(completed, total) * (double) BAR_WIDTH / total) : 0;
        return "[" + "█".repeat(filled) + "░".repeat(BAR_WIDTH - filled) + "] "
                + completed + "/" + total + " (" + percent + "%)";
    }

    public static String runStart(TaskFile taskFile) {
        return "🤖 Anton starting: " + taskFile.pending().size() + " pending of " + taskFile.totalCount()
                + " tasks in " + taskFile.path().getFileName();
    }

    public static String heartbeat(ProgressSnapshot snapshot) {
        StringBuilder sb = new StringBuilder("⏳ Still working");
        if (snapshot.currentTask() != null) {
            sb.append(": ").append(snapshot.currentTask())
              .append(" (attempt ").append(snapshot.currentAttempt()).append(')');
        }
        sb.append(' ').append(progressBar(snapshot.resolved(), snapshot.totalTasks()));
        sb.append(" · elapsed ").append(formatDuration(snapshot.elapsed()));
        sb.append(" · ETA ").append(snapshot.eta() == null ? "unknown" : "~" + formatDuration(snapshot.eta()));
        return sb.toString();
    }

    public static String taskStart(Task task, int attempt, ProgressSnapshot snapshot) {
        int index = Math.min(snapshot.resolved() + 1, Math.max(snapshot.totalTasks(), 1));
        return "🔧 [" + index + "/" + snapshot.totalTasks() + "] " + task.text() + " (attempt " + attempt + ")";
    }

    public static String taskEnd(TaskAttempt attempt) {
        String emoji = attempt.status().isSuccess() ? "✅" : "❌";
        StringBuilder sb = new StringBuilder()
                .append(emoji).append(' ').append(attempt.taskText())
                .append(" — ").append(statusLabel(attempt.status()))
                .append(" (").append(formatDuration(attempt.duration()));
        if (attempt.commitHash() != null) {
            sb.append(", ").append(attempt.commitHash());
        }
        sb.append(')');
        if (!attempt.status().isSuccess() && attempt.reason() != null) {
            sb.append(": ").append(attempt.reason());
        }
        return sb.toString();
    }

    public static String taskSkip(String taskText, String reason) {
        return "⏭️  " + taskText + " — skipped: " + reason;
    }

    /**
     * Loop events always say whether the condition was handled or abandoned.
     */
    public static String loopEvent(LoopEvent event) {
        if (event.kind() == LoopEventKind.AUTO_RECOVERED) {
            return "🔁 Loop auto-recovered on \"" + event.taskText() + "\": " + event.message();
        }
        return "🛑 Final loop failure on \"" + event.taskText() + "\": " + event.message();
    }

    public static String stage(Stage stage, String message) {
        String line = "🧭 " + stage.label();
        return message == null || message.isBlank() ? line : line + ": " + message;
    }

    public static String runSummary(RunResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("🤖 Anton Complete");
        lines.add("  ✅ " + result.completed().size() + " tasks completed");
        if (!result.autoCompleted().isEmpty()) {
            lines.add("  🔎 " + result.autoCompleted().size() + " already implemented");
        }
        lines.add("  ⏭️  " + result.skipped().size() + " tasks skipped");
        lines.add("  ❌ " + result.failed().size() + " tasks failed");
        lines.add("  📋 " + result.remaining() + " remaining");
        lines.add("  ⏱️  " + formatDuration(result.duration()));
        lines.add("  💾 " + result.commits().size() + " commits");
        String stop = "  Stop: " + result.stopReason().name().toLowerCase(Locale.ROOT);
        if (result.detail() != null && !result.detail().isBlank()) {
            stop += " (" + result.detail() + ")";
        }
        lines.add(stop);
        result.skipped().forEach(s -> lines.add("    ⏭️  " + s.taskText() + ": " + s.reason()));
        return String.join("\n", lines);
    }

    public static String dryRunPlan(TaskFile taskFile) {
        List<String> lines = new ArrayList<>();
        lines.add("🧪 Dry Run Plan");
        lines.add("  📋 " + taskFile.totalCount() + " total tasks");
        lines.add("  ⏳ " + taskFile.pending().size() + " pending tasks");
        lines.add("  ✅ " + taskFile.completed().size() + " already completed");
        lines.add("");
        lines.add("Pending tasks:");
        List<Task> pending = taskFile.pending();
        for (Task task : pending.subList(0, Math.min(DRY_RUN_PREVIEW, pending.size()))) {
            lines.add("  ".repeat(task.depth() + 1) + "• " + task.text());
        }
        if (pending.size() > DRY_RUN_PREVIEW) {
            lines.add("  ... and " + (pending.size() - DRY_RUN_PREVIEW) + " more tasks");
        }
        return String.join("\n", lines);
    }

    private static String statusLabel(AttemptStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
