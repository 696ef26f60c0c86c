package com.anton.core.tasks;

import com.anton.core.model.SkippedTask;
import com.anton.core.model.Task;
import com.anton.core.model.TaskFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The controller's own record of which tasks are done, skipped or still pending in a run.
 *
 * <p>Checkboxes in the document are input only: a task counts as done here when the
 * controller verified it, never because the agent ticked a box. Decomposition substitutes
 * proposed subtasks for a task in this ledger without touching the document; the substituted
 * task resolves once all of its subtasks do.
 *
 * <p>Not thread-safe; owned by the run controller's thread.
 */
public class TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(TaskLedger.class);

    private final List<Task> order = new ArrayList<>();
    private final Map<String, Task> byKey = new HashMap<>();
    private final Map<String, List<Task>> substitutions = new LinkedHashMap<>();
    private final Set<String> done = new LinkedHashSet<>();
    private final Map<String, String> skipped = new LinkedHashMap<>();
    private final int initialPending;
    private final int initialCompleted;
    private int documentTotal;
    private String contentHash;

    public TaskLedger(TaskFile file) {
        this.initialPending = file.pending().size();
        this.initialCompleted = file.completed().size();
        load(file);
    }

    /**
     * Merges a re-parsed document. Unchanged content is a no-op; otherwise the pending order is
     * rebuilt from the new document, keeping resolutions and substitutions by key.
     *
     * @return true if the document had changed
     */
    public boolean refresh(TaskFile file) {
        if (file.contentHash().equals(contentHash)) {
            return false;
        }
        log.warn("Task file {} changed during the run; merging by task key", file.path());
        load(file);
        return true;
    }

    /**
     * Next task to work on: the first unresolved, unsubstituted entry in depth-first order whose
     * parent is not itself still waiting to run.
     */
    public Optional<Task> nextRunnable() {
        for (Task task : order) {
            if (isResolved(task.key()) || substitutions.containsKey(task.key())) {
                continue;
            }
            Task parent = task.parentKey() == null ? null : byKey.get(task.parentKey());
            if (parent != null && !parent.checked() && !isResolved(parent.key())
                    && !substitutions.containsKey(parent.key())) {
                continue;
            }
            return Optional.of(task);
        }
        return Optional.empty();
    }

    /**
     * Marks a task done.
     *
     * @return substituted ancestors that resolved as a consequence, innermost first
     */
    public List<Task> markDone(Task task) {
        done.add(task.key());
        skipped.remove(task.key());
        return resolveAncestors(task);
    }

    /**
     * Marks a task skipped with the reason recorded for the run summary.
     *
     * @return substituted ancestors that resolved as a consequence, innermost first
     */
    public List<Task> markSkipped(Task task, String reason) {
        if (!done.contains(task.key())) {
            skipped.put(task.key(), reason);
        }
        return resolveAncestors(task);
    }

    /**
     * Substitutes agent-proposed subtasks for {@code parent}. The subtasks are scheduled
     * immediately after the parent at depth + 1.
     *
     * @return the synthetic subtasks, in order
     */
    public List<Task> decompose(Task parent, List<String> subtaskTexts) {
        List<Task> subtasks = new ArrayList<>(subtaskTexts.size());
        Map<String, Integer> ordinals = new HashMap<>();
        for (String text : subtaskTexts) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int ordinal = ordinals.merge(TaskKeys.normalizeWhitespace(trimmed), 1, Integer::sum) - 1;
            int depth = parent.depth() + 1;
            subtasks.add(new Task(TaskKeys.subtaskKey(parent.key(), depth, trimmed, ordinal), trimmed,
                    parent.line(), parent.phasePath(), depth, false, parent.key(), List.of()));
        }
        if (subtasks.isEmpty()) {
            return List.of();
        }
        substitutions.put(parent.key(), List.copyOf(subtasks));
        int at = order.indexOf(parent);
        order.addAll(at < 0 ? order.size() : at + 1, subtasks);
        for (Task subtask : subtasks) {
            byKey.put(subtask.key(), subtask);
        }
        log.info("Decomposed '{}' into {} subtasks", parent.text(), subtasks.size());
        return subtasks;
    }

    public boolean isDone(String key) {
        return done.contains(key);
    }

    public boolean isSkipped(String key) {
        return skipped.containsKey(key);
    }

    public boolean isResolved(String key) {
        return done.contains(key) || skipped.containsKey(key);
    }

    /** Done here, or checked in the document. */
    public boolean isComplete(Task task) {
        return task.checked() || done.contains(task.key());
    }

    public int completedCount() {
        return done.size();
    }

    public int skippedCount() {
        return skipped.size();
    }

    /** Unresolved entries still in the schedule. */
    public int remainingCount() {
        int remaining = 0;
        for (Task task : order) {
            if (!isResolved(task.key())) {
                remaining++;
            }
        }
        return remaining;
    }

    /** Tasks in the document plus subtasks added by decomposition. */
    public int totalCount() {
        int synthetic = 0;
        for (List<Task> subtasks : substitutions.values()) {
            synthetic += subtasks.size();
        }
        return documentTotal + synthetic;
    }

    /** Pending tasks at run start plus subtasks added by decomposition. */
    public int plannedCount() {
        return initialPending + (totalCount() - documentTotal);
    }

    public int initialCompleted() {
        return initialCompleted;
    }

    public List<String> completedTexts() {
        List<String> texts = new ArrayList<>(done.size());
        for (String key : done) {
            Task task = byKey.get(key);
            texts.add(task == null ? key : task.text());
        }
        return texts;
    }

    public List<SkippedTask> skippedTasks() {
        List<SkippedTask> result = new ArrayList<>(skipped.size());
        for (Map.Entry<String, String> entry : skipped.entrySet()) {
            Task task = byKey.get(entry.getKey());
            result.add(new SkippedTask(entry.getKey(), task == null ? entry.getKey() : task.text(),
                    entry.getValue()));
        }
        return result;
    }

    private void load(TaskFile file) {
        order.clear();
        for (Task task : file.allTasks()) {
            byKey.put(task.key(), task);
        }
        Set<String> placed = new LinkedHashSet<>();
        for (Task task : file.pending()) {
            order.add(task);
            placed.add(task.key());
            appendSubstitutions(task, placed);
        }
        // Subtasks whose decomposed parent no longer appears in the document
        for (Map.Entry<String, List<Task>> entry : substitutions.entrySet()) {
            if (!placed.contains(entry.getKey())) {
                for (Task subtask : entry.getValue()) {
                    if (placed.add(subtask.key())) {
                        order.add(subtask);
                    }
                }
            }
        }
        this.documentTotal = file.totalCount();
        this.contentHash = file.contentHash();
    }

    private void appendSubstitutions(Task task, Set<String> placed) {
        for (Task subtask : substitutions.getOrDefault(task.key(), List.of())) {
            if (placed.add(subtask.key())) {
                order.add(subtask);
                appendSubstitutions(subtask, placed);
            }
        }
    }

    private List<Task> resolveAncestors(Task task) {
        List<Task> resolved = new ArrayList<>();
        String parentKey = task.parentKey();
        while (parentKey != null && substitutions.containsKey(parentKey) && !isResolved(parentKey)) {
            List<Task> subtasks = substitutions.get(parentKey);
            if (!subtasks.stream().allMatch(s -> isResolved(s.key()))) {
                break;
            }
            Task parent = byKey.get(parentKey);
            List<String> skippedReasons = subtasks.stream()
                    .filter(s -> skipped.containsKey(s.key()))
                    .map(s -> s.text() + ": " + skipped.get(s.key()))
                    .toList();
            if (skippedReasons.isEmpty()) {
                done.add(parentKey);
            } else {
                skipped.put(parentKey, "subtask skipped (" + String.join("; ", skippedReasons) + ")");
            }
            resolved.add(parent);
            parentKey = parent.parentKey();
        }
        return resolved;
    }
}
