package com.anton.core.engine;

import com.anton.core.model.TaskAttempt;

import java.util.List;
import java.util.Set;

/**
 * An attempt record plus what the controller needs to act on it.
 *
 * @param attempt         the recorded attempt
 * @param subtasks        proposed subtasks for a decomposed attempt, empty otherwise
 * @param exhaustRetries  whether retrying this task is pointless
 * @param untrackedBefore untracked files present before the attempt, for rollback
 */
record AttemptOutcome(TaskAttempt attempt, List<String> subtasks, boolean exhaustRetries, Set<String> untrackedBefore) {

    AttemptOutcome {
        subtasks = List.copyOf(subtasks);
        untrackedBefore = Set.copyOf(untrackedBefore);
    }
}
