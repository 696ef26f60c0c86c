package com.anton.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A parsed task document.
 *
 * @param path source document
 * @param allTasks every task in depth-first document order
 * @param pending unchecked tasks in depth-first document order
 * @param completed checked tasks in depth-first document order
 * @param totalCount number of tasks, subtasks included
 * @param contentHash SHA-256 of the raw document
 */
public record TaskFile(
    Path path,
    List<Task> allTasks,
    List<Task> pending,
    List<Task> completed,
    int totalCount,
    String contentHash
) {

    public TaskFile {
        allTasks = List.copyOf(allTasks);
        pending = List.copyOf(pending);
        completed = List.copyOf(completed);
    }
}
