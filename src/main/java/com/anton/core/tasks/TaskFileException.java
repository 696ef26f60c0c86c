package com.anton.core.tasks;

import com.anton.core.AntonException;

/**
 * The task document is missing or unreadable.
 */
public class TaskFileException extends AntonException {

    public TaskFileException(String message) {
        super(message);
    }

    public TaskFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
