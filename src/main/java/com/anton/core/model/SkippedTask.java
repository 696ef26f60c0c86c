package com.anton.core.model;

/**
 * A task the run gave up on, with the recorded reason.
 */
public record SkippedTask(String taskKey, String taskText, String reason) {
}
