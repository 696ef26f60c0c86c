package com.anton.core.model;

import java.time.Instant;

/**
 * A tool-call loop (or turn timeout) condition observed during a task attempt.
 *
 * @param kind handled vs. abandoned
 * @param taskText task the attempt was working on
 * @param message detail such as "Auto-recovered by continuing (retry 1/3)"
 * @param at when the condition was observed
 */
public record LoopEvent(LoopEventKind kind, String taskText, String message, Instant at) {
}
