package com.anton.core;

/**
 * Root of the orchestrator's unchecked exception hierarchy.
 */
public class AntonException extends RuntimeException {

    public AntonException(String message) {
        super(message);
    }

    public AntonException(String message, Throwable cause) {
        super(message, cause);
    }
}
