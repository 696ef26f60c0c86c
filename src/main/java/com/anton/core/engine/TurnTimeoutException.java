package com.anton.core.engine;

import com.anton.core.AntonException;

import java.time.Duration;

/**
 * An agent turn outlived its budget and was cancelled through the session.
 */
public class TurnTimeoutException extends AntonException {

    private final Duration limit;

    public TurnTimeoutException(String label, Duration limit) {
        super(label + " timed out after " + limit.toSeconds() + "s");
        this.limit = limit;
    }

    public Duration getLimit() {
        return limit;
    }
}
