package com.anton.core.session;

import com.anton.core.AntonException;

/**
 * An agent session failed or was cancelled.
 */
public class AgentSessionException extends AntonException {

    private final boolean cancelled;

    public AgentSessionException(String message) {
        this(message, false, null);
    }

    public AgentSessionException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public AgentSessionException(String message, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.cancelled = cancelled;
    }

    public static AgentSessionException cancelled() {
        return new AgentSessionException("Session cancelled", true, null);
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
