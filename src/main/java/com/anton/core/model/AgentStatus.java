package com.anton.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome an agent reports for one task turn.
 */
public enum AgentStatus {
    DONE,
    BLOCKED,
    DECOMPOSE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentStatus status : values()) {
            if (status.wireName().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
