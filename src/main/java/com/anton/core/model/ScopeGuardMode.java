package com.anton.core.model;

import java.util.Locale;

/**
 * How strictly changed files are checked against files named in the task text.
 */
public enum ScopeGuardMode {
    OFF,
    LAX,
    STRICT;

    /** Parses a configured mode name, case-insensitively. Blank or unknown values mean LAX. */
    public static ScopeGuardMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return LAX;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LAX;
        }
    }
}
