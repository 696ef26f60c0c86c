package com.anton.core.progress;

import java.util.Locale;

/**
 * Coarse run phases announced through stage events.
 */
public enum Stage {
    PLANNING("planning", "Planning"),
    RUNTIME_PREFLIGHT("runtime_preflight", "Pre-flight"),
    EXECUTING("executing", "Executing");

    private final String id;
    private final String label;

    Stage(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a stage from its wire id. Unknown ids fall back to {@link #EXECUTING}.
     */
    public static Stage fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (Stage stage : values()) {
                if (stage.id.equals(normalized)) {
                    return stage;
                }
            }
        }
        return EXECUTING;
    }
}
