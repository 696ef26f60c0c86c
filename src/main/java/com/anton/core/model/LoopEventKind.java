package com.anton.core.model;

/**
 * Whether a repetitive tool-call condition was handled or abandoned.
 */
public enum LoopEventKind {
    AUTO_RECOVERED("auto-recovered"),
    FINAL_FAILURE("final-failure");

    private final String label;

    LoopEventKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
