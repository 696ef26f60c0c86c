package com.anton.core.prompt;

import java.nio.file.Path;

/**
 * Parsed reply of a discovery or requirements-review session.
 *
 * @param status "complete", "incomplete" or "ready"
 * @param planFile absolute plan file path inside the plan directory, null for "complete"
 */
public record PreflightDecision(String status, Path planFile) {

    public boolean isComplete() {
        return "complete".equals(status);
    }
}
