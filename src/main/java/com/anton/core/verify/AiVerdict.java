package com.anton.core.verify;

/**
 * A verification session's judgement of a diff.
 */
public record AiVerdict(boolean pass, String reason) {
}
