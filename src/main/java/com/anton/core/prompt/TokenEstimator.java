package com.anton.core.prompt;

/**
 * Coarse character-ratio token estimate, good enough for budget gating.
 */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
