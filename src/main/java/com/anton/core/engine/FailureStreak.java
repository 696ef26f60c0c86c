package com.anton.core.engine;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Counts consecutive failures that share the same normalized reason. Digits and runs of
 * whitespace are collapsed so that counters and durations in a message do not break a streak.
 */
class FailureStreak {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private String lastReason;
    private int count;

    /**
     * @return the length of the streak including this failure
     */
    int record(String reason) {
        String normalized = normalize(reason);
        if (normalized.equals(lastReason)) {
            count++;
        } else {
            lastReason = normalized;
            count = 1;
        }
        return count;
    }

    void reset() {
        lastReason = null;
        count = 0;
    }

    int count() {
        return count;
    }

    static String normalize(String reason) {
        if (reason == null) {
            return "unknown";
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return SPACES.matcher(DIGITS.matcher(lower).replaceAll("#")).replaceAll(" ").trim();
    }
}
