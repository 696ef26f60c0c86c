package com.anton.core.lock;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Contents of the lock file. Fields that were missing or of the wrong type read as 0 or "".
 *
 * @param pid owning process id
 * @param startedAt ISO-8601 instant the lock was written or last refreshed
 * @param cwd working directory of the owning run
 * @param taskFile task document of the owning run
 */
public record LockRecord(long pid, String startedAt, String cwd, String taskFile) {

    /** Parsed start time, or null when the stored value is not a valid instant. */
    public Instant startedAtInstant() {
        if (startedAt == null || startedAt.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(startedAt);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
