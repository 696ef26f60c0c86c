package com.anton.core.lock;

import java.nio.file.Path;

/**
 * Proof of lock ownership returned by {@link LockManager#acquire} and required by
 * {@link LockManager#release}.
 */
public final class LockHandle {

    private final Path path;
    private volatile LockRecord record;
    private volatile boolean released;

    LockHandle(Path path, LockRecord record) {
        this.path = path;
        this.record = record;
    }

    public Path path() {
        return path;
    }

    public LockRecord record() {
        return record;
    }

    public boolean isReleased() {
        return released;
    }

    void refreshed(LockRecord updated) {
        this.record = updated;
    }

    void markReleased() {
        this.released = true;
    }
}
