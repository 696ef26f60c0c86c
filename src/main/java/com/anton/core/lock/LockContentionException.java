package com.anton.core.lock;

import com.anton.core.AntonException;

/**
 * Another live run holds the lock.
 */
public class LockContentionException extends AntonException {

    private final long blockingPid;

    public LockContentionException(long blockingPid) {
        super("Run already in progress (PID %d). Stop it before starting another run.".formatted(blockingPid));
        this.blockingPid = blockingPid;
    }

    public long getBlockingPid() {
        return blockingPid;
    }
}
