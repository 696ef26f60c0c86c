package com.anton.core.lock;

/**
 * Liveness check for the process recorded in a lock.
 */
@FunctionalInterface
public interface ProcessLiveness {

    boolean isAlive(long pid);

    /** Checks the operating system's process table. */
    static ProcessLiveness system() {
        return pid -> pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
