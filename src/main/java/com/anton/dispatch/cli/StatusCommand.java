package com.anton.dispatch.cli;

import com.anton.core.lock.LockManager;
import com.anton.core.lock.LockRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Optional;

/**
 * CLI command: anton status
 * <p>
 * Reports whether a run holds the lock, and which one.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show whether a run is in progress")
@Component
public class StatusCommand implements Runnable {

    private final LockManager lockManager;

    public StatusCommand(LockManager lockManager) {
        this.lockManager = lockManager;
    }

    @Override
    public void run() {
        Optional<LockRecord> lock = lockManager.readLock();
        if (lock.isEmpty()) {
            ConsoleOutput.info("No run in progress.");
            return;
        }
        LockRecord record = lock.get();
        if (lockManager.isStale(record)) {
            ConsoleOutput.warn("Stale lock from PID " + record.pid() + " (started " + record.startedAt()
                    + "); the next run will reclaim it.");
            return;
        }
        ConsoleOutput.success("Run in progress");
        System.out.println("  PID:       " + record.pid());
        System.out.println("  Started:   " + record.startedAt());
        System.out.println("  Task file: " + record.taskFile());
        System.out.println("  Directory: " + record.cwd());
    }
}
