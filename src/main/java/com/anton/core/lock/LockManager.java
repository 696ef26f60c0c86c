package com.anton.core.lock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cross-process mutual exclusion for runs, backed by a lock file in a state directory.
 *
 * <p>The lock file is created with create-exclusive semantics so two processes racing to
 * start cannot both succeed. A lock is valid while it is younger than the staleness
 * threshold and its owning process is alive; anything else may be reclaimed.
 *
 * <p>Ownership is carried by the {@link LockHandle} returned from {@link #acquire}, so
 * several managers in one process never share hidden state.
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    public static final String LOCK_FILE_NAME = "anton.lock";
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofHours(1);

    private final Path lockPath;
    private final Duration staleAfter;
    private final Clock clock;
    private final ProcessLiveness liveness;
    private final long selfPid;
    private final ObjectMapper mapper = new ObjectMapper();

    public LockManager(Path stateDir) {
        this(stateDir, DEFAULT_STALE_AFTER, Clock.systemUTC(), ProcessLiveness.system(),
                ProcessHandle.current().pid());
    }

    public LockManager(Path stateDir, Duration staleAfter, Clock clock, ProcessLiveness liveness, long selfPid) {
        this.lockPath = stateDir.resolve(LOCK_FILE_NAME);
        this.staleAfter = staleAfter;
        this.clock = clock;
        this.liveness = liveness;
        this.selfPid = selfPid;
    }

    public Path getLockPath() {
        return lockPath;
    }

    /**
     * Acquires the lock for a run.
     *
     * @param taskFile task document of the run
     * @param cwd      working directory of the run
     * @return handle to pass to {@link #release}
     * @throws LockContentionException if another live process holds a valid lock
     * @throws LockException           if the lock file cannot be written
     */
    public LockHandle acquire(String taskFile, String cwd) {
        // One initial try plus exactly one retry after losing a create-exclusive race
        boolean unreadableCleared = false;
        for (int attempt = 0; attempt < 2; attempt++) {
            Optional<LockRecord> existing = readLock();
            if (existing.isPresent()) {
                clearReclaimable(existing.get());
            } else if (!unreadableCleared && Files.exists(lockPath)) {
                // no readable owner, so it can never become valid
                log.warn("Unreadable lock file {}, reclaiming", lockPath);
                delete();
                unreadableCleared = true;
            }
            try {
                return writeExclusive(taskFile, cwd);
            } catch (FileAlreadyExistsException e) {
                log.debug("Lost lock creation race on {} (attempt {})", lockPath, attempt + 1);
            }
        }
        long winner = readLock().map(LockRecord::pid).orElse(0L);
        throw new LockContentionException(winner);
    }

    /**
     * Releases a lock acquired through {@code handle}. Never throws; a lock that has since been
     * reclaimed by someone else is left in place.
     */
    public void release(LockHandle handle) {
        if (handle == null || handle.isReleased()) {
            return;
        }
        synchronized (handle) {
            try {
                Optional<LockRecord> current = readLock();
                if (current.isPresent() && !isOwnedBy(current.get(), handle)) {
                    log.warn("Lock at {} now belongs to PID {}; leaving it in place",
                            lockPath, current.get().pid());
                } else {
                    Files.deleteIfExists(lockPath);
                    log.debug("Released lock {}", lockPath);
                }
            } catch (Exception e) {
                log.warn("Failed to release lock {}: {}", lockPath, e.getMessage());
            } finally {
                handle.markReleased();
            }
        }
    }

    /**
     * Refreshes the start time of a held lock so a long-running live run is never judged
     * stale by age. Best-effort. Serialized with {@link #release} on the handle, so a refresh
     * never lands after the lock was released.
     */
    public void touch(LockHandle handle) {
        if (handle == null) {
            return;
        }
        synchronized (handle) {
            if (handle.isReleased()) {
                return;
            }
            try {
                Optional<LockRecord> current = readLock();
                if (current.isEmpty() || !isOwnedBy(current.get(), handle)) {
                    return;
                }
                LockRecord old = handle.record();
                LockRecord updated = new LockRecord(old.pid(), clock.instant().toString(), old.cwd(),
                        old.taskFile());
                Path tmp = lockPath.resolveSibling(LOCK_FILE_NAME + ".tmp");
                Files.write(tmp, mapper.writeValueAsBytes(toJson(updated)));
                Files.move(tmp, lockPath, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
                handle.refreshed(updated);
            } catch (Exception e) {
                log.debug("Lock heartbeat failed for {}: {}", lockPath, e.getMessage());
            }
        }
    }

    /** True when a valid, non-stale lock exists. Read-only. */
    public boolean isHeld() {
        return readLock().map(lock -> !isStale(lock)).orElse(false);
    }

    /**
     * Reads the current lock file. An absent or unparseable file reads as no lock; fields of
     * the wrong JSON type read as absent.
     */
    public Optional<LockRecord> readLock() {
        if (!Files.exists(lockPath)) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(lockPath.toFile());
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            JsonNode pid = node.get("pid");
            return Optional.of(new LockRecord(
                    pid != null && pid.isNumber() ? pid.asLong() : 0L,
                    textOrEmpty(node, "startedAt"),
                    textOrEmpty(node, "cwd"),
                    textOrEmpty(node, "taskFile")));
        } catch (IOException e) {
            log.debug("Unreadable lock file {}: {}", lockPath, e.getMessage());
            return Optional.empty();
        }
    }

    /** Stale when older than the threshold or when the owning process is gone. */
    public boolean isStale(LockRecord lock) {
        Instant started = lock.startedAtInstant();
        if (started != null && Duration.between(started, clock.instant()).compareTo(staleAfter) > 0) {
            return true;
        }
        return !liveness.isAlive(lock.pid());
    }

    private void clearReclaimable(LockRecord existing) {
        if (isStale(existing)) {
            log.warn("Stale lock detected (PID {}), reclaiming", existing.pid());
        } else if (existing.pid() != selfPid) {
            throw new LockContentionException(existing.pid());
        } else {
            log.debug("Lock already held by this process, reclaiming");
        }
        delete();
    }

    private void delete() {
        try {
            Files.deleteIfExists(lockPath);
        } catch (IOException e) {
            throw new LockException("Failed to remove lock " + lockPath, e);
        }
    }

    private LockHandle writeExclusive(String taskFile, String cwd) throws FileAlreadyExistsException {
        LockRecord record = new LockRecord(selfPid, clock.instant().toString(), cwd, taskFile);
        try {
            Files.createDirectories(lockPath.getParent());
            try (OutputStream out = Files.newOutputStream(lockPath,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                out.write(mapper.writeValueAsBytes(toJson(record)));
            }
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (IOException e) {
            throw new LockException("Failed to write lock " + lockPath, e);
        }
        log.info("Acquired run lock {} (PID {})", lockPath, selfPid);
        return new LockHandle(lockPath, record);
    }

    private boolean isOwnedBy(LockRecord current, LockHandle handle) {
        LockRecord held = handle.record();
        return current.pid() == held.pid() && current.startedAt().equals(held.startedAt());
    }

    private ObjectNode toJson(LockRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put("pid", record.pid());
        node.put("startedAt", record.startedAt());
        node.put("cwd", record.cwd());
        node.put("taskFile", record.taskFile());
        return node;
    }

    private static String textOrEmpty(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }
}
