package com.anton.core.lock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LockManagerTest {

    private static final long SELF = 1000L;
    private static final long OTHER = 2000L;
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path stateDir;

    private final Set<Long> alive = new HashSet<>();
    private LockManager manager;

    @BeforeEach
    void setUp() {
        alive.add(SELF);
        manager = managerFor(SELF, NOW);
    }

    private LockManager managerFor(long pid, Instant now) {
        return new LockManager(stateDir, LockManager.DEFAULT_STALE_AFTER, Clock.fixed(now, ZoneOffset.UTC),
                alive::contains, pid);
    }

    private void writeLock(String json) throws Exception {
        Files.createDirectories(stateDir);
        Files.writeString(stateDir.resolve(LockManager.LOCK_FILE_NAME), json);
    }

    @Nested
    @DisplayName("acquire")
    class Acquire {

        @Test
        @DisplayName("writes pid, start time, cwd and task file as JSON")
        void writesLockFile() throws Exception {
            LockHandle handle = manager.acquire("/work/TASKS.md", "/work");

            JsonNode node = new ObjectMapper().readTree(handle.path().toFile());
            assertEquals(SELF, node.get("pid").asLong());
            assertEquals(NOW.toString(), node.get("startedAt").asText());
            assertEquals("/work", node.get("cwd").asText());
            assertEquals("/work/TASKS.md", node.get("taskFile").asText());
            assertTrue(manager.isHeld());
        }

        @Test
        @DisplayName("refuses when another live process holds a fresh lock")
        void contention() {
            alive.add(OTHER);
            managerFor(OTHER, NOW).acquire("t.md", "/w");

            LockContentionException e = assertThrows(LockContentionException.class,
                    () -> manager.acquire("t.md", "/w"));
            assertEquals(OTHER, e.getBlockingPid());
        }

        @Test
        @DisplayName("reclaims a lock whose owner is dead")
        void reclaimsDeadOwner() throws Exception {
            writeLock("{\"pid\":" + OTHER + ",\"startedAt\":\"" + NOW + "\",\"cwd\":\"/w\",\"taskFile\":\"t.md\"}");

            LockHandle handle = manager.acquire("t.md", "/w");

            assertEquals(SELF, handle.record().pid());
        }

        @Test
        @DisplayName("reclaims a lock older than an hour even if the pid is alive")
        void reclaimsOldLock() throws Exception {
            alive.add(OTHER);
            Instant old = NOW.minus(Duration.ofMinutes(61));
            writeLock("{\"pid\":" + OTHER + ",\"startedAt\":\"" + old + "\",\"cwd\":\"/w\",\"taskFile\":\"t.md\"}");

            assertDoesNotThrow(() -> manager.acquire("t.md", "/w"));
        }

        @Test
        @DisplayName("silently reclaims a lock recorded under its own pid")
        void reclaimsOwnPid() {
            manager.acquire("t.md", "/w");

            LockHandle second = managerFor(SELF, NOW.plusSeconds(1)).acquire("t.md", "/w");

            assertEquals(NOW.plusSeconds(1).toString(), second.record().startedAt());
        }

        @Test
        @DisplayName("treats an unparseable lock file as no lock and reclaims it")
        void unparseableFile() throws Exception {
            writeLock("not json at all");

            assertTrue(manager.readLock().isEmpty());
            LockHandle handle = manager.acquire("t.md", "/w");

            assertEquals(SELF, manager.readLock().orElseThrow().pid());
            assertEquals(handle.path(), manager.getLockPath());
        }

        @Test
        @DisplayName("reclaims an empty lock file left by a crash mid-write")
        void emptyFile() throws Exception {
            writeLock("");

            assertFalse(manager.isHeld());
            LockHandle handle = manager.acquire("t.md", "/w");

            LockRecord record = manager.readLock().orElseThrow();
            assertEquals(SELF, record.pid());
            assertEquals("t.md", record.taskFile());
            assertFalse(handle.isReleased());
        }

        @Test
        @DisplayName("reads fields of the wrong JSON type as absent")
        void wrongFieldTypes() throws Exception {
            writeLock("{\"pid\":\"123\",\"startedAt\":42,\"cwd\":null}");

            LockRecord record = manager.readLock().orElseThrow();

            assertEquals(0L, record.pid());
            assertEquals("", record.startedAt());
            assertEquals("", record.cwd());
            assertEquals("", record.taskFile());
            assertTrue(manager.isStale(record));
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        @Test
        @DisplayName("removes the lock file it owns")
        void removesOwnLock() {
            LockHandle handle = manager.acquire("t.md", "/w");

            manager.release(handle);

            assertFalse(Files.exists(handle.path()));
            assertTrue(handle.isReleased());
            assertFalse(manager.isHeld());
        }

        @Test
        @DisplayName("leaves a lock that was reclaimed by another process")
        void leavesForeignLock() throws Exception {
            LockHandle handle = manager.acquire("t.md", "/w");
            alive.add(OTHER);
            writeLock("{\"pid\":" + OTHER + ",\"startedAt\":\"" + NOW + "\",\"cwd\":\"/w\",\"taskFile\":\"t.md\"}");

            manager.release(handle);

            assertEquals(OTHER, manager.readLock().orElseThrow().pid());
        }

        @Test
        @DisplayName("is a no-op for null or already released handles")
        void idempotent() {
            LockHandle handle = manager.acquire("t.md", "/w");
            manager.release(handle);

            assertDoesNotThrow(() -> manager.release(handle));
            assertDoesNotThrow(() -> manager.release(null));
        }
    }

    @Nested
    @DisplayName("touch")
    class Touch {

        @Test
        @DisplayName("refreshes the start time so a long run never goes stale by age")
        void refreshesStartTime() {
            LockHandle handle = manager.acquire("t.md", "/w");
            Instant later = NOW.plus(Duration.ofMinutes(90));
            LockManager laterManager = managerFor(SELF, later);

            laterManager.touch(handle);

            LockRecord record = laterManager.readLock().orElseThrow();
            assertEquals(later.toString(), record.startedAt());
            assertFalse(laterManager.isStale(record));
            laterManager.release(handle);
            assertFalse(Files.exists(handle.path()));
        }

        @Test
        @DisplayName("a touch after release does not recreate the lock file")
        void afterRelease() {
            LockHandle handle = manager.acquire("t.md", "/w");
            manager.release(handle);

            manager.touch(handle);

            assertFalse(Files.exists(handle.path()));
            assertFalse(manager.isHeld());
        }
    }
}
