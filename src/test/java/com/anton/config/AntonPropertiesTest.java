package com.anton.config;

import com.anton.core.model.RunConfig;
import com.anton.core.model.ScopeGuardMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AntonPropertiesTest {

    private static final Path PROJECT = Path.of("/work/app");
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    @DisplayName("defaults resolve to the documented run policy")
    void defaults() {
        RunConfig run = new AntonProperties().toRunConfig(Path.of("TASKS.md"), PROJECT, null);

        assertEquals(PROJECT.resolve("TASKS.md"), run.taskFile());
        assertEquals(PROJECT.resolve(".agents/tasks"), run.planDir());
        assertEquals(Duration.ofMinutes(10), run.taskTimeout());
        assertEquals(Duration.ofHours(2), run.totalTimeout());
        assertEquals(3, run.maxRetries());
        assertEquals(200, run.maxTotalIterations());
        assertTrue(run.autoCommit());
        assertTrue(run.skipOnBlocked());
        assertFalse(run.skipOnFail());
        assertEquals(ScopeGuardMode.LAX, run.scopeGuard());
        assertEquals(Duration.ofSeconds(30), run.heartbeatInterval());
        assertEquals(128_000, run.maxPromptTokens());
        assertNull(run.branch());
        assertFalse(run.dryRun());
        assertFalse(run.preflight().enabled());
    }

    @Test
    @DisplayName("command-line overrides replace only the values they set")
    void overrides() {
        AntonProperties props = new AntonProperties();
        props.setSkipOnFail(false);

        RunConfig run = props.toRunConfig(Path.of("TASKS.md"), PROJECT,
                new AntonProperties.RunOverrides(true, false, true, null, true, true), CLOCK);

        assertTrue(run.preflight().enabled());
        assertFalse(run.autoCommit());
        assertTrue(run.skipOnFail());
        assertFalse(run.rollbackOnFail());
        assertEquals("anton-1700000000000", run.branch());
        assertTrue(run.dryRun());
    }

    @Test
    @DisplayName("heartbeat and retries are floored, preflight timeouts capped by the session timeout")
    void floorsAndCaps() {
        AntonProperties props = new AntonProperties();
        props.setProgressHeartbeatSec(1);
        props.setMaxRetries(0);
        props.getPreflight().setSessionTimeoutSec(120);
        props.getPreflight().setDiscoveryTimeoutSec(600);
        props.getPreflight().setReviewTimeoutSec(60);

        RunConfig run = props.toRunConfig(Path.of("TASKS.md"), PROJECT, AntonProperties.RunOverrides.none());

        assertEquals(Duration.ofSeconds(5), run.heartbeatInterval());
        assertEquals(1, run.maxRetries());
        assertEquals(Duration.ofSeconds(120), run.preflight().discoveryTimeout());
        assertEquals(Duration.ofSeconds(60), run.preflight().reviewTimeout());
    }

    @Test
    @DisplayName("absolute task files are kept and unknown scope modes fall back to lax")
    void pathsAndScope() {
        AntonProperties props = new AntonProperties();
        props.setScopeGuard("STRICT");
        props.setPlanDir("plans");

        RunConfig strict = props.toRunConfig(Path.of("/elsewhere/todo.md"), PROJECT, null);
        props.setScopeGuard("sometimes");
        RunConfig unknown = props.toRunConfig(Path.of("todo.md"), PROJECT, null);

        assertEquals(Path.of("/elsewhere/todo.md"), strict.taskFile());
        assertEquals(PROJECT.resolve("plans"), strict.planDir());
        assertEquals(ScopeGuardMode.STRICT, strict.scopeGuard());
        assertEquals(ScopeGuardMode.LAX, unknown.scopeGuard());
    }
}
