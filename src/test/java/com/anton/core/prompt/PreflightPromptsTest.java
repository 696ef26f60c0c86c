package com.anton.core.prompt;

import com.anton.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreflightPromptsTest {

    private static final Path PLAN_DIR = Path.of("/repo/.agents/tasks").toAbsolutePath();
    private static final Task TASK = new Task("k", "Cache user lookups", 4, List.of("Perf"), 0, false, null, List.of());

    @Nested
    @DisplayName("discovery replies")
    class Discovery {

        @Test
        @DisplayName("complete needs no filename")
        void complete() {
            PreflightDecision decision = PreflightPrompts.parseDiscovery("{\"status\":\"complete\",\"filename\":\"\"}",
                    PLAN_DIR);

            assertTrue(decision.isComplete());
            assertNull(decision.planFile());
        }

        @Test
        @DisplayName("incomplete resolves a relative filename inside the plan directory")
        void relativeFilename() {
            PreflightDecision decision = PreflightPrompts.parseDiscovery(
                    "Sure.\n```json\n{\"status\":\"incomplete\",\"filename\":\"plan-1.md\"}\n```", PLAN_DIR);

            assertEquals(PLAN_DIR.resolve("plan-1.md"), decision.planFile());
        }

        @Test
        @DisplayName("rejects a filename that escapes the plan directory")
        void outsidePlanDir() {
            PreflightParseException e = assertThrows(PreflightParseException.class,
                    () -> PreflightPrompts.parseDiscovery(
                            "{\"status\":\"incomplete\",\"filename\":\"../../src/Main.java\"}", PLAN_DIR));
            assertEquals("preflight-discovery-filename-outside-plan-dir", e.getMessage());
        }

        @Test
        @DisplayName("rejects unknown status and missing JSON")
        void invalid() {
            assertThrows(PreflightParseException.class,
                    () -> PreflightPrompts.parseDiscovery("{\"status\":\"maybe\",\"filename\":\"\"}", PLAN_DIR));
            PreflightParseException missing = assertThrows(PreflightParseException.class,
                    () -> PreflightPrompts.parseDiscovery("I looked around and it's fine.", PLAN_DIR));
            assertEquals("preflight-json-missing-object", missing.getMessage());
        }

        @Test
        @DisplayName("incomplete with a blank filename is invalid")
        void blankFilename() {
            assertThrows(PreflightParseException.class,
                    () -> PreflightPrompts.parseDiscovery("{\"status\":\"incomplete\",\"filename\":\"\"}", PLAN_DIR));
        }
    }

    @Nested
    @DisplayName("review replies")
    class Review {

        @Test
        @DisplayName("ready with an absolute path inside the plan directory")
        void ready() {
            Path plan = PLAN_DIR.resolve("p.md");

            PreflightDecision decision = PreflightPrompts.parseReview(
                    "{\"status\":\"ready\",\"filename\":\"" + plan + "\"}", PLAN_DIR);

            assertEquals(plan, decision.planFile());
        }

        @Test
        @DisplayName("anything but ready is invalid")
        void notReady() {
            assertThrows(PreflightParseException.class,
                    () -> PreflightPrompts.parseReview("{\"status\":\"complete\",\"filename\":\"p.md\"}", PLAN_DIR));
        }
    }

    @Nested
    @DisplayName("prompts")
    class Prompts {

        @Test
        @DisplayName("discovery forbids implementation and names the plan file and directory")
        void discoveryPrompt() {
            Path plan = PLAN_DIR.resolve("p.md");

            String prompt = PreflightPrompts.discovery(TASK, "TASKS.md", Path.of("/repo"), PLAN_DIR, plan, null);

            assertTrue(prompt.contains("DO NOT COMPLETE THE TASK"));
            assertTrue(prompt.contains("Cache user lookups"));
            assertTrue(prompt.contains(plan.toString()));
            assertTrue(prompt.contains("MUST NOT modify any files outside: " + PLAN_DIR));
            assertFalse(prompt.contains("RETRY CONTEXT"));
        }

        @Test
        @DisplayName("discovery carries the retry hint")
        void retryHint() {
            String prompt = PreflightPrompts.discovery(TASK, "TASKS.md", Path.of("/repo"), PLAN_DIR,
                    PLAN_DIR.resolve("p.md"), "previous try timed out");

            assertTrue(prompt.contains("RETRY CONTEXT: previous try timed out"));
        }

        @Test
        @DisplayName("fallback plan quotes the task verbatim")
        void fallback() {
            String plan = PreflightPrompts.fallbackPlan(TASK, "discovery");

            assertTrue(plan.contains("## Task (verbatim)\nCache user lookups"));
            assertTrue(plan.contains("Generated because discovery"));
        }
    }
}
