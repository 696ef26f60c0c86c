package com.anton.core.prompt;

import com.anton.core.knowledge.KnowledgeHit;
import com.anton.core.knowledge.KnowledgeStore;
import com.anton.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private static final Task TASK = new Task("k1", "Add retry logic to the payment client", 12,
            List.of("Backend", "Payments"), 0, false, null, List.of());

    private static PromptRequest request(String retry, String plan, boolean decompose) {
        return new PromptRequest(TASK, List.of(), "TASKS.md", 3, 10, retry, plan, decompose, 2, 8000);
    }

    @Nested
    @DisplayName("sections")
    class Sections {

        @Test
        @DisplayName("contains task, location, progress and result instructions in order")
        void order() {
            String prompt = new PromptBuilder(KnowledgeStore.none()).build(request(null, null, true));

            int task = prompt.indexOf("## Current Task");
            int progress = prompt.indexOf("## Progress Summary");
            int instructions = prompt.indexOf("## Instructions");
            assertTrue(task > 0 && task < progress && progress < instructions);
            assertTrue(prompt.contains("**File:** TASKS.md"));
            assertTrue(prompt.contains("**Line:** 12"));
            assertTrue(prompt.contains("**Phase:** Backend → Payments"));
            assertTrue(prompt.contains("3/10 complete. Phase: Backend."));
            assertTrue(prompt.contains("Maximum decomposition depth: 2"));
            assertTrue(prompt.contains("status: decompose"));
        }

        @Test
        @DisplayName("omits decomposition guidance when decomposition is off")
        void noDecompose() {
            String prompt = new PromptBuilder(KnowledgeStore.none()).build(request(null, null, false));

            assertFalse(prompt.contains("decompose"));
        }

        @Test
        @DisplayName("includes the vetted plan and previous failure when present")
        void planAndRetry() {
            String prompt = new PromptBuilder(KnowledgeStore.none())
                    .build(request("Previous attempt #1 result: failed\nError: tests red", ".agents/tasks/p.md", false));

            assertTrue(prompt.contains("## Vetted Plan"));
            assertTrue(prompt.contains("`.agents/tasks/p.md`"));
            assertTrue(prompt.contains("## Previous Attempt Failed"));
            assertTrue(prompt.contains("Error: tests red"));
            assertTrue(prompt.indexOf("## Previous Attempt Failed") < prompt.indexOf("## Instructions"));
        }

        @Test
        @DisplayName("lists children with their completion state")
        void children() {
            PromptRequest req = new PromptRequest(TASK, List.of(new PromptRequest.ChildStatus("write test", true),
                    new PromptRequest.ChildStatus("wire config", false)), "TASKS.md", 0, 3, null, null, false, 2, 8000);

            String prompt = new PromptBuilder(KnowledgeStore.none()).build(req);

            assertTrue(prompt.contains("- [x] write test"));
            assertTrue(prompt.contains("- [ ] wire config"));
        }
    }

    @Nested
    @DisplayName("relevant files")
    class RelevantFiles {

        @Test
        @DisplayName("searches with the task keywords and renders hits")
        void rendersHits() {
            List<String> queries = new ArrayList<>();
            KnowledgeStore store = (query, limit) -> {
                queries.add(query);
                return List.of(new KnowledgeHit("notes/payments.md", "Retries use exponential backoff.", 2.0));
            };

            String prompt = new PromptBuilder(store).build(request(null, null, false));

            assertEquals(List.of("add retry logic payment client"), queries);
            assertTrue(prompt.contains("## Relevant Files"));
            assertTrue(prompt.contains("**notes/payments.md**"));
        }

        @Test
        @DisplayName("stops adding hits at the token budget")
        void budget() {
            KnowledgeStore store = (query, limit) -> List.of(
                    new KnowledgeHit("small.md", "tiny", 2.0),
                    new KnowledgeHit("huge.md", "x".repeat(4000), 1.0));
            PromptRequest req = new PromptRequest(TASK, List.of(), "TASKS.md", 0, 1, null, null, false, 2, 100);

            String prompt = new PromptBuilder(store).build(req);

            assertTrue(prompt.contains("small.md"));
            assertFalse(prompt.contains("huge.md"));
        }

        @Test
        @DisplayName("a search without hits leaves the section out")
        void noHits() {
            List<String> queries = new ArrayList<>();
            KnowledgeStore store = (query, limit) -> {
                queries.add(query);
                return List.of();
            };

            String prompt = new PromptBuilder(store).build(request(null, null, false));

            assertEquals(1, queries.size());
            assertFalse(prompt.contains("## Relevant Files"));
        }

        @Test
        @DisplayName("a task without keywords never queries the store")
        void noKeywords() {
            Task vague = new Task("k2", "Do it at 10:00 by 5pm", 3, List.of(), 0, false, null, List.of());
            KnowledgeStore store = (query, limit) -> {
                throw new AssertionError("store queried for " + query);
            };

            String prompt = new PromptBuilder(store).build(
                    new PromptRequest(vague, List.of(), "TASKS.md", 0, 1, null, null, false, 2, 8000));

            assertFalse(prompt.contains("## Relevant Files"));
        }

        @Test
        @DisplayName("a failing store leaves the section out")
        void failingStore() {
            KnowledgeStore store = (query, limit) -> {
                throw new IllegalStateException("index offline");
            };

            String prompt = new PromptBuilder(store).build(request(null, null, false));

            assertFalse(prompt.contains("## Relevant Files"));
        }
    }

    @Test
    @DisplayName("keyword extraction drops stop words, short and non-alphabetic words")
    void keywords() {
        assertEquals(List.of("update", "config", "loader"),
                KeywordExtractor.extract("Update the config loader to v2 in it"));
        assertTrue(KeywordExtractor.extract("  ").isEmpty());
    }

    @Test
    @DisplayName("token estimate is a ceiling of characters over four")
    void tokenEstimate() {
        assertEquals(0, TokenEstimator.estimate(""));
        assertEquals(1, TokenEstimator.estimate("abc"));
        assertEquals(2, TokenEstimator.estimate("abcde"));
    }
}
