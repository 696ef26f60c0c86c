package com.anton.core.prompt;

import com.anton.core.knowledge.KnowledgeHit;
import com.anton.core.knowledge.KnowledgeStore;
import com.anton.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the per-attempt instruction sent to an implementation session.
 *
 * <p>Sections, in order, each omitted when it has nothing to say: preamble, current task,
 * progress summary, vetted plan, relevant files, previous failure, result instructions.
 */
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    static final int SEARCH_LIMIT = 10;
    static final String RELEVANT_FILES_HEADING = "## Relevant Files";

    private final KnowledgeStore knowledgeStore;

    public PromptBuilder(KnowledgeStore knowledgeStore) {
        this.knowledgeStore = knowledgeStore;
    }

    public String build(PromptRequest request) {
        List<String> sections = new ArrayList<>();
        sections.add(preamble(request.decompose(), request.maxDecomposeDepth()));
        sections.add(currentTask(request));
        sections.add(progressSummary(request));
        if (request.planFile() != null && !request.planFile().isBlank()) {
            sections.add(vettedPlan(request.planFile()));
        }
        String context = relevantFiles(request.task(), request.maxContextTokens());
        if (context != null) {
            sections.add(context);
        }
        if (request.retryContext() != null && !request.retryContext().isBlank()) {
            sections.add(retryContext(request.retryContext()));
        }
        sections.add(resultInstructions(request.decompose()));
        return String.join("\n\n", sections);
    }

    static String preamble(boolean decompose, int maxDecomposeDepth) {
        var sb = new StringBuilder();
        sb.append("You are an autonomous coding agent working on ONE task.\n");
        sb.append("Complete the task, then emit exactly one `<anton-result>` block.\n");
        sb.append("Do NOT edit the task file checkboxes.\n");
        sb.append("Keep changes minimal and focused.");
        if (decompose) {
            sb.append("\n\nIf a task is too large or complex, you can decompose it into smaller subtasks.\n");
            sb.append("Maximum decomposition depth: ").append(maxDecomposeDepth).append("\n");
            sb.append("Only decompose when truly necessary - prefer completing tasks directly when possible.");
        }
        return sb.toString();
    }

    static String currentTask(PromptRequest request) {
        Task task = request.task();
        var sb = new StringBuilder();
        sb.append("## Current Task\n\n");
        sb.append("**File:** ").append(request.taskFilePath()).append("\n");
        sb.append("**Line:** ").append(task.line()).append("\n");
        sb.append("**Phase:** ").append(String.join(" → ", task.phasePath())).append("\n");
        sb.append("**Task:** ").append(task.text());
        if (!request.children().isEmpty()) {
            sb.append("\n\n**Children:**");
            for (PromptRequest.ChildStatus child : request.children()) {
                sb.append("\n- ").append(child.done() ? "[x] " : "[ ] ").append(child.text());
            }
        }
        return sb.toString();
    }

    static String progressSummary(PromptRequest request) {
        List<String> phasePath = request.task().phasePath();
        String phase = phasePath.isEmpty() ? "Unknown" : phasePath.get(0);
        return "## Progress Summary\n\n%d/%d complete. Phase: %s."
                .formatted(request.completedCount(), request.totalCount(), phase);
    }

    static String vettedPlan(String planFile) {
        return "## Vetted Plan\n\n"
                + "A reviewed implementation plan for this task is at `" + planFile + "`.\n"
                + "Read it first and follow it; do not modify the plan file.";
    }

    /**
     * Builds the retrieved-context section, or null when there are no keywords, no hits, or no
     * hit fits the token budget. Hits are appended whole until the next one would exceed the
     * budget.
     */
    String relevantFiles(Task task, int maxContextTokens) {
        List<String> keywords = KeywordExtractor.extract(task.text());
        if (keywords.isEmpty()) {
            return null;
        }
        List<KnowledgeHit> hits;
        try {
            hits = knowledgeStore.search(String.join(" ", keywords), SEARCH_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Knowledge search failed for task '{}': {}", task.text(), e.getMessage());
            return null;
        }
        if (hits == null || hits.isEmpty()) {
            return null;
        }

        var sb = new StringBuilder(RELEVANT_FILES_HEADING).append("\n\n");
        int used = TokenEstimator.estimate(sb.toString());
        for (KnowledgeHit hit : hits) {
            if (hit.content() == null || hit.content().isEmpty()) {
                continue;
            }
            String item = "**" + hit.key() + "**\n" + hit.content() + "\n\n";
            int cost = TokenEstimator.estimate(item);
            if (used + cost > maxContextTokens) {
                break;
            }
            sb.append(item);
            used += cost;
        }
        String section = sb.toString().trim();
        return section.equals(RELEVANT_FILES_HEADING) ? null : section;
    }

    static String retryContext(String reason) {
        return "## Previous Attempt Failed\n\n" + reason + "\n\nDo not repeat the same mistake.";
    }

    static String resultInstructions(boolean decompose) {
        var sb = new StringBuilder();
        sb.append("## Instructions\n\n");
        sb.append("When finished, emit exactly this block at the end of your response:\n\n");
        sb.append("```\n<anton-result>\nstatus: done\n</anton-result>\n```\n\n");
        sb.append("If blocked:\n\n");
        sb.append("```\n<anton-result>\nstatus: blocked\nreason: <why>\n</anton-result>\n```");
        if (decompose) {
            sb.append("\n\nIf task is too large:\n\n");
            sb.append("```\n<anton-result>\nstatus: decompose\nsubtasks:\n- <sub-task 1>\n- <sub-task 2>\n</anton-result>\n```");
        }
        return sb.toString();
    }

    /** Prompt asking a session that produced an unusable result to restate it. */
    public static String formatRecovery(String diagnostic) {
        return "Your previous response did not contain a valid result block (" + diagnostic + ").\n"
                + "Do not call any tools. Reply with ONLY the result block for the task you just worked on:\n\n"
                + "<anton-result>\nstatus: done|blocked|decompose\nreason: <optional>\n</anton-result>";
    }

    /** Prompt asking the implementing session to address a rejected review. */
    public static String verificationFix(String reviewerReason) {
        return "A reviewer rejected your change for this task:\n" + reviewerReason + "\n\n"
                + "Fix exactly what the reviewer describes, keep the rest of your change, "
                + "then emit the `<anton-result>` block again.";
    }

    /** Prompt continuing a session that was interrupted by a tool-call loop. */
    public static String loopContinuation(String detail) {
        return "Your previous turn was stopped because it repeated the same tool call (" + detail + ").\n"
                + "Change approach: re-read the relevant files, make a different edit, then finish the task "
                + "and emit the `<anton-result>` block.";
    }
}
