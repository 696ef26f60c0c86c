package com.anton.core.prompt;

import com.anton.core.model.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;

/**
 * Prompts and reply parsing for the two preflight stages.
 *
 * <p>Discovery replies {@code {"status":"complete"|"incomplete","filename":...}}; review replies
 * {@code {"status":"ready","filename":...}}. A plan filename must resolve inside the plan
 * directory.
 */
public final class PreflightPrompts {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PreflightPrompts() {}

    public static String discovery(Task task, String taskFilePath, Path projectDir, Path planDir,
                                   Path planFile, String retryHint) {
        var sb = new StringBuilder();
        sb.append("You are running PRE-FLIGHT DISCOVERY for an autonomous coding orchestrator.\n\n");
        sb.append("CRITICAL: DO NOT COMPLETE THE TASK. DO NOT IMPLEMENT ANY CODE CHANGES.\n");
        sb.append("Your only goals are:\n");
        sb.append("1) Verify whether the task is already fully complete in the current codebase.\n");
        sb.append("2) If incomplete, determine what likely needs to change and which files are likely involved.\n\n");
        sb.append("Task metadata:\n");
        sb.append("- Task file: ").append(taskFilePath).append("\n");
        sb.append("- Task line: ").append(task.line()).append("\n");
        sb.append("- Phase: ").append(task.phasePath().isEmpty() ? "N/A" : String.join(" > ", task.phasePath()))
                .append("\n");
        sb.append("- Project dir: ").append(projectDir).append("\n\n");
        sb.append("FULL TASK (VERBATIM):\n").append(task.text()).append("\n\n");
        sb.append("If task is already complete:\n");
        sb.append("- Return EXACT JSON only:\n");
        sb.append("{\"status\":\"complete\",\"filename\":\"\"}\n\n");
        sb.append("If task is incomplete:\n");
        sb.append("- Create/update this markdown file path exactly: ").append(planFile).append("\n");
        sb.append("- You MUST NOT modify any files outside: ").append(planDir).append("\n");
        sb.append("- The markdown MUST include:\n");
        sb.append("  - The FULL TASK (VERBATIM)\n");
        sb.append("  - What is missing\n");
        sb.append("  - Concrete implementation recommendation\n");
        sb.append("  - Likely files to modify/create (or explicitly state none)\n");
        sb.append("- Then return EXACT JSON only:\n");
        sb.append("{\"status\":\"incomplete\",\"filename\":\"").append(planFile).append("\"}\n\n");
        if (retryHint != null && !retryHint.isBlank()) {
            sb.append("RETRY CONTEXT: ").append(retryHint).append("\n");
            sb.append("Keep output minimal, write/update only the plan file above, and return valid JSON.\n\n");
        }
        sb.append("Return JSON only. No markdown fences. No commentary.");
        return sb.toString();
    }

    public static String requirementsReview(Path planFile) {
        return "Please review this plan file and perform a strict peer review:\n" + planFile + "\n\n"
                + "Treat it as written by an entry-level developer who may miss edge cases and fail to reuse existing code.\n"
                + "Be thorough and precise. Update the SAME file in-place to improve correctness, reuse, and clarity.\n"
                + "Remove ambiguity and tighten implementation steps.\n\n"
                + "After review, return EXACT JSON only:\n"
                + "{\"status\":\"ready\",\"filename\":\"" + planFile + "\"}\n\n"
                + "Return JSON only. No markdown fences. No commentary.";
    }

    /** Asked once when a discovery reply could not be parsed. */
    public static String forceDiscoveryDecision() {
        return "STOP. You must return your discovery result NOW.\n\n"
                + "Return ONLY this JSON (no markdown, no explanation, no tool calls):\n"
                + "{\"status\":\"complete\",\"filename\":\"\"}\n"
                + "OR\n"
                + "{\"status\":\"incomplete\",\"filename\":\"<absolute-path-to-plan-file-you-created>\"}\n\n"
                + "If you wrote a plan file, use that path. If the task is already done, use \"complete\" with an empty filename.\n"
                + "JSON only. Nothing else.";
    }

    /** Asked once when a review reply could not be parsed. */
    public static String forceReviewDecision() {
        return "STOP. You must return your review result NOW.\n\n"
                + "Return ONLY this JSON (no markdown, no explanation, no tool calls):\n"
                + "{\"status\":\"ready\",\"filename\":\"<absolute-path-to-plan-file>\"}\n\n"
                + "Use the plan file path you were reviewing.\n"
                + "JSON only. Nothing else.";
    }

    /**
     * Asked when a stage named a plan file that is missing or empty.
     *
     * @param status the JSON status the stage must repeat, "incomplete" or "ready"
     */
    public static String rewritePlan(Path planFile, String problem, String status) {
        return "The plan file you reported is not usable (" + problem + "):\n" + planFile + "\n\n"
                + "Write the complete plan to that exact path now using your file tools. "
                + "Do not modify any other file.\n\n"
                + "Then return EXACT JSON only:\n"
                + "{\"status\":\"" + status + "\",\"filename\":\"" + planFile + "\"}";
    }

    /** Body written when a stage failed to leave a usable plan behind. */
    public static String fallbackPlan(Task task, String stage) {
        return String.join("\n",
                "# Anton preflight plan (auto-generated fallback)",
                "",
                "> Generated because " + stage + " did not write a valid plan file.",
                "",
                "## Task (verbatim)",
                task.text(),
                "",
                "## Missing",
                "- Discovery/review did not persist structured details to disk.",
                "",
                "## Recommendation",
                "- Keep implementation scoped to this task only.",
                "",
                "## Likely files",
                "- TBD",
                "");
    }

    public static PreflightDecision parseDiscovery(String raw, Path planDir) {
        JsonNode node = parseObject(raw);
        String status = text(node, "status");
        if (!"complete".equals(status) && !"incomplete".equals(status)) {
            throw new PreflightParseException("preflight-discovery-invalid-status:" + status);
        }
        String filename = filename(node, "discovery");
        if ("complete".equals(status)) {
            return new PreflightDecision(status, null);
        }
        return new PreflightDecision(status, insidePlanDir(filename, planDir, "discovery"));
    }

    public static PreflightDecision parseReview(String raw, Path planDir) {
        JsonNode node = parseObject(raw);
        String status = text(node, "status");
        if (!"ready".equals(status)) {
            throw new PreflightParseException("preflight-review-invalid-status:" + status);
        }
        return new PreflightDecision(status, insidePlanDir(filename(node, "review"), planDir, "review"));
    }

    private static JsonNode parseObject(String raw) {
        try {
            JsonNode node = MAPPER.readTree(JsonReplies.extractObject(raw)
                    .orElseThrow(() -> new PreflightParseException("preflight-json-missing-object")));
            if (node == null || !node.isObject()) {
                throw new PreflightParseException("preflight-json-missing-object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new PreflightParseException("preflight-json-invalid: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    private static String filename(JsonNode node, String stage) {
        JsonNode value = node.get("filename");
        if (value == null || !value.isTextual()) {
            throw new PreflightParseException("preflight-" + stage + "-invalid-filename");
        }
        return value.asText();
    }

    private static Path insidePlanDir(String filename, Path planDir, String stage) {
        if (filename.isBlank()) {
            throw new PreflightParseException("preflight-" + stage + "-invalid-filename");
        }
        Path root = planDir.toAbsolutePath().normalize();
        Path candidate = Path.of(filename);
        Path resolved = (candidate.isAbsolute() ? candidate : root.resolve(candidate)).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new PreflightParseException("preflight-" + stage + "-filename-outside-plan-dir");
        }
        return resolved;
    }
}
