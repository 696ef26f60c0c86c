package com.anton.core.verify;

import com.anton.core.model.RunConfig;
import com.anton.core.model.Task;
import com.anton.core.prompt.JsonReplies;
import com.anton.core.session.AgentSession;
import com.anton.core.session.AgentSessionFactory;
import com.anton.core.session.SessionConfigBuilder;
import com.anton.core.session.SessionDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Asks a single-turn, tool-less session whether a diff accomplishes a task.
 */
public class AiVerifier {

    private static final Logger log = LoggerFactory.getLogger(AiVerifier.class);

    static final int MAX_DIFF_CHARS = 30_000;

    private final AgentSessionFactory sessionFactory;
    private final SessionDefaults sessionDefaults;
    private final String verifyModel;
    private final ObjectMapper mapper = new ObjectMapper();

    public AiVerifier(AgentSessionFactory sessionFactory, SessionDefaults sessionDefaults, String verifyModel) {
        this.sessionFactory = sessionFactory;
        this.sessionDefaults = sessionDefaults;
        this.verifyModel = verifyModel;
    }

    public AiVerdict verify(Task task, String diff, RunConfig run) {
        String prompt = buildPrompt(task, diff);
        try (AgentSession session = sessionFactory.create(
                SessionConfigBuilder.forVerification(sessionDefaults, run, verifyModel))) {
            return parseVerdict(session.ask(prompt).text());
        } catch (RuntimeException e) {
            log.warn("Verification session failed for '{}': {}", task.text(), e.getMessage());
            return new AiVerdict(false, "Verifier session error: " + e.getMessage());
        }
    }

    static String buildPrompt(Task task, String diff) {
        String body = diff.length() > MAX_DIFF_CHARS
                ? diff.substring(0, MAX_DIFF_CHARS) + "\n... (diff truncated)"
                : diff;
        return "You are a code review verifier. Task: \"" + task.text() + "\"\n\n"
                + "Diff:\n```diff\n" + body + "\n```\n\n"
                + "Reply with exactly one JSON object:\n"
                + "{\"pass\": true, \"reason\": \"...\"}\n"
                + "or\n"
                + "{\"pass\": false, \"reason\": \"...\"}";
    }

    AiVerdict parseVerdict(String response) {
        Optional<String> json = JsonReplies.extractObject(response);
        if (json.isEmpty()) {
            return new AiVerdict(false, "Invalid verifier response: not valid JSON");
        }
        try {
            JsonNode node = mapper.readTree(json.get());
            JsonNode pass = node.get("pass");
            if (pass == null || !pass.isBoolean()) {
                return new AiVerdict(false, "Invalid verifier response: missing pass field");
            }
            JsonNode reason = node.get("reason");
            String reasonText = reason != null && reason.isTextual() && !reason.asText().isBlank()
                    ? reason.asText()
                    : "No reason provided";
            return new AiVerdict(pass.asBoolean(), reasonText);
        } catch (JsonProcessingException e) {
            return new AiVerdict(false, "Invalid verifier response: not valid JSON");
        }
    }
}
