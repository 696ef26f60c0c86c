package com.anton.core.model;

import java.util.List;

/**
 * The authoritative structured outcome of one agent turn.
 *
 * @param status reported status; malformed output always maps to BLOCKED
 * @param reason optional free-text reason, or the parser's diagnostic when malformed
 * @param subtasks proposed subtasks, meaningful only for DECOMPOSE
 * @param malformed true when the status was forced to BLOCKED because the output could not be parsed
 */
public record AgentResult(
    AgentStatus status,
    String reason,
    List<String> subtasks,
    boolean malformed
) {

    public AgentResult {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public static AgentResult malformed(String diagnostic) {
        return new AgentResult(AgentStatus.BLOCKED, diagnostic, List.of(), true);
    }
}
