package com.anton.core.prompt;

import com.anton.core.model.AgentResult;
import com.anton.core.model.AgentStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the authoritative {@code <anton-result>} block from agent output.
 *
 * <p>The grammar is line-oriented and tolerant of formatting drift. Only the last block counts,
 * and any missing or malformed status resolves to {@code blocked}, never to {@code done}.
 */
public final class ResultParser {

    static final String NO_BLOCK = "Agent did not emit structured result";
    static final String NO_STATUS = "No status line found in result block";

    private static final Pattern BLOCK = Pattern.compile("<anton-result>([\\s\\S]*?)</anton-result>");
    private static final Pattern STATUS = Pattern.compile("^status:\\s*(.+)$");
    private static final Pattern REASON = Pattern.compile("^reason:\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern SUBTASK = Pattern.compile("^-\\s*(.+)$", Pattern.MULTILINE);

    private ResultParser() {}

    public static AgentResult parse(String output) {
        if (output == null) {
            return AgentResult.malformed(NO_BLOCK);
        }
        Matcher blocks = BLOCK.matcher(output);
        String block = null;
        while (blocks.find()) {
            block = blocks.group(1);
        }
        if (block == null) {
            return AgentResult.malformed(NO_BLOCK);
        }

        String content = block.trim();
        String firstLine = content.lines().findFirst().orElse("").trim();
        Matcher status = STATUS.matcher(firstLine);
        if (!status.matches()) {
            return AgentResult.malformed(NO_STATUS);
        }
        String value = status.group(1).trim();
        Optional<AgentStatus> parsed = AgentStatus.fromWire(value);
        if (parsed.isEmpty()) {
            return AgentResult.malformed("Unknown status: " + value);
        }

        Matcher reason = REASON.matcher(content);
        String reasonText = reason.find() ? reason.group(1).trim() : null;

        List<String> subtasks = new ArrayList<>();
        Matcher subtask = SUBTASK.matcher(content);
        while (subtask.find()) {
            subtasks.add(subtask.group(1).trim());
        }

        return new AgentResult(parsed.get(), reasonText, subtasks, false);
    }
}
