package com.anton.core.tasks;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Stable task identity and content hashing.
 */
public final class TaskKeys {

    private static final int KEY_LENGTH = 16;

    private TaskKeys() {}

    /**
     * Derives a task key from its position and text. Identical inputs always yield the same key,
     * so an unchanged document re-parses to identically keyed tasks.
     */
    public static String taskKey(List<String> phasePath, int depth, String text, int siblingOrdinal) {
        String input = String.join(" | ",
                String.join(" > ", phasePath),
                String.valueOf(depth),
                normalizeWhitespace(text),
                String.valueOf(siblingOrdinal));
        return sha256(input).substring(0, KEY_LENGTH);
    }

    /** Key for a subtask proposed by decomposition. */
    public static String subtaskKey(String parentKey, int depth, String text, int ordinal) {
        String input = String.join(" | ", parentKey, String.valueOf(depth), normalizeWhitespace(text),
                String.valueOf(ordinal));
        return sha256(input).substring(0, KEY_LENGTH);
    }

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String normalizeWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
