package com.anton.core.prompt;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates a JSON object inside free-form model output.
 */
public final class JsonReplies {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```",
            Pattern.CASE_INSENSITIVE);

    private JsonReplies() {}

    /**
     * Tries, in order: the whole text, the first fenced block, the span between the outermost
     * braces.
     */
    public static Optional<String> extractObject(String raw) {
        String t = raw == null ? "" : raw.trim();
        if (t.startsWith("{") && t.endsWith("}")) {
            return Optional.of(t);
        }
        Matcher fence = FENCE.matcher(t);
        if (fence.find()) {
            String body = fence.group(1).trim();
            if (body.startsWith("{") && body.endsWith("}")) {
                return Optional.of(body);
            }
        }
        int first = t.indexOf('{');
        int last = t.lastIndexOf('}');
        if (first >= 0 && last > first) {
            return Optional.of(t.substring(first, last + 1));
        }
        return Optional.empty();
    }
}
