package com.anton.core.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pulls search keywords out of task text.
 */
public final class KeywordExtractor {

    static final int MAX_KEYWORDS = 10;

    private static final Pattern ALPHA = Pattern.compile("^[a-z]+$");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
            "it", "its", "of", "on", "that", "the", "to", "was", "were", "will", "with", "this",
            "these", "they", "should", "would", "could", "can", "may", "might", "must");

    private KeywordExtractor() {}

    /**
     * Lower-cased alphabetic words longer than two characters, stop words removed, first ten
     * in text order.
     */
    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (String word : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word) && ALPHA.matcher(word).matches()) {
                keywords.add(word);
                if (keywords.size() == MAX_KEYWORDS) {
                    break;
                }
            }
        }
        return keywords;
    }
}
