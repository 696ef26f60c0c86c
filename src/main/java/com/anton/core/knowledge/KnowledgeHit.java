package com.anton.core.knowledge;

/**
 * A search hit from a knowledge store.
 *
 * @param key label shown to the agent (usually a relative path)
 * @param content text to include in the prompt
 * @param score relevance, higher first
 */
public record KnowledgeHit(String key, String content, double score) {
}
