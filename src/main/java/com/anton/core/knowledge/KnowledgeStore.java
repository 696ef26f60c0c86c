package com.anton.core.knowledge;

import java.util.List;

/**
 * Searchable store of prior knowledge used to enrich task prompts.
 */
public interface KnowledgeStore {

    /**
     * Returns hits for a space-separated keyword query, most relevant first.
     */
    List<KnowledgeHit> search(String query, int limit);

    /** A store that never returns anything. */
    static KnowledgeStore none() {
        return (query, limit) -> List.of();
    }
}
