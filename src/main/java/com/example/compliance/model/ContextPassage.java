package com.example.compliance.model;

import java.util.Map;

/**
 * A passage returned by the vector index for a query.
 *
 * @param text     passage content
 * @param distance cosine distance to the query (lower = more similar)
 * @param metadata metadata stored with the passage at indexing time
 */
public record ContextPassage(
        String text,
        double distance,
        Map<String, Object> metadata
) {
    public ContextPassage {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
