package com.example.compliance.service;

import com.example.compliance.model.ContextPassage;

import java.util.List;
import java.util.Map;

/**
 * Named collections of (id, vector, text, metadata) entries with nearest-neighbour search.
 */
public interface VectorIndex {

    /**
     * Inserts or replaces the entry with the given id.
     */
    void upsert(String collection, String id, float[] vector, String text, Map<String, Object> metadata);

    /**
     * Returns up to {@code topK} entries ranked by ascending distance.
     * An absent or empty collection yields an empty list.
     */
    List<ContextPassage> query(String collection, float[] vector, int topK);

    /**
     * Embeds {@code queryText} and runs {@link #query}.
     *
     * @throws com.example.compliance.exception.EmbeddingException if embedding fails
     */
    List<ContextPassage> search(String collection, String queryText, int topK);

    int count(String collection);

    /**
     * Removes every entry of the collection.
     */
    void clear(String collection);
}
