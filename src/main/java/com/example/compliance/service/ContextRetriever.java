package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.ContextPassage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Retrieves reference-corpus passages relevant to a technical document.
 * <p>
 * The search query is the first {@value #QUERY_PREFIX_CHARS} characters of the document
 * followed by a fixed set of regulatory anchor terms. No model is involved, so the query
 * depends only on the document prefix.
 */
@Service
public class ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(ContextRetriever.class);

    static final int QUERY_PREFIX_CHARS = 500;

    static final List<String> ANCHOR_TERMS = List.of(
            "AI system",
            "machine learning",
            "high risk AI",
            "prohibited AI practices",
            "artificial intelligence regulation"
    );

    private final VectorIndex vectorIndex;
    private final String collection;
    private final int topK;

    public ContextRetriever(VectorIndex vectorIndex, ComplianceProperties properties) {
        this.vectorIndex = vectorIndex;
        this.collection = properties.retrieval().collection();
        this.topK = properties.retrieval().topK();
    }

    /**
     * Builds the search query for a document.
     */
    public static String reformulateQuery(String documentText) {
        String text = documentText == null ? "" : documentText;
        String prefix = text.length() > QUERY_PREFIX_CHARS ? text.substring(0, QUERY_PREFIX_CHARS) : text;
        return prefix + " " + String.join(" ", ANCHOR_TERMS);
    }

    /**
     * Returns up to {@code top-k} passages ranked by ascending distance; empty when the
     * corpus has not been indexed.
     */
    public List<ContextPassage> retrieve(String documentText) {
        log.info("Retrieving reference context (collection '{}', top-k {})...", collection, topK);

        List<ContextPassage> passages = vectorIndex.search(collection, reformulateQuery(documentText), topK);
        if (passages.isEmpty()) {
            log.warn("No context available: collection '{}' returned no passages", collection);
            return passages;
        }

        log.info("Retrieved {} context passages", passages.size());
        for (int i = 0; i < Math.min(3, passages.size()); i++) {
            ContextPassage passage = passages.get(i);
            log.debug("Context {} (distance: {}): {}...", i + 1,
                    "%.4f".formatted(passage.distance()), truncate(passage.text(), 100));
        }
        return passages;
    }

    public int getTopK() {
        return topK;
    }

    private static String truncate(String text, int maxLen) {
        if (text == null || text.length() <= maxLen) return text;
        return text.substring(0, maxLen);
    }
}
