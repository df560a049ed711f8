package com.example.compliance.model;

import java.util.List;

/**
 * Output of extraction: the cleaned full text and its chunks.
 */
public record ProcessedDocument(
        String cleanText,
        List<String> chunks
) {
    public ProcessedDocument {
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
    }
}
