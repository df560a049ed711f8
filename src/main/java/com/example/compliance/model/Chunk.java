package com.example.compliance.model;

/**
 * A bounded slice of document text, the unit of vector indexing.
 *
 * @param text      chunk content
 * @param index     position of the chunk within its source document (0-based)
 * @param sourceTag name of the document the chunk was cut from
 */
public record Chunk(
        String text,
        int index,
        String sourceTag
) {}
