package com.example.compliance.model;

/**
 * Size summary of a vector index collection.
 */
public record CollectionStats(
        String collectionName,
        int totalDocuments,
        boolean indexed
) {}
