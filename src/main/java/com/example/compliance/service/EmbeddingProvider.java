package com.example.compliance.service;

/**
 * Maps text to a fixed-length vector.
 * Implementations truncate input over their length cap instead of failing.
 */
public interface EmbeddingProvider {

    /**
     * @throws com.example.compliance.exception.EmbeddingException if the provider fails
     */
    float[] embed(String text);
}
