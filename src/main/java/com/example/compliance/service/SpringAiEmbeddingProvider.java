package com.example.compliance.service;

import com.example.compliance.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingProvider} backed by a Spring AI {@link EmbeddingModel}, with retry.
 */
@Service
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    /** Input cap in characters; longer text is truncated before embedding. */
    static final int MAX_INPUT_CHARS = 8000;

    private final EmbeddingModel embeddingModel;
    private final ResilientCaller resilientCaller;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, ResilientCaller resilientCaller) {
        this.embeddingModel = embeddingModel;
        this.resilientCaller = resilientCaller;
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text;
        if (input.length() > MAX_INPUT_CHARS) {
            log.debug("Truncating embedding input from {} to {} characters", input.length(), MAX_INPUT_CHARS);
            input = input.substring(0, MAX_INPUT_CHARS);
        }
        final String request = input;

        float[] vector;
        try {
            vector = resilientCaller.call("Embedding", () -> embeddingModel.embed(request));
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding failed: " + e.getMessage(), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding provider returned an empty vector", null);
        }
        log.debug("Generated embedding ({} dimensions) for text of length {}", vector.length, request.length());
        return vector;
    }
}
