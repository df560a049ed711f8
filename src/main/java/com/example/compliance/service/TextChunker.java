package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.Chunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits cleaned text into overlapping, size-bounded chunks along sentence boundaries.
 * <p>
 * Sentences end at {@code .}, {@code !} or {@code ?} followed by whitespace. A chunk's
 * length is the sum of its sentence lengths. A sentence longer than the target size is
 * still placed whole in its own chunk: sentences are never split.
 * <p>
 * When a chunk is closed, the next one is seeded with the longest suffix of its
 * sentences whose summed length fits in {@code overlap}. If the whole closed chunk is
 * no longer than {@code overlap}, nothing is carried over.
 */
@Service
public class TextChunker {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private final int defaultTargetSize;
    private final int defaultOverlap;

    public TextChunker(ComplianceProperties properties) {
        this.defaultTargetSize = properties.chunking().targetSize();
        this.defaultOverlap = properties.chunking().overlap();
    }

    /**
     * Chunks {@code text} with the configured target size and overlap.
     */
    public List<String> chunk(String text) {
        return chunk(text, defaultTargetSize, defaultOverlap);
    }

    /**
     * Chunks {@code text}; deterministic for identical arguments.
     *
     * @param text       cleaned document text
     * @param targetSize maximum chunk length, exceeded only by a single oversized sentence
     * @param overlap    maximum length carried into the next chunk
     * @return chunks in document order, empty for blank text
     */
    public List<String> chunk(String text, int targetSize, int overlap) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("targetSize must be positive, was " + targetSize);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        LinkedList<String> current = new LinkedList<>();
        int currentSize = 0;

        for (String sentence : SENTENCE_BOUNDARY.split(text.strip())) {
            if (sentence.isEmpty()) continue;
            int sentenceSize = sentence.length();

            if (currentSize + sentenceSize > targetSize && !current.isEmpty()) {
                String closed = String.join(" ", current);
                chunks.add(closed);

                if (closed.length() > overlap) {
                    LinkedList<String> carried = new LinkedList<>();
                    int carriedSize = 0;
                    for (var it = current.descendingIterator(); it.hasNext(); ) {
                        String previous = it.next();
                        if (carriedSize + previous.length() > overlap) break;
                        carried.addFirst(previous);
                        carriedSize += previous.length();
                    }
                    current = carried;
                    currentSize = carriedSize;
                } else {
                    current = new LinkedList<>();
                    currentSize = 0;
                }
            }

            current.add(sentence);
            currentSize += sentenceSize;
        }

        if (!current.isEmpty()) {
            chunks.add(String.join(" ", current));
        }
        return chunks;
    }

    /**
     * Chunks {@code text} and tags every chunk with its position and source.
     */
    public List<Chunk> chunkDocument(String text, String sourceTag) {
        List<String> pieces = chunk(text);
        List<Chunk> result = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            result.add(new Chunk(pieces.get(i), i, sourceTag));
        }
        return result;
    }
}
