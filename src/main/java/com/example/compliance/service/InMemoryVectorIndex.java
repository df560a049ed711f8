package com.example.compliance.service;

import com.example.compliance.model.ContextPassage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link VectorIndex} ranking entries by cosine distance.
 * <p>
 * Reads and writes are serialized through a read/write lock, so a query never sees a
 * half-applied upsert. A forced reindex ({@code clear} followed by upserts) is not
 * atomic: a query running between the two observes an empty collection and gets no
 * context. That window is accepted.
 * <p>
 * Collections can be written to and restored from a JSON snapshot.
 */
@Service
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    /** Stored entry; also the snapshot's element type. */
    record Entry(String id, float[] vector, String text, Map<String, Object> metadata) {}

    private final Map<String, LinkedHashMap<String, Entry>> collections = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper;

    public InMemoryVectorIndex(EmbeddingProvider embeddingProvider, ObjectMapper objectMapper) {
        this.embeddingProvider = embeddingProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public void upsert(String collection, String id, float[] vector, String text, Map<String, Object> metadata) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot index entry '%s' without a vector".formatted(id));
        }
        Entry entry = new Entry(id, vector.clone(), text, metadata != null ? Map.copyOf(metadata) : Map.of());
        lock.writeLock().lock();
        try {
            collections.computeIfAbsent(collection, k -> new LinkedHashMap<>()).put(id, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ContextPassage> query(String collection, float[] vector, int topK) {
        if (topK <= 0) return List.of();

        List<ContextPassage> scored = new ArrayList<>();
        lock.readLock().lock();
        try {
            Map<String, Entry> entries = collections.get(collection);
            if (entries == null || entries.isEmpty()) {
                log.debug("Collection '{}' is empty or absent, no results", collection);
                return List.of();
            }
            for (Entry entry : entries.values()) {
                scored.add(new ContextPassage(entry.text(), cosineDistance(vector, entry.vector()), entry.metadata()));
            }
        } finally {
            lock.readLock().unlock();
        }

        // stable sort: equal distances keep insertion order
        return scored.stream()
                .sorted(Comparator.comparingDouble(ContextPassage::distance))
                .limit(topK)
                .toList();
    }

    @Override
    public List<ContextPassage> search(String collection, String queryText, int topK) {
        if (count(collection) == 0) {
            return List.of();
        }
        float[] queryVector = embeddingProvider.embed(queryText);
        List<ContextPassage> results = query(collection, queryVector, topK);
        log.info("Retrieved {} passages from '{}'", results.size(), collection);
        return results;
    }

    @Override
    public int count(String collection) {
        lock.readLock().lock();
        try {
            Map<String, Entry> entries = collections.get(collection);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear(String collection) {
        lock.writeLock().lock();
        try {
            Map<String, Entry> removed = collections.remove(collection);
            log.info("Cleared collection '{}' ({} entries)", collection, removed == null ? 0 : removed.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes every collection to {@code path} as JSON.
     */
    public void saveSnapshot(Path path) {
        Map<String, List<Entry>> snapshot = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            collections.forEach((name, entries) -> snapshot.put(name, List.copyOf(entries.values())));
        } finally {
            lock.readLock().unlock();
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), snapshot);
            log.info("Index snapshot written to {} ({} collections)", path, snapshot.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write index snapshot to " + path, e);
        }
    }

    /**
     * Restores collections from a snapshot written by {@link #saveSnapshot}.
     * Each collection in the snapshot replaces the one with the same name.
     *
     * @return false if {@code path} does not exist
     */
    public boolean loadSnapshot(Path path) {
        if (!Files.exists(path)) {
            return false;
        }
        Map<String, List<Entry>> snapshot;
        try {
            snapshot = objectMapper.readValue(path.toFile(), new TypeReference<Map<String, List<Entry>>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read index snapshot from " + path, e);
        }
        lock.writeLock().lock();
        try {
            snapshot.forEach((name, entries) -> {
                LinkedHashMap<String, Entry> restored = new LinkedHashMap<>();
                entries.forEach(entry -> restored.put(entry.id(), entry));
                collections.put(name, restored);
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Index snapshot loaded from {} ({} collections)", path, snapshot.size());
        return true;
    }

    /**
     * {@code 1 - cos(a, b)}; 1.0 when either vector has zero norm.
     */
    static double cosineDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 1.0;
        }
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
