package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.Chunk;
import com.example.compliance.model.CollectionStats;
import com.example.compliance.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the reference corpus (the EU AI Act) into the vector index.
 * <p>
 * The collection is either empty or fully populated: a forced reindex clears it and
 * writes every chunk again. Queries running during that window see no context.
 */
@Service
public class CorpusIndexingService {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexingService.class);

    private static final int PROGRESS_EVERY = 10;

    private final DocumentExtractionService extractionService;
    private final TextChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final String collection;
    private final ComplianceProperties.Corpus corpus;
    private final ComplianceProperties.Index index;

    public CorpusIndexingService(DocumentExtractionService extractionService,
                                 TextChunker chunker,
                                 EmbeddingProvider embeddingProvider,
                                 VectorIndex vectorIndex,
                                 ComplianceProperties properties) {
        this.extractionService = extractionService;
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.collection = properties.retrieval().collection();
        this.corpus = properties.corpus();
        this.index = properties.index();
    }

    /**
     * Indexes the reference corpus.
     *
     * @param forceReindex replace an already populated collection
     * @return number of entries in the collection afterwards
     * @throws IllegalStateException if the corpus file is missing or yields no chunks
     */
    public int indexCorpus(boolean forceReindex) {
        Path corpusPath = Path.of(corpus.path());
        if (!Files.isRegularFile(corpusPath)) {
            throw new IllegalStateException("Reference corpus not found at " + corpusPath.toAbsolutePath());
        }

        int existing = vectorIndex.count(collection);
        if (existing > 0 && !forceReindex) {
            log.info("Collection '{}' already indexed with {} chunks, skipping", collection, existing);
            return existing;
        }

        log.info("═══════════════════════════════════════════════");
        log.info("Indexing reference corpus '{}' into '{}'", corpusPath.getFileName(), collection);
        log.info("═══════════════════════════════════════════════");

        String text = extractionService.clean(extractionService.extract(readCorpus(corpusPath)));
        List<Chunk> chunks = chunker.chunkDocument(text, corpus.sourceTag());
        if (chunks.isEmpty()) {
            throw new IllegalStateException("Reference corpus " + corpusPath + " produced no chunks");
        }
        log.info("Corpus split into {} chunks ({} characters)", chunks.size(), text.length());

        // Embed everything before touching the collection: a failed embedding leaves it as it was.
        List<float[]> vectors = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            vectors.add(embeddingProvider.embed(chunk.text()));
            int done = vectors.size();
            if (done % PROGRESS_EVERY == 0 || done == chunks.size()) {
                log.info("Embedded {}/{} chunks", done, chunks.size());
            }
        }

        if (existing > 0) {
            log.info("Force reindex: clearing {} existing entries", existing);
            vectorIndex.clear(collection);
        }

        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            vectorIndex.upsert(collection, entryId(chunk), vectors.get(i), chunk.text(), Map.of(
                    "chunk_index", chunk.index(),
                    "source", chunk.sourceTag(),
                    "total_chunks", chunks.size()
            ));
        }

        if (index.persistent() && vectorIndex instanceof InMemoryVectorIndex inMemory) {
            inMemory.saveSnapshot(Path.of(index.snapshotPath()));
        }

        int total = vectorIndex.count(collection);
        log.info("Corpus indexing completed: {} chunks in '{}'", total, collection);
        return total;
    }

    public CollectionStats stats() {
        int count = vectorIndex.count(collection);
        return new CollectionStats(collection, count, count > 0);
    }

    public boolean isIndexed() {
        return vectorIndex.count(collection) > 0;
    }

    /**
     * Restores the index snapshot, if one is configured, and reports the corpus status.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (index.persistent() && vectorIndex instanceof InMemoryVectorIndex inMemory) {
            try {
                if (!inMemory.loadSnapshot(Path.of(index.snapshotPath()))) {
                    log.info("No index snapshot at {}", index.snapshotPath());
                }
            } catch (UncheckedIOException e) {
                log.warn("Index snapshot at {} could not be loaded, starting empty: {}",
                        index.snapshotPath(), e.getMessage());
            }
        }
        CollectionStats stats = stats();
        if (stats.indexed()) {
            log.info("Reference corpus ready: {} chunks in '{}'", stats.totalDocuments(), collection);
        } else {
            log.warn("Reference corpus not indexed. Call POST /api/index-corpus before submitting documents.");
        }
    }

    /** {@code <collection>_chunk_<index>_<first 8 hex of md5(text)>}. */
    String entryId(Chunk chunk) {
        String digest = DigestUtils.md5DigestAsHex(chunk.text().getBytes(StandardCharsets.UTF_8));
        return "%s_chunk_%d_%s".formatted(collection, chunk.index(), digest.substring(0, 8));
    }

    private static SourceDocument readCorpus(Path path) {
        try {
            return new SourceDocument(path.getFileName().toString(), Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read reference corpus " + path, e);
        }
    }
}
