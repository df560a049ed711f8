package com.example.compliance.config;

import com.example.compliance.model.EvaluationMetric;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the compliance analyzer.
 * Absent groups and values fall back to the defaults documented on each record.
 */
@ConfigurationProperties(prefix = "compliance")
public record ComplianceProperties(
        Chunking chunking,
        Retrieval retrieval,
        Evaluation evaluation,
        Retry retry,
        Corpus corpus,
        Index index,
        Upload upload,
        Jobs jobs,
        Executor executor
) {

    public ComplianceProperties {
        if (chunking == null) chunking = new Chunking(null, null);
        if (retrieval == null) retrieval = new Retrieval(null, null);
        if (evaluation == null) evaluation = new Evaluation(null, null);
        if (retry == null) retry = new Retry(null, null);
        if (corpus == null) corpus = new Corpus(null, null);
        if (index == null) index = new Index(null);
        if (upload == null) upload = new Upload(null, null);
        if (jobs == null) jobs = new Jobs(null);
        if (executor == null) executor = new Executor(null, null, null);
    }

    /** Properties with every default applied. */
    public static ComplianceProperties defaults() {
        return new ComplianceProperties(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Sentence chunking.
     *
     * @param targetSize maximum chunk length in characters (default 1000)
     * @param overlap    characters carried over from the previous chunk (default 200)
     */
    public record Chunking(Integer targetSize, Integer overlap) {
        public Chunking {
            if (targetSize == null || targetSize <= 0) targetSize = 1000;
            if (overlap == null || overlap < 0) overlap = 200;
        }
    }

    /**
     * Context retrieval.
     *
     * @param topK       passages returned per query (default 5)
     * @param collection vector index collection holding the reference corpus
     */
    public record Retrieval(Integer topK, String collection) {
        public Retrieval {
            if (topK == null || topK <= 0) topK = 5;
            if (collection == null || collection.isBlank()) collection = "eu_ai_act";
        }
    }

    /**
     * Evaluation stage.
     *
     * @param metrics      heuristic metrics to compute (default: all)
     * @param judgeEnabled whether the model-as-judge call runs (default true)
     */
    public record Evaluation(List<EvaluationMetric> metrics, Boolean judgeEnabled) {
        public Evaluation {
            if (metrics == null) metrics = List.of(EvaluationMetric.values());
            metrics = List.copyOf(metrics);
            if (judgeEnabled == null) judgeEnabled = true;
        }

        public Set<EvaluationMetric> enabledMetrics() {
            return metrics.isEmpty() ? EnumSet.noneOf(EvaluationMetric.class) : EnumSet.copyOf(metrics);
        }
    }

    /**
     * Retry of external calls.
     *
     * @param maxAttempts total attempts including the first one (default 3)
     * @param baseDelay   delay before the first retry, doubled on each further retry (default 2s)
     */
    public record Retry(Integer maxAttempts, Duration baseDelay) {
        public Retry {
            if (maxAttempts == null || maxAttempts <= 0) maxAttempts = 3;
            if (baseDelay == null || baseDelay.isNegative()) baseDelay = Duration.ofSeconds(2);
        }
    }

    /**
     * Reference corpus.
     *
     * @param path      file indexed into the retrieval collection
     * @param sourceTag value of the {@code source} metadata on every indexed chunk
     */
    public record Corpus(String path, String sourceTag) {
        public Corpus {
            if (path == null || path.isBlank()) path = "./data/EU_AI_ACT.pdf";
            if (sourceTag == null || sourceTag.isBlank()) sourceTag = "EU_AI_ACT.pdf";
        }
    }

    /**
     * Vector index persistence.
     *
     * @param snapshotPath JSON snapshot file; blank disables persistence
     */
    public record Index(String snapshotPath) {
        public Index {
            if (snapshotPath == null) snapshotPath = "";
        }

        public boolean persistent() {
            return !snapshotPath.isBlank();
        }
    }

    /**
     * Upload validation.
     *
     * @param maxFileSizeMb     maximum accepted size (default 50)
     * @param allowedExtensions accepted extensions without the dot (default pdf, docx, txt, md)
     */
    public record Upload(Integer maxFileSizeMb, List<String> allowedExtensions) {
        public Upload {
            if (maxFileSizeMb == null || maxFileSizeMb <= 0) maxFileSizeMb = 50;
            if (allowedExtensions == null || allowedExtensions.isEmpty()) {
                allowedExtensions = List.of("pdf", "docx", "txt", "md");
            }
            allowedExtensions = List.copyOf(allowedExtensions);
        }

        public long maxFileSizeBytes() {
            return maxFileSizeMb * 1024L * 1024L;
        }
    }

    /**
     * Job store selection.
     *
     * @param store {@code memory} (default) or {@code mongo}
     */
    public record Jobs(String store) {
        public Jobs {
            if (store == null || store.isBlank()) store = "memory";
        }
    }

    /**
     * Thread pool running analysis jobs.
     */
    public record Executor(Integer corePoolSize, Integer maxPoolSize, Integer queueCapacity) {
        public Executor {
            if (corePoolSize == null || corePoolSize <= 0) corePoolSize = 4;
            if (maxPoolSize == null || maxPoolSize < corePoolSize) maxPoolSize = Math.max(8, corePoolSize);
            if (queueCapacity == null || queueCapacity < 0) queueCapacity = 100;
        }
    }
}
