package com.example.compliance.orchestrator;

import com.example.compliance.agent.AnalysisModelClient;
import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.EvaluationMetrics;
import com.example.compliance.model.Job;
import com.example.compliance.model.JudgeVerdict;
import com.example.compliance.model.PipelineTimings;
import com.example.compliance.model.ProcessedDocument;
import com.example.compliance.model.SourceDocument;
import com.example.compliance.repository.JobStore;
import com.example.compliance.service.ContextRetriever;
import com.example.compliance.service.DocumentExtractionService;
import com.example.compliance.service.EvaluationScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs analysis jobs in the background.
 * Pipeline (sequential, each stage consumes the previous one's output):
 * 1. Extraction, cleaning and chunking
 * 2. Context retrieval from the reference corpus
 * 3. Model analysis grounded in the context
 * 4. Heuristic evaluation (NO model calls)
 * 5. Model-as-judge (optional, advisory)
 * <p>
 * A failure in stages 1-4 fails the job with the error message. A judge failure only
 * drops the verdict; the job still completes. Retries happen inside the external-call
 * wrapper, never at this level.
 */
@Service
public class AnalysisJobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobOrchestrator.class);

    private static final int MAX_ID_ATTEMPTS = 3;

    private final DocumentExtractionService extractionService;
    private final ContextRetriever contextRetriever;
    private final AnalysisModelClient modelClient;
    private final EvaluationScorer evaluationScorer;
    private final JobStore jobStore;
    private final Executor executor;
    private final boolean judgeEnabled;
    private final Clock clock;

    @Autowired
    public AnalysisJobOrchestrator(DocumentExtractionService extractionService,
                                   ContextRetriever contextRetriever,
                                   AnalysisModelClient modelClient,
                                   EvaluationScorer evaluationScorer,
                                   JobStore jobStore,
                                   @Qualifier("analysisExecutor") Executor executor,
                                   ComplianceProperties properties) {
        this(extractionService, contextRetriever, modelClient, evaluationScorer, jobStore, executor,
                properties.evaluation().judgeEnabled(), Clock.systemUTC());
    }

    public AnalysisJobOrchestrator(DocumentExtractionService extractionService,
                                   ContextRetriever contextRetriever,
                                   AnalysisModelClient modelClient,
                                   EvaluationScorer evaluationScorer,
                                   JobStore jobStore,
                                   Executor executor,
                                   boolean judgeEnabled,
                                   Clock clock) {
        this.extractionService = extractionService;
        this.contextRetriever = contextRetriever;
        this.modelClient = modelClient;
        this.evaluationScorer = evaluationScorer;
        this.jobStore = jobStore;
        this.executor = executor;
        this.judgeEnabled = judgeEnabled;
        this.clock = clock;
    }

    /**
     * Creates a PENDING job for {@code document} and schedules it.
     *
     * @return the job as stored at submission time
     */
    public Job submit(SourceDocument document) {
        Job job = insertPending(document.filename());
        log.info("Job {} submitted for '{}'", job.id(), document.filename());
        try {
            executor.execute(() -> run(job.id(), document));
        } catch (RejectedExecutionException e) {
            log.error("Job {} rejected by the executor", job.id(), e);
            return jobStore.update(job.id(), current -> current.failed(
                    "Analysis queue is full, job rejected", clock.instant()));
        }
        return job;
    }

    public Optional<Job> getJob(String jobId) {
        return jobStore.find(jobId);
    }

    /**
     * Executes the pipeline for an already stored job. Never throws: every failure ends
     * up on the job.
     */
    void run(String jobId, SourceDocument document) {
        try {
            jobStore.update(jobId, Job::processing);

            log.info("═══════════════════════════════════════════════");
            log.info("Job {}: starting analysis pipeline for '{}'", jobId, document.filename());
            log.info("═══════════════════════════════════════════════");

            // ── Step 1: Extraction ──
            log.info("[1/5] Job {}: extracting text...", jobId);
            long start = System.nanoTime();
            ProcessedDocument processed = extractionService.process(document);
            String text = processed.cleanText();
            double extractionSeconds = secondsSince(start);
            log.info("[1/5] Extraction completed: {} characters", text.length());

            // ── Step 2: Retrieval ──
            log.info("[2/5] Job {}: retrieving reference context...", jobId);
            start = System.nanoTime();
            List<ContextPassage> context = contextRetriever.retrieve(text);
            double retrievalSeconds = secondsSince(start);
            log.info("[2/5] Retrieval completed: {} passages", context.size());

            // ── Step 3: Analysis ──
            log.info("[3/5] Job {}: running compliance analysis...", jobId);
            start = System.nanoTime();
            Analysis analysis = modelClient.analyze(text, context);
            double analysisSeconds = secondsSince(start);
            log.info("[3/5] Analysis completed: {} risks identified", analysis.totalRisks());

            // ── Step 4: Heuristic evaluation ──
            log.info("[4/5] Job {}: computing evaluation metrics...", jobId);
            start = System.nanoTime();
            EvaluationMetrics metrics = evaluationScorer.evaluate(context, analysis, text);
            double evaluationSeconds = secondsSince(start);
            log.info("[4/5] Overall score: {}", "%.2f".formatted(metrics.overallScore()));

            // ── Step 5: Judge (advisory) ──
            JudgeVerdict verdict = null;
            double judgeSeconds = 0.0;
            if (judgeEnabled) {
                log.info("[5/5] Job {}: running judge evaluation...", jobId);
                start = System.nanoTime();
                verdict = judgeOrNull(jobId, () -> modelClient.judge(text, analysis, context));
                judgeSeconds = secondsSince(start);
            } else {
                log.info("[5/5] Judge evaluation disabled, skipping");
            }

            PipelineTimings timings = new PipelineTimings(extractionSeconds, retrievalSeconds,
                    analysisSeconds, evaluationSeconds, judgeSeconds);
            JudgeVerdict finalVerdict = verdict;
            jobStore.update(jobId, job -> job.completed(analysis, metrics, finalVerdict, timings, clock.instant()));

            log.info("═══════════════════════════════════════════════");
            log.info("Job {} completed in {}s", jobId, "%.2f".formatted(timings.totalSeconds()));
            log.info("═══════════════════════════════════════════════");

        } catch (Exception e) {
            log.error("Job {} failed", jobId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            markFailed(jobId, message);
        }
    }

    private void markFailed(String jobId, String message) {
        try {
            jobStore.update(jobId, job -> job.failed(message, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Job {}: unable to record failure '{}'", jobId, message, e);
        }
    }

    private JudgeVerdict judgeOrNull(String jobId, Supplier<JudgeVerdict> judgeCall) {
        try {
            JudgeVerdict verdict = judgeCall.get();
            log.info("[5/5] Judge completed: overall {}", "%.2f".formatted(verdict.overall()));
            return verdict;
        } catch (RuntimeException e) {
            log.warn("[5/5] Job {}: judge evaluation failed, continuing without a verdict: {}",
                    jobId, e.getMessage());
            return null;
        }
    }

    private Job insertPending(String documentName) {
        IllegalStateException lastError = null;
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            Job job = Job.pending(UUID.randomUUID().toString(), documentName, clock.instant());
            try {
                jobStore.insert(job);
                return job;
            } catch (IllegalStateException e) {
                lastError = e;
                log.warn("Job id collision on {}, generating a new id", job.id());
            }
        }
        throw lastError;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
