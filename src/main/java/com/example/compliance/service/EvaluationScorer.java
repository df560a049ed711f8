package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.EvaluationMetric;
import com.example.compliance.model.EvaluationMetrics;
import com.example.compliance.model.Risk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heuristic RAG evaluation: NO model calls, deterministic for identical inputs.
 * <p>
 * All four metrics are coarse lexical checks (term containment and word-set overlap),
 * not semantic similarity. A semantic scorer would need extra model calls per risk.
 */
@Service
public class EvaluationScorer {

    private static final Logger log = LoggerFactory.getLogger(EvaluationScorer.class);

    /** A description term counts only if it is longer than this. */
    private static final int MIN_TERM_LENGTH = 4;

    /** Distinct qualifying terms needed for a risk to count as grounded. */
    private static final int MIN_GROUNDED_TERMS = 2;

    private static final double RELEVANCE_BOOST = 1.2;

    private static final List<String> AI_INDICATOR_TERMS =
            List.of("ai", "machine learning", "neural", "model", "algorithm");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final EnumSet<EvaluationMetric> enabledMetrics;

    @Autowired
    public EvaluationScorer(ComplianceProperties properties) {
        this(properties.evaluation().enabledMetrics());
    }

    public EvaluationScorer(Set<EvaluationMetric> enabledMetrics) {
        this.enabledMetrics = enabledMetrics.isEmpty()
                ? EnumSet.noneOf(EvaluationMetric.class)
                : EnumSet.copyOf(enabledMetrics);
    }

    /**
     * Computes every enabled metric and their mean.
     *
     * @param context      passages retrieved for the document
     * @param analysis     analysis produced from that context
     * @param documentText cleaned text of the analyzed document
     */
    public EvaluationMetrics evaluate(List<ContextPassage> context, Analysis analysis, String documentText) {
        log.info("Calculating RAG evaluation metrics ({})...", enabledMetrics);

        Double faithfulness = enabledMetrics.contains(EvaluationMetric.FAITHFULNESS)
                ? calculateFaithfulness(context, analysis) : null;
        Double relevance = enabledMetrics.contains(EvaluationMetric.ANSWER_RELEVANCE)
                ? calculateAnswerRelevance(analysis, documentText) : null;
        Double precision = enabledMetrics.contains(EvaluationMetric.CONTEXT_PRECISION)
                ? calculateContextPrecision(context, analysis) : null;
        Double recall = enabledMetrics.contains(EvaluationMetric.CONTEXT_RECALL)
                ? calculateContextRecall(context, analysis) : null;

        EvaluationMetrics metrics = EvaluationMetrics.of(faithfulness, relevance, precision, recall);
        log.info("Evaluation metrics: {}", metrics);
        return metrics;
    }

    /**
     * Share of risks whose description has at least two distinct terms longer than four
     * characters that occur in the context. 1.0 when there are no risks.
     */
    public double calculateFaithfulness(List<ContextPassage> context, Analysis analysis) {
        List<Risk> risks = analysis.allRisks();
        if (risks.isEmpty()) {
            return 1.0;
        }
        String contextText = joinLowercase(context);
        long grounded = risks.stream()
                .filter(risk -> isGroundedIn(risk, contextText))
                .count();

        double score = (double) grounded / risks.size();
        log.debug("Faithfulness: {}/{} = {}", grounded, risks.size(), "%.2f".formatted(score));
        return score;
    }

    /**
     * Word-set overlap of the analysis description with the document, boosted by
     * {@value #RELEVANCE_BOOST} (capped at 1.0) when the document's AI indicator terms
     * agree with {@code containsAi}. 0.0 for a description without words.
     */
    public double calculateAnswerRelevance(Analysis analysis, String documentText) {
        String documentLower = documentText == null ? "" : documentText.toLowerCase(Locale.ROOT);
        Set<String> descriptionWords = words(analysis.description());
        if (descriptionWords.isEmpty()) {
            return 0.0;
        }
        Set<String> documentWords = words(documentLower);

        long common = descriptionWords.stream().filter(documentWords::contains).count();
        double overlap = (double) common / descriptionWords.size();

        boolean documentMentionsAi = AI_INDICATOR_TERMS.stream().anyMatch(documentLower::contains);
        if (documentMentionsAi == analysis.containsAi()) {
            overlap = overlap * RELEVANCE_BOOST;
        }

        double score = Math.min(1.0, overlap);
        log.debug("Answer relevance: {}", "%.2f".formatted(score));
        return score;
    }

    /**
     * Share of passages containing the reference string of at least one risk.
     * 0.0 for empty context.
     */
    public double calculateContextPrecision(List<ContextPassage> context, Analysis analysis) {
        if (context == null || context.isEmpty()) {
            return 0.0;
        }
        List<String> references = analysis.allRisks().stream()
                .filter(Risk::hasReference)
                .map(risk -> risk.euActReference().toLowerCase(Locale.ROOT))
                .toList();

        long relevant = context.stream()
                .map(passage -> passage.text().toLowerCase(Locale.ROOT))
                .filter(text -> references.stream().anyMatch(text::contains))
                .count();

        double score = (double) relevant / context.size();
        log.debug("Context precision: {}/{} = {}", relevant, context.size(), "%.2f".formatted(score));
        return score;
    }

    /**
     * Share of risks that carry a reference or are lexically grounded in the context.
     * 1.0 when there are no risks.
     */
    public double calculateContextRecall(List<ContextPassage> context, Analysis analysis) {
        List<Risk> risks = analysis.allRisks();
        if (risks.isEmpty()) {
            return 1.0;
        }
        String contextText = joinLowercase(context);
        long supported = risks.stream()
                .filter(risk -> risk.hasReference() || isGroundedIn(risk, contextText))
                .count();

        double score = (double) supported / risks.size();
        log.debug("Context recall: {}/{} = {}", supported, risks.size(), "%.2f".formatted(score));
        return score;
    }

    public Set<EvaluationMetric> getEnabledMetrics() {
        return EnumSet.copyOf(enabledMetrics);
    }

    private static boolean isGroundedIn(Risk risk, String contextText) {
        long matches = words(risk.description()).stream()
                .filter(term -> term.length() > MIN_TERM_LENGTH)
                .filter(contextText::contains)
                .count();
        return matches >= MIN_GROUNDED_TERMS;
    }

    private static String joinLowercase(List<ContextPassage> context) {
        if (context == null) return "";
        return context.stream()
                .map(ContextPassage::text)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }

    /** Distinct lowercased whitespace-separated words, in order of appearance. */
    private static Set<String> words(String text) {
        if (text == null || text.isBlank()) return Set.of();
        return Arrays.stream(WHITESPACE.split(text.toLowerCase(Locale.ROOT).strip()))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
