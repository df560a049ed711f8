package com.example.compliance.agent;

import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.JudgeVerdict;

import java.util.List;

/**
 * Language-model operations used by the analysis pipeline.
 * Both operations either return well-formed typed output or throw.
 */
public interface AnalysisModelClient {

    /**
     * Produces a compliance analysis of {@code documentText} grounded in {@code context}.
     *
     * @throws com.example.compliance.exception.ModelCallException        if the provider keeps failing
     * @throws com.example.compliance.exception.ModelOutputParseException if the output is malformed
     */
    Analysis analyze(String documentText, List<ContextPassage> context);

    /**
     * Asks the model to grade {@code analysis}.
     *
     * @throws com.example.compliance.exception.ModelCallException        if the provider keeps failing
     * @throws com.example.compliance.exception.ModelOutputParseException if the output is malformed
     */
    JudgeVerdict judge(String documentText, Analysis analysis, List<ContextPassage> context);
}
