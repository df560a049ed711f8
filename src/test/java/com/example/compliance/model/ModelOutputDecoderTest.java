package com.example.compliance.model;

import com.example.compliance.exception.ModelOutputParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelOutputDecoderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    @DisplayName("Full analysis decodes with levels assigned by list and risk counters")
    void decodesFullAnalysis() throws Exception {
        // Given
        JsonNode node = json("""
                {
                  "project_name": "AI Border Control",
                  "description": "Automated border control using facial recognition",
                  "contains_ai": true,
                  "ai_confidence": 0.95,
                  "high_risks": [
                    {"description": "Biometric identification system", "category": "Prohibited AI",
                     "eu_act_reference": "Article 5", "confidence_score": 0.9}
                  ],
                  "low_risks": [
                    {"description": "Data transparency requirements", "category": "Transparency",
                     "eu_act_reference": "Article 9", "confidence_score": "0.7"}
                  ]
                }
                """);

        // When
        Analysis analysis = ModelOutputDecoder.decodeAnalysis(node);

        // Then
        assertEquals("AI Border Control", analysis.projectName());
        assertTrue(analysis.containsAi());
        assertEquals(0.95, analysis.aiConfidence());
        assertEquals(RiskLevel.HIGH, analysis.highRisks().get(0).level());
        assertEquals(RiskLevel.LOW, analysis.lowRisks().get(0).level());
        assertEquals(0.7, analysis.lowRisks().get(0).confidenceScore());
        assertEquals(2, analysis.metadata().get("total_risks"));
        assertEquals(1, analysis.metadata().get("high_risk_count"));
    }

    @Test
    @DisplayName("Missing optional fields fall back to defaults")
    void appliesDefaults() throws Exception {
        Analysis analysis = ModelOutputDecoder.decodeAnalysis(json("{\"high_risks\": [{}]}"));

        assertEquals("Unknown Project", analysis.projectName());
        assertEquals("", analysis.description());
        assertFalse(analysis.containsAi());
        assertEquals(0.0, analysis.aiConfidence());
        assertTrue(analysis.lowRisks().isEmpty());

        Risk risk = analysis.highRisks().get(0);
        assertEquals("Unknown", risk.category());
        assertEquals("", risk.description());
        assertNull(risk.euActReference());
        assertNull(risk.confidenceScore());
    }

    @Test
    @DisplayName("Non-object root, non-array risks and out-of-range confidence are rejected")
    void rejectsMalformedAnalysis() {
        assertThrows(ModelOutputParseException.class, () -> ModelOutputDecoder.decodeAnalysis(json("[1, 2]")));
        assertThrows(ModelOutputParseException.class,
                () -> ModelOutputDecoder.decodeAnalysis(json("{\"high_risks\": \"many\"}")));
        assertThrows(ModelOutputParseException.class,
                () -> ModelOutputDecoder.decodeAnalysis(json("{\"low_risks\": [\"not an object\"]}")));
        assertThrows(ModelOutputParseException.class,
                () -> ModelOutputDecoder.decodeAnalysis(json("{\"ai_confidence\": 1.5}")));
        assertThrows(ModelOutputParseException.class,
                () -> ModelOutputDecoder.decodeAnalysis(json("{\"ai_confidence\": \"high\"}")));
        assertThrows(ModelOutputParseException.class,
                () -> ModelOutputDecoder.decodeAnalysis(json("{\"contains_ai\": \"maybe\"}")));
    }

    @Test
    @DisplayName("Judge verdict requires all scores and reasoning")
    void decodesJudgeVerdict() throws Exception {
        JudgeVerdict verdict = ModelOutputDecoder.decodeJudge(json("""
                {"accuracy_score": 0.8, "completeness_score": 0.7, "consistency_score": 0.9,
                 "overall_score": 0.8, "reasoning": "Good coverage"}
                """));

        assertEquals(0.8, verdict.accuracy());
        assertEquals(0.9, verdict.consistency());
        assertEquals("Good coverage", verdict.reasoning());

        assertThrows(ModelOutputParseException.class, () -> ModelOutputDecoder.decodeJudge(json("""
                {"accuracy_score": 0.8, "completeness_score": 0.7, "overall_score": 0.8, "reasoning": "x"}
                """)));
        assertThrows(ModelOutputParseException.class, () -> ModelOutputDecoder.decodeJudge(json("""
                {"accuracy_score": 0.8, "completeness_score": 0.7, "consistency_score": 2,
                 "overall_score": 0.8, "reasoning": "x"}
                """)));
        assertThrows(ModelOutputParseException.class, () -> ModelOutputDecoder.decodeJudge(json("""
                {"accuracy_score": 0.8, "completeness_score": 0.7, "consistency_score": 0.9, "overall_score": 0.8}
                """)));
    }
}
