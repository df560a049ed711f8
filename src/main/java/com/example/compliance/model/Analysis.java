package com.example.compliance.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Structured compliance analysis of one technical document.
 * <p>
 * {@code metadata} always carries {@code total_risks}, {@code high_risk_count} and
 * {@code low_risk_count}, recomputed from the two risk lists on construction.
 */
public record Analysis(
        String projectName,
        String description,
        boolean containsAi,
        double aiConfidence,
        List<Risk> highRisks,
        List<Risk> lowRisks,
        Map<String, Object> metadata
) {

    public Analysis {
        highRisks = highRisks != null ? List.copyOf(highRisks) : List.of();
        lowRisks = lowRisks != null ? List.copyOf(lowRisks) : List.of();
        Map<String, Object> merged = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        merged.put("total_risks", highRisks.size() + lowRisks.size());
        merged.put("high_risk_count", highRisks.size());
        merged.put("low_risk_count", lowRisks.size());
        metadata = Map.copyOf(merged);
    }

    public static Analysis of(String projectName, String description, boolean containsAi,
                              double aiConfidence, List<Risk> highRisks, List<Risk> lowRisks) {
        return new Analysis(projectName, description, containsAi, aiConfidence, highRisks, lowRisks, Map.of());
    }

    /** High risks followed by low risks, in model order. */
    public List<Risk> allRisks() {
        return Stream.concat(highRisks.stream(), lowRisks.stream()).toList();
    }

    public int totalRisks() {
        return highRisks.size() + lowRisks.size();
    }
}
