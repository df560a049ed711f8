package com.example.compliance.model;

/**
 * A single compliance risk identified by the analysis model.
 *
 * @param description     what the risk is
 * @param category        EU AI Act category (e.g. "Prohibited AI", "High-Risk AI")
 * @param level           HIGH / LOW / NONE
 * @param euActReference  article or section of the regulation, may be null
 * @param confidenceScore model confidence in [0,1], may be null
 */
public record Risk(
        String description,
        String category,
        RiskLevel level,
        String euActReference,
        Double confidenceScore
) {
    public Risk {
        if (description == null) description = "";
        if (category == null || category.isBlank()) category = "Unknown";
    }

    /** Whether the risk cites an explicit article or section. */
    public boolean hasReference() {
        return euActReference != null && !euActReference.isBlank();
    }
}
