package com.example.compliance.model;

/**
 * Model-as-judge assessment of an analysis. Advisory only.
 *
 * @param accuracy     are the identified AI components and risks accurate (0-1)
 * @param completeness did the analysis cover all relevant aspects (0-1)
 * @param consistency  are risk classifications consistent with the regulation (0-1)
 * @param overall      overall judge score (0-1)
 * @param reasoning    explanation of the scores
 */
public record JudgeVerdict(
        double accuracy,
        double completeness,
        double consistency,
        double overall,
        String reasoning
) {}
