package com.example.compliance.model;

/**
 * Risk classification under the EU AI Act.
 */
public enum RiskLevel {
    HIGH, LOW, NONE
}
