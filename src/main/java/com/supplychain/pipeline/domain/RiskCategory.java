package com.supplychain.pipeline.domain;

/**
 * Bucketed risk level. Drives prioritization downstream (critical → immediate review).
 */
public enum RiskCategory {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskCategory fromScore(double score) {
        return score >= 0.8 ? CRITICAL : score >= 0.6 ? HIGH : score >= 0.4 ? MEDIUM : LOW;
    }
}
