package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.RiskAssessment;
import lombok.Value;

import java.util.List;

/**
 * Result of scoring one event: the significant assessments, highest risk first, plus
 * how many (region, sector) pairs were tried and how many failed.
 */
@Value
public class ScoringReport {

    List<RiskAssessment> assessments;
    int attemptedPairs;
    int failedPairs;

    public boolean hasFailures() {
        return failedPairs > 0;
    }
}
