package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Counts over a set of stored assessments: by risk band, and the regions and sectors
 * that appear most often.
 */
@Value
@Builder
@Jacksonized
public class RiskSummary {

    int totalAssessments;
    /** Risk level above 0.7. */
    int highRiskCount;
    /** Risk level from 0.4 to 0.7 inclusive. */
    int mediumRiskCount;
    int lowRiskCount;
    @Builder.Default
    List<RankedCount> topRiskRegions = List.of();
    @Builder.Default
    List<RankedCount> topRiskSectors = List.of();

    public static RiskSummary empty() {
        return RiskSummary.builder().build();
    }

    @Value
    public static class RankedCount {
        String name;
        int count;
    }
}
