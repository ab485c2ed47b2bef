package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Structural risk of a set of businesses, independent of current events.
 */
@Value
@Builder
@Jacksonized
public class PortfolioRisk {

    /** 0.0–1.0 mean of the per-business risks. */
    double overallRisk;
    /** Sum of per-business risk by industry, as given on the profile. */
    @Builder.Default
    Map<String, Double> riskDistribution = Map.of();
    int businessCount;
}
