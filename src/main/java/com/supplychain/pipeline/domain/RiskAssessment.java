package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Risk for one (region, sector) pair caused by one event. Published to the
 * risk-calculated topic, cached per pair and persisted for business lookups.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RiskAssessment {

    String id;
    /** Reference only; the event is owned by the processed-events store. */
    String eventId;
    String region;
    String sector;
    /** 0.0–1.0; higher = higher risk. */
    double riskLevel;
    RiskCategory riskCategory;
    ImpactType impactType;
    List<RiskFactor> riskFactors;
    /** At most five, most urgent first. */
    List<String> recommendations;
    /** 0.0–1.0 */
    double confidenceScore;
    Instant createdAt;
}
