package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BusinessRiskReport {

    String businessId;
    double overallRiskLevel;
    RiskCategory riskCategory;
    boolean exceedsTolerance;
    /** Highest risk first. */
    List<BusinessEventRisk> individualRisks;
    List<String> recommendations;
    Instant assessedAt;
}
