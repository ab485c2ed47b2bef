package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Contribution of a single event to a business's overall risk.
 */
@Value
@Builder
public class BusinessEventRisk {

    String eventId;
    String eventTitle;
    double riskLevel;
    double regionExposure;
    double sectorExposure;
    double materialExposure;
}
