package com.supplychain.pipeline.messaging;

import com.supplychain.pipeline.domain.RiskAssessment;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Payload of the risk-calculated topic: every assessment produced for one event.
 */
@Value
@Builder
@Jacksonized
public class RiskCalculatedMessage {

    String eventId;
    List<RiskAssessment> assessments;
    Instant timestamp;
}
