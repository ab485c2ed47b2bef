package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RiskFactor {

    RiskFactorType type;
    String description;
    RiskCategory severity;
}
