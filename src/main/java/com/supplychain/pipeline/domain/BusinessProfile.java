package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A customer's supply-chain footprint. Owned by the profile service; read-only here.
 */
@Value
@Builder
@Jacksonized
public class BusinessProfile {

    String businessId;
    String businessName;
    String industry;
    List<String> supplyRegions;
    List<String> criticalMaterials;
    List<String> keySuppliers;
    /** 0.0–1.0; overall risk above this is flagged. */
    double riskTolerance;
}
