package com.supplychain.pipeline.domain;

public enum NormalizationWarning {
    TIMESTAMP_FALLBACK,
    LOCATION_UNRESOLVED,
    SECTOR_UNRESOLVED
}
