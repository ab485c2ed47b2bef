package com.supplychain.pipeline.domain;

/**
 * Whether a region is hit by the event itself or through a supply-chain link.
 */
public enum ImpactType {
    DIRECT,
    INDIRECT
}
