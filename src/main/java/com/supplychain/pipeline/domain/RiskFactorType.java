package com.supplychain.pipeline.domain;

/**
 * Explanation attached to an assessment. Consumers use these to say why a pair scored high.
 */
public enum RiskFactorType {
    /** The region itself is highly exposed. */
    REGIONAL,
    /** The sector is highly vulnerable to this kind of event. */
    SECTORAL,
    /** Region and sector exposure compound each other. */
    INTERACTION,
    /** The region is only reached through a supply-chain connection. */
    SUPPLY_CHAIN_LINK
}
