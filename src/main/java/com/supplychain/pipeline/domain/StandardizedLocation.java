package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical form of a free-text location. {@code resolved} is false when the input
 * matched nothing in the catalog and was only title-cased.
 */
@Value
@Builder
@Jacksonized
public class StandardizedLocation {

    String standardName;
    /** Empty when unknown. */
    String country;
    /** Empty when unknown. */
    String region;
    Coordinates coordinates;
    boolean resolved;
}
