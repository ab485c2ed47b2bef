package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Output of the normalizer: canonical text, location, sectors and timestamp.
 */
@Value
@Builder
public class NormalizedEvent {

    String title;
    String description;
    String source;
    StandardizedLocation location;
    /** Canonical tags, insertion ordered, no duplicates. */
    List<String> impactSectors;
    EventType eventType;
    double severity;
    /** False when severity was missing and the default was used. */
    boolean severityExplicit;
    /** False when the collector sent no sectors. */
    boolean sectorsExplicit;
    Instant timestamp;
    String url;
    Set<NormalizationWarning> warnings;
}
