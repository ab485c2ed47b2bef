package com.supplychain.pipeline.domain;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Validated, deduplicated and normalized event. Immutable apart from the
 * {@code processed} marker, which flips false to true at most once.
 */
@Getter
@Builder
@ToString
public class ProcessedEvent {

    static final String GLOBAL_REGION = "Global";
    private static final double WARNING_PENALTY = 0.2;

    private final String id;
    private final String title;
    private final String description;
    private final String source;
    private final StandardizedLocation locationStandardized;
    private final List<String> impactSectors;
    private final EventType eventType;
    private final double severity;
    private final boolean severityExplicit;
    private final boolean sectorsExplicit;
    private final Instant timestamp;
    private final String url;
    private final double qualityScore;
    private final double dataQualityScore;
    private final Set<NormalizationWarning> warnings;
    private final Instant processedAt;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final AtomicBoolean processed = new AtomicBoolean(false);

    public static ProcessedEvent from(NormalizedEvent normalized, double qualityScore, Instant now) {
        return ProcessedEvent.builder()
                .id(UUID.randomUUID().toString())
                .title(normalized.getTitle())
                .description(normalized.getDescription())
                .source(normalized.getSource())
                .locationStandardized(normalized.getLocation())
                .impactSectors(List.copyOf(normalized.getImpactSectors()))
                .eventType(normalized.getEventType())
                .severity(normalized.getSeverity())
                .severityExplicit(normalized.isSeverityExplicit())
                .sectorsExplicit(normalized.isSectorsExplicit())
                .timestamp(normalized.getTimestamp())
                .url(normalized.getUrl())
                .qualityScore(clamp(qualityScore))
                .dataQualityScore(clamp(1.0 - WARNING_PENALTY * normalized.getWarnings().size()))
                .warnings(Set.copyOf(normalized.getWarnings()))
                .processedAt(now)
                .build();
    }

    /**
     * Region used for scoring: resolved country, else the standardized name, else "Global".
     */
    public String primaryRegion() {
        if (locationStandardized == null) {
            return GLOBAL_REGION;
        }
        String country = locationStandardized.getCountry();
        if (country != null && !country.isBlank()) {
            return country;
        }
        String name = locationStandardized.getStandardName();
        return name == null || name.isBlank() ? GLOBAL_REGION : name;
    }

    public boolean isProcessed() {
        return processed.get();
    }

    /**
     * @return true only for the caller that performed the transition
     */
    public boolean markProcessed() {
        return processed.compareAndSet(false, true);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
