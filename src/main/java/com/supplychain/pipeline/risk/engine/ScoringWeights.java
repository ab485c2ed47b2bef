package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.config.ScoringProperties;
import com.supplychain.pipeline.domain.EventType;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable snapshot of the scoring tables. Lookups are case-insensitive and every
 * table has an explicit answer for keys it does not know.
 */
@Getter
public final class ScoringWeights {

    private static final double NEUTRAL = 1.0;

    private final double significanceThreshold;
    private final int maxAssessments;
    private final int maxRecommendations;
    private final double directImpactBoost;
    private final double indirectDamping;
    private final double indirectCeiling;
    private final double unknownRegionWeight;
    private final double unknownSectorVulnerability;
    private final List<String> defaultSectors;
    private final Duration immediateWindow;
    private final Duration shortTermWindow;
    private final Duration mediumTermWindow;
    private final double immediateFactor;
    private final double shortTermFactor;
    private final double mediumTermFactor;
    private final double longTermFactor;

    @Getter(AccessLevel.NONE)
    private final Map<String, Double> regionWeights;
    @Getter(AccessLevel.NONE)
    private final Map<String, Double> sectorVulnerability;
    @Getter(AccessLevel.NONE)
    private final Map<String, Double> eventTypeMultipliers;
    @Getter(AccessLevel.NONE)
    private final Map<String, Map<String, Double>> sectorEventAdjustments;
    @Getter(AccessLevel.NONE)
    private final Map<String, List<String>> connectedRegions;

    private ScoringWeights(ScoringProperties p) {
        this.significanceThreshold = p.getSignificanceThreshold();
        this.maxAssessments = p.getMaxAssessments();
        this.maxRecommendations = p.getMaxRecommendations();
        this.directImpactBoost = p.getDirectImpactBoost();
        this.indirectDamping = p.getIndirectDamping();
        this.indirectCeiling = p.getIndirectCeiling();
        this.unknownRegionWeight = p.getUnknownRegionWeight();
        this.unknownSectorVulnerability = p.getUnknownSectorVulnerability();
        this.defaultSectors = List.copyOf(p.getDefaultSectors());
        ScoringProperties.Decay decay = p.getDecay();
        this.immediateWindow = decay.getImmediate();
        this.shortTermWindow = decay.getShortTerm();
        this.mediumTermWindow = decay.getMediumTerm();
        this.immediateFactor = decay.getImmediateFactor();
        this.shortTermFactor = decay.getShortTermFactor();
        this.mediumTermFactor = decay.getMediumTermFactor();
        this.longTermFactor = decay.getLongTermFactor();
        this.regionWeights = lowerKeys(p.getRegionWeights());
        this.sectorVulnerability = lowerKeys(p.getSectorVulnerability());
        this.eventTypeMultipliers = lowerKeys(p.getEventTypeMultipliers());
        Map<String, Map<String, Double>> adjustments = new HashMap<>();
        p.getSectorEventAdjustments().forEach((type, bySector) -> adjustments.put(key(type), lowerKeys(bySector)));
        this.sectorEventAdjustments = Map.copyOf(adjustments);
        Map<String, List<String>> connections = new HashMap<>();
        p.getConnectedRegions().forEach((region, linked) -> connections.put(key(region), List.copyOf(linked)));
        this.connectedRegions = Map.copyOf(connections);
    }

    public static ScoringWeights from(ScoringProperties properties) {
        return new ScoringWeights(properties);
    }

    /** Production tables with no overrides. */
    public static ScoringWeights defaults() {
        return new ScoringWeights(new ScoringProperties());
    }

    public double regionWeight(String region) {
        return region == null ? unknownRegionWeight : regionWeights.getOrDefault(key(region), unknownRegionWeight);
    }

    public boolean isKnownRegion(String region) {
        return region != null && regionWeights.containsKey(key(region));
    }

    public double sectorVulnerability(String sector) {
        return sector == null ? unknownSectorVulnerability
                : sectorVulnerability.getOrDefault(key(sector), unknownSectorVulnerability);
    }

    public double eventTypeMultiplier(EventType type) {
        EventType effective = type == null ? EventType.OTHER : type;
        return eventTypeMultipliers.getOrDefault(effective.getLabel(), NEUTRAL);
    }

    /** 1.0 when the event type has no special effect on the sector. */
    public double sectorAdjustment(EventType type, String sector) {
        if (type == null || sector == null) {
            return NEUTRAL;
        }
        Map<String, Double> bySector = sectorEventAdjustments.get(type.getLabel());
        return bySector == null ? NEUTRAL : bySector.getOrDefault(key(sector), NEUTRAL);
    }

    /** Empty when the region has no known supply-chain links. */
    public List<String> connectedRegions(String region) {
        return region == null ? List.of() : connectedRegions.getOrDefault(key(region), List.of());
    }

    private static <V> Map<String, V> lowerKeys(Map<String, V> source) {
        Map<String, V> result = new HashMap<>();
        source.forEach((k, v) -> result.put(key(k), v));
        return Map.copyOf(result);
    }

    private static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
