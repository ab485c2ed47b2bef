package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.ImpactType;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.RiskCategory;
import com.supplychain.pipeline.domain.RiskFactor;
import com.supplychain.pipeline.domain.RiskFactorType;
import com.supplychain.pipeline.normalize.SectorCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores an event across every affected (region, sector) pair. The event's own region
 * is hit directly; regions linked to it through supply chains are hit indirectly and
 * dampened. Only pairs above the significance threshold are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEngine {

    private final ScoringWeights weights;
    private final SectorCatalog sectorCatalog;
    private final RecommendationGenerator recommendationGenerator;

    public ScoringReport scoreEvent(ProcessedEvent event) {
        double base = event.getSeverity() * weights.eventTypeMultiplier(event.getEventType());
        String primaryRegion = event.primaryRegion();
        double blended = blend(base, primaryRegion);

        Map<String, RegionHit> regions = new LinkedHashMap<>();
        regions.put(primaryRegion, new RegionHit(primaryRegion, ImpactType.DIRECT, blended));
        for (String linked : weights.connectedRegions(primaryRegion)) {
            if (!regions.containsKey(linked)) {
                double indirect = Math.min(weights.getIndirectCeiling(), blend(base, linked) * weights.getIndirectDamping());
                regions.put(linked, new RegionHit(linked, ImpactType.INDIRECT, indirect));
            }
        }
        List<String> sectors = sectorsFor(event);

        Instant now = Instant.now();
        List<RiskAssessment> significant = new ArrayList<>();
        int attempted = 0;
        int failed = 0;
        for (RegionHit region : regions.values()) {
            for (String sector : sectors) {
                attempted++;
                try {
                    RiskAssessment assessment = assess(event, region, sector, blended, now);
                    if (assessment.getRiskLevel() >= weights.getSignificanceThreshold()) {
                        significant.add(assessment);
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Scoring failed for eventId={}, region={}, sector={}", event.getId(), region.region, sector, e);
                }
            }
        }

        List<RiskAssessment> top = significant.stream()
                .sorted(Comparator.comparingDouble(RiskAssessment::getRiskLevel).reversed()
                        .thenComparing(RiskAssessment::getRegion)
                        .thenComparing(RiskAssessment::getSector))
                .limit(weights.getMaxAssessments())
                .collect(Collectors.toList());

        log.debug("Scored eventId={}: primaryRegion={}, base={}, blended={}, pairs={}, significant={}, kept={}, failed={}",
                event.getId(), primaryRegion, base, blended, attempted, significant.size(), top.size(), failed);
        return new ScoringReport(List.copyOf(top), attempted, failed);
    }

    private RiskAssessment assess(ProcessedEvent event, RegionHit region, String sector, double blended, Instant now) {
        double sectorScore = clamp(blended
                * weights.sectorVulnerability(sector)
                * weights.sectorAdjustment(event.getEventType(), sector));
        double combined = (region.score + sectorScore) / 2.0;
        if (region.impactType == ImpactType.DIRECT) {
            combined *= weights.getDirectImpactBoost();
        }
        double riskLevel = clamp(combined);

        return RiskAssessment.builder()
                .id(UUID.randomUUID().toString())
                .eventId(event.getId())
                .region(region.region)
                .sector(sector)
                .riskLevel(riskLevel)
                .riskCategory(RiskCategory.fromScore(riskLevel))
                .impactType(region.impactType)
                .riskFactors(riskFactors(region, sector, sectorScore))
                .recommendations(recommendationGenerator.recommend(region.region, sector, riskLevel,
                        weights.getMaxRecommendations()))
                .confidenceScore(confidence(event, region.impactType))
                .createdAt(now)
                .build();
    }

    private List<RiskFactor> riskFactors(RegionHit region, String sector, double sectorScore) {
        List<RiskFactor> factors = new ArrayList<>();
        if (region.score > 0.6) {
            factors.add(factor(RiskFactorType.REGIONAL, "High exposure in " + region.region, RiskCategory.HIGH));
        }
        if (sectorScore > 0.6) {
            factors.add(factor(RiskFactorType.SECTORAL, "High vulnerability in " + sector + " sector", RiskCategory.HIGH));
        }
        if (region.score > 0.5 && sectorScore > 0.5) {
            factors.add(factor(RiskFactorType.INTERACTION,
                    "Combined regional and sectoral exposure amplifies risk", RiskCategory.MEDIUM));
        }
        if (region.impactType == ImpactType.INDIRECT) {
            factors.add(factor(RiskFactorType.SUPPLY_CHAIN_LINK,
                    "Indirect impact through supply chain connections", RiskCategory.MEDIUM));
        }
        return List.copyOf(factors);
    }

    private double confidence(ProcessedEvent event, ImpactType impactType) {
        double confidence = 0.7;
        if (event.isSeverityExplicit()) confidence += 0.1;
        if (event.getLocationStandardized() != null && event.getLocationStandardized().isResolved()) confidence += 0.1;
        if (event.isSectorsExplicit()) confidence += 0.1;
        if (impactType == ImpactType.INDIRECT) confidence *= 0.8;
        return clamp(confidence);
    }

    /**
     * Collector sectors if any, else sectors named in the text, else the configured defaults.
     */
    private List<String> sectorsFor(ProcessedEvent event) {
        if (event.getImpactSectors() != null && !event.getImpactSectors().isEmpty()) {
            return event.getImpactSectors();
        }
        List<String> inferred = sectorCatalog.inferFromText(event.getTitle() + " " + event.getDescription());
        return inferred.isEmpty() ? weights.getDefaultSectors() : inferred;
    }

    private double blend(double base, String region) {
        return clamp((base + weights.regionWeight(region)) / 2.0);
    }

    private static RiskFactor factor(RiskFactorType type, String description, RiskCategory severity) {
        return RiskFactor.builder().type(type).description(description).severity(severity).build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class RegionHit {
        private final String region;
        private final ImpactType impactType;
        private final double score;

        private RegionHit(String region, ImpactType impactType, double score) {
            this.region = region;
            this.impactType = impactType;
            this.score = score;
        }
    }
}
