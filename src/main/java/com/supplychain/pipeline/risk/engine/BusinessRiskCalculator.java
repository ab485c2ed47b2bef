package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.BusinessEventRisk;
import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.BusinessRiskReport;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskCategory;
import com.supplychain.pipeline.domain.StandardizedLocation;
import com.supplychain.pipeline.normalize.SectorCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Applies the event scoring primitives to one business: how much each recent event
 * touches its supply regions, its industry and its critical materials.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BusinessRiskCalculator {

    static final double INCLUSION_THRESHOLD = 0.1;
    static final int MIN_KEY_SUPPLIERS = 3;

    private static final double REGION_WEIGHT = 0.5;
    private static final double SECTOR_WEIGHT = 0.4;
    private static final double MATERIAL_WEIGHT = 0.3;

    private final ScoringWeights weights;
    private final SectorCatalog sectorCatalog;
    private final TimeDecay timeDecay;

    public BusinessRiskReport computeBusinessRisk(BusinessProfile profile, List<ProcessedEvent> events) {
        return computeBusinessRisk(profile, events, Instant.now());
    }

    public BusinessRiskReport computeBusinessRisk(BusinessProfile profile, List<ProcessedEvent> events, Instant now) {
        List<BusinessEventRisk> risks = new ArrayList<>();
        double overall = 0.0;
        for (ProcessedEvent event : events) {
            BusinessEventRisk risk = eventRisk(profile, event, now);
            if (risk.getRiskLevel() > INCLUSION_THRESHOLD) {
                risks.add(risk);
                overall = Math.max(overall, risk.getRiskLevel());
            }
        }
        risks.sort(Comparator.comparingDouble(BusinessEventRisk::getRiskLevel).reversed());
        boolean exceeds = overall > profile.getRiskTolerance();

        log.debug("Business risk for businessId={}: events={}, contributing={}, overall={}, exceedsTolerance={}",
                profile.getBusinessId(), events.size(), risks.size(), overall, exceeds);
        return BusinessRiskReport.builder()
                .businessId(profile.getBusinessId())
                .overallRiskLevel(overall)
                .riskCategory(RiskCategory.fromScore(overall))
                .exceedsTolerance(exceeds)
                .individualRisks(List.copyOf(risks))
                .recommendations(recommendations(profile, overall, exceeds))
                .assessedAt(now)
                .build();
    }

    private BusinessEventRisk eventRisk(BusinessProfile profile, ProcessedEvent event, Instant now) {
        double base = event.getSeverity() * weights.eventTypeMultiplier(event.getEventType());
        double blended = clamp((base + weights.regionWeight(event.primaryRegion())) / 2.0);

        double regionExposure = regionExposure(profile.getSupplyRegions(), event);
        double sectorExposure = sectorExposure(profile.getIndustry(), event.getImpactSectors());
        double materialExposure = materialExposure(profile.getCriticalMaterials(), event);

        double risk = clamp(blended * (1 + regionExposure * REGION_WEIGHT
                + sectorExposure * SECTOR_WEIGHT
                + materialExposure * MATERIAL_WEIGHT));
        risk = clamp(risk * timeDecay.factor(event.getTimestamp(), now));

        return BusinessEventRisk.builder()
                .eventId(event.getId())
                .eventTitle(event.getTitle())
                .riskLevel(risk)
                .regionExposure(regionExposure)
                .sectorExposure(sectorExposure)
                .materialExposure(materialExposure)
                .build();
    }

    /**
     * 1.0 when a supply region is the event's location, 0.5 when it is supply-chain
     * linked to it or shares a word with it, else 0.
     */
    double regionExposure(List<String> supplyRegions, ProcessedEvent event) {
        if (supplyRegions == null || supplyRegions.isEmpty()) {
            return 0.0;
        }
        String primary = event.primaryRegion().toLowerCase(Locale.ROOT);
        String locationText = locationText(event.getLocationStandardized());
        List<String> linked = weights.connectedRegions(event.primaryRegion()).stream()
                .map(r -> r.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        double exposure = 0.0;
        for (String supplyRegion : supplyRegions) {
            if (supplyRegion == null || supplyRegion.isBlank()) {
                continue;
            }
            String region = supplyRegion.trim().toLowerCase(Locale.ROOT);
            if (region.equals(primary) || locationText.contains(region)) {
                return 1.0;
            }
            if (linked.contains(region) || sharesWord(region, locationText)) {
                exposure = 0.5;
            }
        }
        return exposure;
    }

    double sectorExposure(String industry, List<String> eventSectors) {
        if (industry == null || industry.isBlank() || eventSectors == null || eventSectors.isEmpty()) {
            return 0.0;
        }
        String lowered = industry.trim().toLowerCase(Locale.ROOT);
        String canonical = sectorCatalog.lookup(industry).orElse(lowered);
        for (String sector : eventSectors) {
            if (sector.equals(canonical) || lowered.contains(sector.replace('_', ' '))) {
                return 1.0;
            }
        }
        return 0.0;
    }

    double materialExposure(List<String> materials, ProcessedEvent event) {
        if (materials == null || materials.isEmpty()) {
            return 0.0;
        }
        String text = (event.getTitle() + " " + event.getDescription()).toLowerCase(Locale.ROOT);
        boolean named = materials.stream()
                .filter(m -> m != null && !m.isBlank())
                .anyMatch(m -> text.contains(m.trim().toLowerCase(Locale.ROOT)));
        return named ? 0.8 : 0.2;
    }

    private List<String> recommendations(BusinessProfile profile, double overall, boolean exceedsTolerance) {
        List<String> advice = new ArrayList<>();
        if (overall >= 0.7) {
            advice.add("Critical risk alert for " + profile.getBusinessName());
            advice.add("Activate emergency supply chain protocols immediately");
            advice.add("Contact all key suppliers to assess their status");
            advice.add("Consider expedited shipping for critical materials");
        } else if (overall >= 0.5) {
            advice.add("Elevated risk detected - increase monitoring frequency");
            advice.add("Review inventory levels for critical materials");
            advice.add("Prepare alternative sourcing strategies");
        } else {
            advice.add("Risk within normal range - continue standard monitoring");
        }
        if (exceedsTolerance) {
            advice.add(String.format(Locale.ROOT, "Overall risk %.2f exceeds the configured tolerance of %.2f",
                    overall, profile.getRiskTolerance()));
        }
        List<String> suppliers = profile.getKeySuppliers();
        if (suppliers != null && !suppliers.isEmpty() && suppliers.size() < MIN_KEY_SUPPLIERS) {
            advice.add("Supplier base is concentrated: qualify additional suppliers");
        }
        String industry = profile.getIndustry() == null ? "" : profile.getIndustry().toLowerCase(Locale.ROOT);
        if (industry.contains("manufacturing")) {
            advice.add("Review production schedules and capacity planning");
        } else if (industry.contains("retail")) {
            advice.add("Assess inventory levels and customer demand patterns");
        }
        return List.copyOf(advice.subList(0, Math.min(weights.getMaxRecommendations(), advice.size())));
    }

    private static String locationText(StandardizedLocation location) {
        if (location == null) {
            return "";
        }
        return (nullToEmpty(location.getStandardName()) + " " + nullToEmpty(location.getCountry()))
                .toLowerCase(Locale.ROOT);
    }

    private static boolean sharesWord(String region, String locationText) {
        for (String word : region.split("\\s+")) {
            if (word.length() > 2 && locationText.matches(".*\\b" + Pattern.quote(word) + "\\b.*")) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
