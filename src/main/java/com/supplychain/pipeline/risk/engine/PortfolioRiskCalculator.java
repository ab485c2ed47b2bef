package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.PortfolioRisk;
import com.supplychain.pipeline.normalize.SectorCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static exposure of a portfolio: each business scores the mean of its industry
 * vulnerability and its average supply-region weight.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioRiskCalculator {

    /** Reported for a portfolio with no businesses. */
    static final double EMPTY_PORTFOLIO_RISK = 0.3;

    private final ScoringWeights weights;
    private final SectorCatalog sectorCatalog;

    public PortfolioRisk calculate(List<BusinessProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            return PortfolioRisk.builder().overallRisk(EMPTY_PORTFOLIO_RISK).build();
        }
        Map<String, Double> distribution = new LinkedHashMap<>();
        double total = 0.0;
        for (BusinessProfile profile : profiles) {
            double risk = businessRisk(profile);
            total += risk;
            String industry = profile.getIndustry() == null ? "unknown" : profile.getIndustry();
            distribution.merge(industry, risk, Double::sum);
        }
        double overall = Math.min(1.0, total / profiles.size());
        log.debug("Portfolio risk over {} businesses: overall={}", profiles.size(), overall);
        return PortfolioRisk.builder()
                .overallRisk(overall)
                .riskDistribution(Map.copyOf(distribution))
                .businessCount(profiles.size())
                .build();
    }

    double businessRisk(BusinessProfile profile) {
        return (industryVulnerability(profile.getIndustry()) + regionalRisk(profile.getSupplyRegions())) / 2.0;
    }

    double industryVulnerability(String industry) {
        return weights.sectorVulnerability(sectorCatalog.lookup(industry).orElse(industry));
    }

    /** Mean configured weight of the supply regions; 0 when none are listed. */
    double regionalRisk(List<String> supplyRegions) {
        if (supplyRegions == null) {
            return 0.0;
        }
        return supplyRegions.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .mapToDouble(weights::regionWeight)
                .average()
                .orElse(0.0);
    }
}
