package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.config.NormalizationProperties;
import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.PortfolioRisk;
import com.supplychain.pipeline.normalize.SectorCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PortfolioRiskCalculatorTest {

    private PortfolioRiskCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PortfolioRiskCalculator(ScoringWeights.defaults(), new SectorCatalog(new NormalizationProperties()));
    }

    private static BusinessProfile business(String id, String industry, List<String> regions) {
        return BusinessProfile.builder()
                .businessId(id)
                .businessName(id)
                .industry(industry)
                .supplyRegions(regions)
                .riskTolerance(0.5)
                .build();
    }

    @Test
    void emptyPortfolioHasBaselineRisk() {
        PortfolioRisk risk = calculator.calculate(List.of());

        assertThat(risk.getOverallRisk()).isEqualTo(0.3);
        assertThat(risk.getRiskDistribution()).isEmpty();
        assertThat(risk.getBusinessCount()).isZero();
    }

    @Test
    void businessRiskAveragesIndustryAndRegionWeights() {
        // electronics 0.9; China 0.9 and Mexico 0.5 average to 0.7
        BusinessProfile electronics = business("b1", "electronics", List.of("China", "Mexico"));

        assertThat(calculator.businessRisk(electronics)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void portfolioAveragesBusinessesAndSumsByIndustry() {
        List<BusinessProfile> profiles = List.of(
                business("b1", "electronics", List.of("China", "Mexico")),
                business("b2", "electronics", List.of("Taiwan")),
                business("b3", "textiles", List.of("Vietnam")));

        PortfolioRisk risk = calculator.calculate(profiles);

        // 0.8, (0.9 + 0.8) / 2 = 0.85, (0.5 + 0.6) / 2 = 0.55
        assertThat(risk.getBusinessCount()).isEqualTo(3);
        assertThat(risk.getOverallRisk()).isCloseTo((0.8 + 0.85 + 0.55) / 3, within(1e-9));
        assertThat(risk.getRiskDistribution().get("electronics")).isCloseTo(1.65, within(1e-9));
        assertThat(risk.getRiskDistribution().get("textiles")).isCloseTo(0.55, within(1e-9));
    }

    @Test
    void unknownIndustryAndRegionUseConfiguredDefaults() {
        assertThat(calculator.industryVulnerability("basket weaving")).isEqualTo(0.6);
        assertThat(calculator.regionalRisk(List.of("Atlantis"))).isEqualTo(0.45);
        assertThat(calculator.regionalRisk(List.of())).isZero();
        assertThat(calculator.regionalRisk(null)).isZero();
    }
}
