package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.config.NormalizationProperties;
import com.supplychain.pipeline.domain.BusinessEventRisk;
import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.BusinessRiskReport;
import com.supplychain.pipeline.domain.Coordinates;
import com.supplychain.pipeline.domain.EventType;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskCategory;
import com.supplychain.pipeline.domain.StandardizedLocation;
import com.supplychain.pipeline.normalize.SectorCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for BusinessRiskCalculator: exposures, decay, tolerance and advice.
 */
class BusinessRiskCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private BusinessRiskCalculator calculator;

    @BeforeEach
    void setUp() {
        ScoringWeights weights = ScoringWeights.defaults();
        calculator = new BusinessRiskCalculator(weights, new SectorCatalog(new NormalizationProperties()), new TimeDecay(weights));
    }

    private static ProcessedEvent event(String id, String name, String country, double severity, EventType type,
                                        List<String> sectors, String title, String description, Instant timestamp) {
        return ProcessedEvent.builder()
                .id(id)
                .title(title)
                .description(description)
                .source("test")
                .locationStandardized(StandardizedLocation.builder()
                        .standardName(name).country(country).region("")
                        .coordinates(Coordinates.UNKNOWN).resolved(!country.isEmpty()).build())
                .impactSectors(sectors)
                .eventType(type)
                .severity(severity)
                .severityExplicit(true)
                .sectorsExplicit(!sectors.isEmpty())
                .timestamp(timestamp)
                .qualityScore(0.9)
                .dataQualityScore(1.0)
                .warnings(Set.of())
                .processedAt(timestamp)
                .build();
    }

    private static BusinessProfile acme(List<String> suppliers) {
        return BusinessProfile.builder()
                .businessId("biz-1")
                .businessName("Acme Motors")
                .industry("automotive")
                .supplyRegions(List.of("China", "Mexico"))
                .criticalMaterials(List.of("semiconductors", "steel"))
                .keySuppliers(suppliers)
                .riskTolerance(0.6)
                .build();
    }

    private static ProcessedEvent chipBan() {
        return event("evt-chip", "China", "China", 0.9, EventType.GEOPOLITICAL, List.of("electronics", "automotive"),
                "Chip export ban", "Semiconductors restricted for foreign buyers", NOW);
    }

    private static ProcessedEvent rotterdamDelay() {
        return event("evt-rtm", "Rotterdam", "Netherlands", 0.2, EventType.NEWS, List.of("textiles"),
                "Dock delays", "Crane maintenance slows unloading", NOW.minus(Duration.ofDays(10)));
    }

    private static ProcessedEvent staleNoise() {
        return event("evt-old", "Unknown Town", "", 0.0, EventType.NEWS, List.of(),
                "Council notice", "Nothing much happened", NOW.minus(Duration.ofDays(100)));
    }

    @Test
    void directExposureDrivesOverallRisk() {
        BusinessRiskReport report = calculator.computeBusinessRisk(acme(List.of("A", "B")),
                List.of(rotterdamDelay(), chipBan(), staleNoise()), NOW);

        assertThat(report.getBusinessId()).isEqualTo("biz-1");
        assertThat(report.getOverallRiskLevel()).isEqualTo(1.0);
        assertThat(report.getRiskCategory()).isEqualTo(RiskCategory.CRITICAL);
        assertThat(report.isExceedsTolerance()).isTrue();
        assertThat(report.getAssessedAt()).isEqualTo(NOW);
        assertThat(report.getIndividualRisks()).extracting(BusinessEventRisk::getEventId)
                .containsExactly("evt-chip", "evt-rtm");

        BusinessEventRisk chip = report.getIndividualRisks().get(0);
        assertThat(chip.getRegionExposure()).isEqualTo(1.0);
        assertThat(chip.getSectorExposure()).isEqualTo(1.0);
        assertThat(chip.getMaterialExposure()).isEqualTo(0.8);

        BusinessEventRisk rotterdam = report.getIndividualRisks().get(1);
        assertThat(rotterdam.getRiskLevel()).isCloseTo(0.35 * 1.06 * 0.6, within(1e-9));
    }

    @Test
    void recommendationsAreTieredAndCapped() {
        BusinessRiskReport report = calculator.computeBusinessRisk(acme(List.of("A", "B")), List.of(chipBan()), NOW);

        assertThat(report.getRecommendations()).hasSize(5);
        assertThat(report.getRecommendations().get(0)).isEqualTo("Critical risk alert for Acme Motors");
        assertThat(report.getRecommendations().get(4))
                .isEqualTo("Overall risk 1.00 exceeds the configured tolerance of 0.60");
    }

    @Test
    void lowRiskWithinToleranceFlagsSupplierConcentration() {
        BusinessRiskReport report = calculator.computeBusinessRisk(acme(List.of("A")), List.of(rotterdamDelay()), NOW);

        assertThat(report.isExceedsTolerance()).isFalse();
        assertThat(report.getRiskCategory()).isEqualTo(RiskCategory.LOW);
        assertThat(report.getRecommendations()).containsExactly(
                "Risk within normal range - continue standard monitoring",
                "Supplier base is concentrated: qualify additional suppliers");
    }

    @Test
    void noEventsMeansNoRisk() {
        BusinessRiskReport report = calculator.computeBusinessRisk(acme(List.of("A", "B", "C")), List.of(), NOW);

        assertThat(report.getOverallRiskLevel()).isZero();
        assertThat(report.getIndividualRisks()).isEmpty();
        assertThat(report.isExceedsTolerance()).isFalse();
    }

    @Test
    void regionExposureRecognisesLinksAndSharedWords() {
        assertThat(calculator.regionExposure(List.of("Taiwan"), chipBan())).isEqualTo(0.5);
        assertThat(calculator.regionExposure(List.of("Brazil"), chipBan())).isZero();
        assertThat(calculator.regionExposure(null, chipBan())).isZero();

        ProcessedEvent shanghai = event("e", "Shanghai", "China", 0.5, EventType.WEATHER, List.of(), "t", "d", NOW);
        assertThat(calculator.regionExposure(List.of("Shanghai"), shanghai)).isEqualTo(1.0);

        ProcessedEvent la = event("e", "Los Angeles", "United States", 0.5, EventType.WEATHER, List.of(), "t", "d", NOW);
        assertThat(calculator.regionExposure(List.of("Greater Los Angeles"), la)).isEqualTo(0.5);
    }

    @Test
    void sectorAndMaterialExposure() {
        assertThat(calculator.sectorExposure("Automotive manufacturing", List.of("automotive"))).isEqualTo(1.0);
        assertThat(calculator.sectorExposure("retail", List.of("energy"))).isZero();
        assertThat(calculator.sectorExposure("retail", List.of())).isZero();

        assertThat(calculator.materialExposure(List.of(), chipBan())).isZero();
        assertThat(calculator.materialExposure(List.of("lithium"), chipBan())).isEqualTo(0.2);
        assertThat(calculator.materialExposure(List.of("Semiconductors"), chipBan())).isEqualTo(0.8);
    }
}
