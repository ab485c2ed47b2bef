package com.supplychain.pipeline.risk.service;

import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.BusinessRiskReport;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskCategory;
import com.supplychain.pipeline.persistence.service.AssessmentPersistenceService;
import com.supplychain.pipeline.risk.engine.BusinessRiskCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BusinessRiskServiceTest {

    @Mock
    private AssessmentPersistenceService persistenceService;

    @Mock
    private BusinessRiskCalculator calculator;

    private BusinessRiskService service;
    private BusinessProfile profile;

    @BeforeEach
    void setUp() {
        service = new BusinessRiskService(persistenceService, calculator);
        profile = BusinessProfile.builder()
                .businessId("biz-7")
                .businessName("Northwind Foods")
                .industry("food_beverage")
                .supplyRegions(List.of("Thailand"))
                .criticalMaterials(List.of("rice"))
                .keySuppliers(List.of("S1", "S2", "S3"))
                .riskTolerance(0.5)
                .build();
    }

    @Test
    void assessesEventsWithinWindow() {
        List<ProcessedEvent> events = List.of(ProcessedEvent.builder().id("evt-1").build());
        BusinessRiskReport report = BusinessRiskReport.builder()
                .businessId("biz-7")
                .overallRiskLevel(0.3)
                .riskCategory(RiskCategory.LOW)
                .individualRisks(List.of())
                .recommendations(List.of())
                .build();
        when(persistenceService.findProcessedSince(any(Instant.class))).thenReturn(events);
        when(calculator.computeBusinessRisk(eq(profile), eq(events), any(Instant.class))).thenReturn(report);

        Instant before = Instant.now();
        BusinessRiskReport result = service.assess(profile, Duration.ofDays(7));

        assertThat(result).isSameAs(report);
        ArgumentCaptor<Instant> since = ArgumentCaptor.forClass(Instant.class);
        verify(persistenceService).findProcessedSince(since.capture());
        assertThat(since.getValue()).isBetween(before.minus(Duration.ofDays(7)), Instant.now().minus(Duration.ofDays(7)));
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> service.assess(profile, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.assess(profile, Duration.ofHours(-1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.assess(profile, null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(persistenceService, calculator);
    }
}
