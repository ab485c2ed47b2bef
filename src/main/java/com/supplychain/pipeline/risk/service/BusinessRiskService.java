package com.supplychain.pipeline.risk.service;

import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.BusinessRiskReport;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.persistence.service.AssessmentPersistenceService;
import com.supplychain.pipeline.risk.engine.BusinessRiskCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Business impact over events processed within a recent window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessRiskService {

    private final AssessmentPersistenceService persistenceService;
    private final BusinessRiskCalculator calculator;

    public BusinessRiskReport assess(BusinessProfile profile, Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        Instant now = Instant.now();
        List<ProcessedEvent> events = persistenceService.findProcessedSince(now.minus(window));
        BusinessRiskReport report = calculator.computeBusinessRisk(profile, events, now);
        log.info("Business risk for {}: overall={}, events={}/{}, exceedsTolerance={}",
                profile.getBusinessId(), report.getOverallRiskLevel(), report.getIndividualRisks().size(),
                events.size(), report.isExceedsTolerance());
        return report;
    }
}
