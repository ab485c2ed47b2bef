package com.supplychain.pipeline.risk.service;

import com.supplychain.pipeline.domain.BusinessProfile;
import com.supplychain.pipeline.domain.PortfolioRisk;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.RiskSummary;
import com.supplychain.pipeline.persistence.service.AssessmentPersistenceService;
import com.supplychain.pipeline.risk.engine.PortfolioRiskCalculator;
import com.supplychain.pipeline.risk.engine.RiskSummaryCalculator;
import com.supplychain.pipeline.sink.RiskAssessmentCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side over stored assessments: recent summary, latest assessment per pair,
 * per-event lookup and portfolio exposure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskOverviewService {

    private final AssessmentPersistenceService persistenceService;
    private final RiskAssessmentCache cache;
    private final RiskSummaryCalculator summaryCalculator;
    private final PortfolioRiskCalculator portfolioCalculator;

    public RiskSummary summarize(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        List<RiskAssessment> recent = persistenceService.findRecentAssessments(Instant.now().minus(window));
        RiskSummary summary = summaryCalculator.summarize(recent);
        log.info("Risk summary over {}: total={}, high={}, medium={}, low={}", window,
                summary.getTotalAssessments(), summary.getHighRiskCount(),
                summary.getMediumRiskCount(), summary.getLowRiskCount());
        return summary;
    }

    /**
     * Cached assessment for the pair, else the newest stored one, which is cached again.
     * A cache failure falls through to the store.
     */
    public Optional<RiskAssessment> latest(String region, String sector) {
        try {
            Optional<RiskAssessment> cached = cache.get(region, sector);
            if (cached.isPresent()) {
                return cached;
            }
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for region={}, sector={}: {}", region, sector, e.getMessage());
        }
        Optional<RiskAssessment> stored = persistenceService.findLatestAssessment(region, sector);
        stored.ifPresent(this::recache);
        return stored;
    }

    public List<RiskAssessment> assessmentsForEvent(String eventId) {
        return persistenceService.findAssessmentsForEvent(eventId);
    }

    public PortfolioRisk portfolio(List<BusinessProfile> profiles) {
        PortfolioRisk risk = portfolioCalculator.calculate(profiles);
        log.info("Portfolio risk: businesses={}, overall={}", risk.getBusinessCount(), risk.getOverallRisk());
        return risk;
    }

    private void recache(RiskAssessment assessment) {
        try {
            cache.put(assessment);
        } catch (RuntimeException e) {
            log.warn("Could not re-cache assessment {}: {}", assessment.getId(), e.getMessage());
        }
    }
}
