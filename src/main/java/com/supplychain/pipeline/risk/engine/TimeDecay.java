package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.RiskCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Older events matter less: full weight for a day, then 0.8 for a week, 0.6 for four
 * weeks and 0.4 after that (bucket edges and factors are configurable).
 */
@Component
@RequiredArgsConstructor
public class TimeDecay {

    private final ScoringWeights weights;

    public double factor(Instant eventTime, Instant now) {
        if (eventTime == null || !eventTime.isBefore(now)) {
            return weights.getImmediateFactor();
        }
        Duration age = Duration.between(eventTime, now);
        if (age.compareTo(weights.getImmediateWindow()) <= 0) {
            return weights.getImmediateFactor();
        }
        if (age.compareTo(weights.getShortTermWindow()) <= 0) {
            return weights.getShortTermFactor();
        }
        if (age.compareTo(weights.getMediumTermWindow()) <= 0) {
            return weights.getMediumTermFactor();
        }
        return weights.getLongTermFactor();
    }

    /**
     * Copy of the assessment with its risk level (and category) decayed by the event's age.
     */
    public RiskAssessment decay(RiskAssessment assessment, Instant eventTime, Instant now) {
        double decayed = Math.max(0.0, Math.min(1.0, assessment.getRiskLevel() * factor(eventTime, now)));
        return assessment.toBuilder()
                .riskLevel(decayed)
                .riskCategory(RiskCategory.fromScore(decayed))
                .build();
    }
}
