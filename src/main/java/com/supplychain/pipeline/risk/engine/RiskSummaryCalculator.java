package com.supplychain.pipeline.risk.engine;

import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.RiskSummary;
import com.supplychain.pipeline.domain.RiskSummary.RankedCount;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bands assessments by risk level and ranks the regions and sectors they name.
 */
@Component
public class RiskSummaryCalculator {

    static final double HIGH_THRESHOLD = 0.7;
    static final double MEDIUM_THRESHOLD = 0.4;
    static final int TOP_N = 5;

    public RiskSummary summarize(List<RiskAssessment> assessments) {
        if (assessments == null || assessments.isEmpty()) {
            return RiskSummary.empty();
        }
        int high = 0;
        int medium = 0;
        int low = 0;
        for (RiskAssessment assessment : assessments) {
            double level = assessment.getRiskLevel();
            if (level > HIGH_THRESHOLD) {
                high++;
            } else if (level >= MEDIUM_THRESHOLD) {
                medium++;
            } else {
                low++;
            }
        }
        return RiskSummary.builder()
                .totalAssessments(assessments.size())
                .highRiskCount(high)
                .mediumRiskCount(medium)
                .lowRiskCount(low)
                .topRiskRegions(top(assessments, RiskAssessment::getRegion))
                .topRiskSectors(top(assessments, RiskAssessment::getSector))
                .build();
    }

    /** Most frequent first; equal counts in name order. */
    private static List<RankedCount> top(List<RiskAssessment> assessments, Function<RiskAssessment, String> field) {
        Map<String, Long> counts = assessments.stream()
                .map(field)
                .filter(name -> name != null && !name.isBlank())
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_N)
                .map(e -> new RankedCount(e.getKey(), e.getValue().intValue()))
                .collect(Collectors.toList());
    }
}
