package com.supplychain.pipeline.risk.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mitigation advice for a (region, sector) pair: a tier chosen by risk level, followed
 * by sector-specific lines.
 */
@Component
public class RecommendationGenerator {

    private static final Map<String, List<String>> SECTOR_ADVICE = Map.of(
            "automotive", List.of("Consider alternative semiconductor sources", "Review just-in-time delivery schedules"),
            "electronics", List.of("Secure component inventory", "Evaluate design alternatives"),
            "pharmaceuticals", List.of("Ensure API supply security", "Review regulatory compliance"),
            "food_beverage", List.of("Monitor commodity prices", "Secure packaging materials"),
            "energy", List.of("Review fuel supply contracts", "Consider renewable alternatives"));

    public List<String> recommend(String region, String sector, double riskLevel, int limit) {
        List<String> advice = new ArrayList<>();
        if (riskLevel >= 0.7) {
            advice.add("Immediate action required: Review and activate contingency plans");
            advice.add("Diversify suppliers away from " + region + " if heavily concentrated");
            advice.add("Increase inventory buffers for critical materials");
            advice.add("Establish alternative supply routes");
        } else if (riskLevel >= 0.5) {
            advice.add("Monitor situation closely and prepare contingency measures");
            advice.add("Assess supplier concentration in " + region);
            advice.add("Review contracts for force majeure clauses");
            advice.add("Consider temporary inventory increases");
        } else {
            advice.add("Continue monitoring for escalation");
            advice.add("Review supplier risk assessments");
            advice.add("Maintain standard inventory levels");
        }
        if (sector != null) {
            advice.addAll(SECTOR_ADVICE.getOrDefault(sector.toLowerCase(Locale.ROOT), List.of()));
        }
        return List.copyOf(advice.subList(0, Math.min(limit, advice.size())));
    }
}
