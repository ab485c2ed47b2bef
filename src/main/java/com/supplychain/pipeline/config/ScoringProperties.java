package com.supplychain.pipeline.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring tables and thresholds. Defaults are the production tables; override per
 * environment under {@code supplychain.scoring}. Frozen into {@code ScoringWeights} at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "supplychain.scoring")
@Data
@Validated
public class ScoringProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double significanceThreshold = 0.3;

    @Min(1)
    private int maxAssessments = 20;

    @Min(1)
    private int maxRecommendations = 5;

    @Positive
    private double directImpactBoost = 1.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double indirectDamping = 0.65;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double indirectCeiling = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double unknownRegionWeight = 0.45;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double unknownSectorVulnerability = 0.6;

    @NotEmpty
    private Map<String, Double> regionWeights = defaultRegionWeights();

    @NotEmpty
    private Map<String, Double> sectorVulnerability = defaultSectorVulnerability();

    @NotEmpty
    private Map<String, Double> eventTypeMultipliers = defaultEventTypeMultipliers();

    private Map<String, Map<String, Double>> sectorEventAdjustments = defaultSectorEventAdjustments();

    private Map<String, List<String>> connectedRegions = defaultConnectedRegions();

    /** Used when an event names no sectors and none can be inferred from its text. */
    @NotEmpty
    private List<String> defaultSectors = List.of("automotive", "electronics", "pharmaceuticals", "food_beverage", "textiles");

    private Decay decay = new Decay();

    @Data
    public static class Decay {
        private Duration immediate = Duration.ofHours(24);
        private Duration shortTerm = Duration.ofDays(7);
        private Duration mediumTerm = Duration.ofDays(28);

        private double immediateFactor = 1.0;
        private double shortTermFactor = 0.8;
        private double mediumTermFactor = 0.6;
        private double longTermFactor = 0.4;
    }

    private static Map<String, Double> defaultRegionWeights() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("China", 0.9);
        m.put("Taiwan", 0.8);
        m.put("South Korea", 0.7);
        m.put("Japan", 0.6);
        m.put("Singapore", 0.7);
        m.put("Germany", 0.6);
        m.put("Netherlands", 0.5);
        m.put("United States", 0.7);
        m.put("Mexico", 0.5);
        m.put("Vietnam", 0.6);
        m.put("India", 0.6);
        m.put("Thailand", 0.5);
        m.put("Malaysia", 0.5);
        m.put("Global", 0.8);
        return m;
    }

    private static Map<String, Double> defaultSectorVulnerability() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("automotive", 0.8);
        m.put("electronics", 0.9);
        m.put("pharmaceuticals", 0.7);
        m.put("food_beverage", 0.6);
        m.put("textiles", 0.5);
        m.put("construction", 0.6);
        m.put("energy", 0.8);
        m.put("retail", 0.7);
        m.put("aerospace", 0.8);
        m.put("chemicals", 0.7);
        return m;
    }

    private static Map<String, Double> defaultEventTypeMultipliers() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("news", 1.0);
        m.put("weather", 1.2);
        m.put("economic", 1.1);
        m.put("geopolitical", 1.3);
        m.put("shipping", 1.2);
        m.put("natural_disaster", 1.5);
        m.put("cyber_attack", 1.4);
        m.put("pandemic", 1.6);
        m.put("other", 1.0);
        return m;
    }

    private static Map<String, Map<String, Double>> defaultSectorEventAdjustments() {
        Map<String, Map<String, Double>> m = new LinkedHashMap<>();
        m.put("weather", Map.of("food_beverage", 1.3, "energy", 1.2, "construction", 1.2));
        m.put("economic", Map.of("automotive", 1.2, "electronics", 1.1, "retail", 1.3));
        m.put("geopolitical", Map.of("electronics", 1.4, "automotive", 1.2, "energy", 1.3));
        return m;
    }

    private static Map<String, List<String>> defaultConnectedRegions() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("China", List.of("Taiwan", "South Korea", "Japan", "Singapore", "United States"));
        m.put("Taiwan", List.of("China", "South Korea", "Japan", "United States"));
        m.put("Germany", List.of("Netherlands", "France", "Italy", "Poland"));
        m.put("United States", List.of("Mexico", "Canada", "China", "Germany"));
        m.put("Singapore", List.of("Malaysia", "Thailand", "Indonesia", "China"));
        m.put("Japan", List.of("China", "South Korea", "Taiwan", "United States"));
        return m;
    }
}
