package com.supplychain.pipeline.risk.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();

    @Test
    void tierFollowsRiskLevel() {
        assertThat(generator.recommend("China", "textiles", 0.7, 5).get(0)).startsWith("Immediate action required");
        assertThat(generator.recommend("China", "textiles", 0.5, 5).get(0)).startsWith("Monitor situation closely");
        assertThat(generator.recommend("China", "textiles", 0.49, 5).get(0)).isEqualTo("Continue monitoring for escalation");
    }

    @Test
    void sectorAdviceFollowsTierAndIsTruncated() {
        List<String> advice = generator.recommend("Germany", "automotive", 0.3, 5);

        assertThat(advice).hasSize(5);
        assertThat(advice.get(3)).isEqualTo("Consider alternative semiconductor sources");
        assertThat(advice.get(4)).isEqualTo("Review just-in-time delivery schedules");
    }

    @Test
    void regionIsNamedInTierAdvice() {
        assertThat(generator.recommend("Vietnam", null, 0.9, 5))
                .contains("Diversify suppliers away from Vietnam if heavily concentrated");
        assertThat(generator.recommend("Vietnam", "retail", 0.9, 2)).hasSize(2);
    }
}
