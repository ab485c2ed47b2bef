package com.supplychain.pipeline.config;

import com.supplychain.pipeline.risk.engine.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ScoringConfig {

    @Bean
    public ScoringWeights scoringWeights(ScoringProperties properties) {
        ScoringWeights weights = ScoringWeights.from(properties);
        log.info("Scoring tables loaded: regions={}, sectors={}, eventTypes={}, threshold={}, maxAssessments={}",
                properties.getRegionWeights().size(), properties.getSectorVulnerability().size(),
                properties.getEventTypeMultipliers().size(), weights.getSignificanceThreshold(),
                weights.getMaxAssessments());
        return weights;
    }
}
