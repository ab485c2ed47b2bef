package com.supplychain.pipeline.sink;

import com.supplychain.pipeline.config.PipelineProperties;
import com.supplychain.pipeline.domain.RiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Latest assessment per (region, sector), kept in Redis for the configured TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskAssessmentCache {

    static final String KEY_PREFIX = "risk_assessment:";

    private final RedisTemplate<String, RiskAssessment> riskAssessmentRedisTemplate;
    private final PipelineProperties properties;

    public void put(RiskAssessment assessment) {
        String key = key(assessment.getRegion(), assessment.getSector());
        riskAssessmentRedisTemplate.opsForValue().set(key, assessment, properties.getSink().getCacheTtl());
        log.debug("Cached assessment key={}, riskLevel={}", key, assessment.getRiskLevel());
    }

    public Optional<RiskAssessment> get(String region, String sector) {
        return Optional.ofNullable(riskAssessmentRedisTemplate.opsForValue().get(key(region, sector)));
    }

    static String key(String region, String sector) {
        return KEY_PREFIX + region + ":" + sector;
    }
}
