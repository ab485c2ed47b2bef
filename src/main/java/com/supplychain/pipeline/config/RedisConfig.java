package com.supplychain.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.sink.RiskAssessmentRedisSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Assessment cache template: {@code risk_assessment:<region>:<sector>} string keys and
 * snake_case JSON values. Only plain values are stored, so hash serializers stay unset.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, RiskAssessment> riskAssessmentRedisTemplate(
            RedisConnectionFactory connectionFactory,
            @Qualifier("pipelineObjectMapper") ObjectMapper objectMapper) {
        RedisTemplate<String, RiskAssessment> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setEnableDefaultSerializer(false);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(new RiskAssessmentRedisSerializer(objectMapper));
        return template;
    }
}
