package com.supplychain.pipeline.config;

import com.supplychain.pipeline.dedup.InMemorySignatureStore;
import com.supplychain.pipeline.dedup.RedisSignatureStore;
import com.supplychain.pipeline.dedup.SignatureStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses where duplicate signatures live: process memory (single instance) or Redis
 * (shared, survives restarts).
 */
@Slf4j
@Configuration
public class DedupConfig {

    @Bean
    @ConditionalOnProperty(name = "supplychain.pipeline.dedup.store", havingValue = "memory", matchIfMissing = true)
    public SignatureStore inMemorySignatureStore(PipelineProperties properties) {
        log.info("Using in-memory signature store (retention={})", properties.getDedup().getRetention());
        return new InMemorySignatureStore(properties.getDedup().getCleanupLockTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "supplychain.pipeline.dedup.store", havingValue = "redis")
    public SignatureStore redisSignatureStore(StringRedisTemplate redisTemplate, PipelineProperties properties) {
        log.info("Using Redis signature store (retention={})", properties.getDedup().getRetention());
        return new RedisSignatureStore(redisTemplate, properties.getDedup().getRetention());
    }
}
