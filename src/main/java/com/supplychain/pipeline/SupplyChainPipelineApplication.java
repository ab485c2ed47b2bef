package com.supplychain.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Supply-chain risk pipeline. Enables:
 * <ul>
 *   <li>Raw event intake from Kafka or direct submission</li>
 *   <li>Validation, duplicate suppression (memory or Redis) and normalization</li>
 *   <li>Region x sector risk scoring with retried PostgreSQL, Redis and Kafka sinks</li>
 * </ul>
 */
@SpringBootApplication
public class SupplyChainPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupplyChainPipelineApplication.class, args);
    }
}
