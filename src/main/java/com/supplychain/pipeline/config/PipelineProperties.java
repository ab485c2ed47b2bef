package com.supplychain.pipeline.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "supplychain.pipeline")
@Data
@Validated
public class PipelineProperties {

    /** Concurrent Kafka consumers and core size of the pipeline executor. */
    @Min(1)
    private int workers = 4;

    @Min(0)
    private int queueCapacity = 500;

    private Duration metricsLogInterval = Duration.ofMinutes(5);

    private Validation validation = new Validation();
    private Dedup dedup = new Dedup();
    private Sink sink = new Sink();

    @Data
    public static class Validation {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minimumQualityScore = 0.3;

        @Min(1)
        private int titleMinLength = 10;

        @Min(1)
        private int titleMaxLength = 200;

        @Min(1)
        private int descriptionMinLength = 20;

        @Min(1)
        private int descriptionMaxLength = 2000;
    }

    @Data
    public static class Dedup {
        @NotNull
        private StoreType store = StoreType.MEMORY;

        @NotNull
        private Duration retention = Duration.ofHours(24);

        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(10);

        @NotNull
        private Duration cleanupLockTimeout = Duration.ofSeconds(2);

        @Min(1)
        private int fuzzyTokenCount = 10;
    }

    @Data
    public static class Sink {
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(30);

        @NotNull
        private Duration publishTimeout = Duration.ofSeconds(10);

        /** Pause before a record whose sinks failed is delivered again. */
        @NotNull
        private Duration redeliveryInterval = Duration.ofSeconds(30);

        /** Redeliveries after the first failed attempt; the record is then skipped. */
        @Min(0)
        private long redeliveryAttempts = 5;
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }
}
