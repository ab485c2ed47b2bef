package com.supplychain.pipeline.config;

import com.supplychain.pipeline.persistence.service.AssessmentPersistenceService;
import com.supplychain.pipeline.pipeline.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class SchedulingConfig {

    private final PipelineMetrics metrics;
    private final AssessmentPersistenceService persistenceService;

    /**
     * Periodic one-line summary of pipeline counters.
     */
    @Scheduled(fixedDelayString = "${supplychain.pipeline.metrics-log-interval:PT5M}",
            initialDelayString = "${supplychain.pipeline.metrics-log-interval:PT5M}")
    public void logPipelineMetrics() {
        try {
            log.info("Pipeline metrics: {}", metrics.snapshot());
        } catch (Exception e) {
            log.warn("Pipeline metrics summary failed", e);
        }
    }

    /**
     * Warns about stored events left unprocessed by a sink failure. A redelivered record
     * is stored under a new event id, so the count only grows with failed attempts.
     */
    @Scheduled(fixedDelayString = "${supplychain.pipeline.metrics-log-interval:PT5M}",
            initialDelayString = "${supplychain.pipeline.metrics-log-interval:PT5M}")
    public void reportUnprocessedBacklog() {
        try {
            long unprocessed = persistenceService.countUnprocessed();
            if (unprocessed > 0) {
                log.warn("{} stored events are still unprocessed", unprocessed);
            }
        } catch (Exception e) {
            log.warn("Unprocessed backlog check failed", e);
        }
    }
}
