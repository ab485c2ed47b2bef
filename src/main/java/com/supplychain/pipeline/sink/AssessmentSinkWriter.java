package com.supplychain.pipeline.sink;

import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.messaging.RiskCalculatedProducer;
import com.supplychain.pipeline.persistence.service.AssessmentPersistenceService;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes a scored event to the store, the cache and the risk-calculated topic, in
 * that order. Each write is retried on its own; the first one that exhausts its
 * retries aborts the rest with a {@link SinkFailureException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssessmentSinkWriter {

    static final String RETRY_INSTANCE = "assessment-sink";

    private final AssessmentPersistenceService persistenceService;
    private final RiskAssessmentCache cache;
    private final RiskCalculatedProducer producer;
    private final RetryRegistry retryRegistry;

    public void write(ProcessedEvent event, List<RiskAssessment> assessments) {
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        String eventId = event.getId();
        run(retry, "store", eventId, () -> persistenceService.persist(event, assessments));
        run(retry, "cache", eventId, () -> assessments.forEach(cache::put));
        run(retry, "publish", eventId, () -> producer.publish(eventId, assessments));
        log.debug("Sinks written for event {}: {} assessments", eventId, assessments.size());
    }

    /**
     * Flips the stored processed flag with the same retry policy.
     *
     * @return false when another run already marked the event
     */
    public boolean markProcessed(String eventId) {
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        try {
            return Retry.decorateSupplier(retry, () -> persistenceService.markProcessed(eventId)).get();
        } catch (RuntimeException e) {
            throw new SinkFailureException("store", eventId, e);
        }
    }

    private void run(Retry retry, String sink, String eventId, Runnable write) {
        try {
            Retry.decorateRunnable(retry, () -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Sink '{}' write failed for event {}: {}", sink, eventId, e.getMessage());
                    throw e;
                }
            }).run();
        } catch (RuntimeException e) {
            throw new SinkFailureException(sink, eventId, e);
        }
    }
}
