package com.supplychain.pipeline.messaging;

import com.supplychain.pipeline.config.PipelineProperties;
import com.supplychain.pipeline.domain.RiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes scored events for downstream alerting. Sends are synchronous so a broker
 * failure surfaces to the caller and can be retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskCalculatedProducer {

    private final KafkaTemplate<String, RiskCalculatedMessage> riskCalculatedKafkaTemplate;
    private final PipelineProperties properties;

    @Value("${supplychain.kafka.topic.risk-calculated:risk-calculated}")
    private String topic;

    public void publish(String eventId, List<RiskAssessment> assessments) {
        RiskCalculatedMessage message = RiskCalculatedMessage.builder()
                .eventId(eventId)
                .assessments(assessments)
                .timestamp(Instant.now())
                .build();
        long timeoutMs = properties.getSink().getPublishTimeout().toMillis();
        try {
            SendResult<String, RiskCalculatedMessage> result = riskCalculatedKafkaTemplate
                    .send(topic, eventId, message)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published {} assessments for event {} partition={}", assessments.size(), eventId,
                    result != null && result.getRecordMetadata() != null ? result.getRecordMetadata().partition() : null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing event " + eventId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to publish event " + eventId + " to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out after " + timeoutMs + "ms publishing event " + eventId, e);
        }
    }
}
