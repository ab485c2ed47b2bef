package com.supplychain.pipeline.messaging;

import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.pipeline.EventPipeline;
import com.supplychain.pipeline.pipeline.PipelineOutcome;
import com.supplychain.pipeline.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Feeds raw events from collectors into the pipeline. Only a sink failure reaches the
 * listener container, as an {@link EventRedeliveryException}, so the record is
 * delivered again; every other outcome is logged and the record is acknowledged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "supplychain.kafka.consumer.enabled", havingValue = "true", matchIfMissing = true)
public class RawEventConsumer {

    private final EventPipeline pipeline;

    @KafkaListener(
            topics = "${supplychain.kafka.topic.raw-events:raw-events}",
            groupId = "${supplychain.kafka.consumer-group:supply-chain-risk-pipeline}",
            containerFactory = "rawEventListenerContainerFactory"
    )
    public void onRawEvent(
            @Payload(required = false) RawEvent event,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (event == null) {
            log.warn("Received null raw event (deserialization failed). key={}, partition={}, offset={}", key, partition, offset);
            return;
        }
        PipelineOutcome outcome;
        try {
            outcome = pipeline.process(event);
        } catch (Exception e) {
            log.error("Error processing raw event key={}, partition={}, offset={}, title='{}'",
                    key, partition, offset, event.getTitle(), e);
            return;
        }
        log.debug("Raw event key={} offset={} finished at stage={}", key, offset, outcome.getStage());
        if (outcome.getStage() == PipelineStage.SINK_FAILED) {
            throw new EventRedeliveryException(outcome.getEventId(), outcome.getDetail());
        }
    }
}
