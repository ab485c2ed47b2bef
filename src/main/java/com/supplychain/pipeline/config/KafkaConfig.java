package com.supplychain.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.messaging.RiskCalculatedMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Consumer for raw-events ({@link RawEvent}) and producer for risk-calculated
 * ({@link RiskCalculatedMessage}). Both sides use the snake_case mapper from {@link JsonConfig}.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${supplychain.kafka.consumer-group:supply-chain-risk-pipeline}")
    private String consumerGroup;

    @Bean
    public ConsumerFactory<String, RawEvent> rawEventConsumerFactory(
            @Qualifier("pipelineObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        JsonDeserializer<RawEvent> deserializer = new JsonDeserializer<>(RawEvent.class, objectMapper);
        deserializer.setUseTypeHeaders(false);
        deserializer.addTrustedPackages("com.supplychain.pipeline");
        ErrorHandlingDeserializer<RawEvent> errorHandlingDeserializer = new ErrorHandlingDeserializer<>(deserializer);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), errorHandlingDeserializer);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, RawEvent> rawEventListenerContainerFactory(
            ConsumerFactory<String, RawEvent> rawEventConsumerFactory,
            PipelineProperties pipelineProperties) {
        ConcurrentKafkaListenerContainerFactory<String, RawEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(rawEventConsumerFactory);
        factory.setConcurrency(pipelineProperties.getWorkers());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.setCommonErrorHandler(new DefaultErrorHandler(
                (record, e) -> log.error("[OPS-ALERT] Giving up on raw event key={}, partition={}, offset={} after redeliveries: {}",
                        record.key(), record.partition(), record.offset(), e.getMessage()),
                redeliveryBackOff(pipelineProperties.getSink())) {
            @Override
            public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                    MessageListenerContainer container, boolean batchListener) {
                Throwable cause = thrownException.getCause() != null ? thrownException.getCause() : thrownException;
                log.error("Kafka listener error on raw-events: {} - {}",
                        cause.getClass().getSimpleName(), cause.getMessage(), thrownException);
                super.handleOtherException(thrownException, consumer, container, batchListener);
            }
        });
        log.info("Raw event listener concurrency={}", pipelineProperties.getWorkers());
        return factory;
    }

    static FixedBackOff redeliveryBackOff(PipelineProperties.Sink sink) {
        return new FixedBackOff(sink.getRedeliveryInterval().toMillis(), sink.getRedeliveryAttempts());
    }

    @Bean
    public ProducerFactory<String, RiskCalculatedMessage> riskCalculatedProducerFactory(
            @Qualifier("pipelineObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        JsonSerializer<RiskCalculatedMessage> serializer = new JsonSerializer<>(objectMapper);
        serializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, RiskCalculatedMessage> riskCalculatedKafkaTemplate(
            ProducerFactory<String, RiskCalculatedMessage> riskCalculatedProducerFactory) {
        return new KafkaTemplate<>(riskCalculatedProducerFactory);
    }
}
