package com.supplychain.pipeline.config;

import org.junit.jupiter.api.Test;
import org.springframework.util.backoff.FixedBackOff;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaConfigTest {

    @Test
    void sinkFailuresAreRedeliveredWithConfiguredBackOff() {
        PipelineProperties.Sink sink = new PipelineProperties.Sink();
        sink.setRedeliveryInterval(Duration.ofSeconds(15));
        sink.setRedeliveryAttempts(3);

        FixedBackOff backOff = KafkaConfig.redeliveryBackOff(sink);

        assertThat(backOff.getInterval()).isEqualTo(15_000L);
        assertThat(backOff.getMaxAttempts()).isEqualTo(3L);
    }

    @Test
    void defaultsRetryBeforeSkipping() {
        FixedBackOff backOff = KafkaConfig.redeliveryBackOff(new PipelineProperties.Sink());

        assertThat(backOff.getInterval()).isEqualTo(30_000L);
        assertThat(backOff.getMaxAttempts()).isEqualTo(5L);
    }
}
