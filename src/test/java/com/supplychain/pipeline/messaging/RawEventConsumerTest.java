package com.supplychain.pipeline.messaging;

import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.pipeline.EventPipeline;
import com.supplychain.pipeline.pipeline.PipelineOutcome;
import com.supplychain.pipeline.pipeline.PipelineStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RawEventConsumerTest {

    @Mock
    private EventPipeline pipeline;

    @InjectMocks
    private RawEventConsumer consumer;

    private static RawEvent flood() {
        return RawEvent.builder()
                .title("Flooding closes highways near Bangkok")
                .description("Heavy monsoon rain has closed major highways around Bangkok for two days.")
                .location("Bangkok")
                .severity(0.6)
                .eventType("weather")
                .build();
    }

    @Test
    void passesEventToPipeline() {
        RawEvent event = flood();
        when(pipeline.process(event)).thenReturn(PipelineOutcome.builder().stage(PipelineStage.PROCESSED).build());

        consumer.onRawEvent(event, "k1", 0, 42L);

        verify(pipeline).process(event);
    }

    @Test
    void undeserializablePayloadIsSkipped() {
        consumer.onRawEvent(null, "k1", 0, 43L);

        verifyNoInteractions(pipeline);
    }

    @Test
    void sinkFailureIsThrownBackForRedelivery() {
        when(pipeline.process(any())).thenReturn(PipelineOutcome.builder()
                .stage(PipelineStage.SINK_FAILED)
                .eventId("evt-7")
                .detail("Sink 'publish' failed for event evt-7: broker unavailable")
                .build());

        assertThatThrownBy(() -> consumer.onRawEvent(flood(), "k1", 1, 45L))
                .isInstanceOf(EventRedeliveryException.class)
                .hasMessageContaining("evt-7")
                .hasMessageContaining("broker unavailable");
    }

    @Test
    void rejectedAndDuplicateOutcomesAreAcknowledged() {
        when(pipeline.process(any()))
                .thenReturn(PipelineOutcome.builder().stage(PipelineStage.REJECTED).build())
                .thenReturn(PipelineOutcome.builder().stage(PipelineStage.DISCARDED).build());

        assertThatCode(() -> consumer.onRawEvent(flood(), "k1", 1, 46L)).doesNotThrowAnyException();
        assertThatCode(() -> consumer.onRawEvent(flood(), "k1", 1, 47L)).doesNotThrowAnyException();
    }

    @Test
    void scoringFailureDoesNotReachContainer() {
        when(pipeline.process(any())).thenThrow(new IllegalStateException("scoring exploded"));

        assertThatCode(() -> consumer.onRawEvent(flood(), "k1", 1, 44L)).doesNotThrowAnyException();
    }
}
