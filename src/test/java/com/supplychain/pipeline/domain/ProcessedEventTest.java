package com.supplychain.pipeline.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProcessedEventTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static NormalizedEvent.NormalizedEventBuilder normalized() {
        return NormalizedEvent.builder()
                .title("Refinery fire in Rotterdam")
                .description("A fire at a major refinery has cut output")
                .source("news")
                .location(StandardizedLocation.builder()
                        .standardName("Rotterdam").country("Netherlands").region("Europe")
                        .coordinates(new Coordinates(51.9244, 4.4777)).resolved(true).build())
                .impactSectors(List.of("energy", "chemicals"))
                .eventType(EventType.NEWS)
                .severity(0.6)
                .severityExplicit(true)
                .sectorsExplicit(true)
                .timestamp(NOW)
                .warnings(Set.of());
    }

    @Test
    void fromCopiesNormalizedFieldsAndAssignsId() {
        ProcessedEvent event = ProcessedEvent.from(normalized().build(), 0.85, NOW);

        assertThat(event.getId()).isNotBlank();
        assertThat(event.getTitle()).isEqualTo("Refinery fire in Rotterdam");
        assertThat(event.getImpactSectors()).containsExactly("energy", "chemicals");
        assertThat(event.getQualityScore()).isEqualTo(0.85);
        assertThat(event.getDataQualityScore()).isEqualTo(1.0);
        assertThat(event.getProcessedAt()).isEqualTo(NOW);
        assertThat(event.isProcessed()).isFalse();
        assertThat(ProcessedEvent.from(normalized().build(), 0.85, NOW).getId()).isNotEqualTo(event.getId());
    }

    @Test
    void dataQualityDropsPerWarning() {
        ProcessedEvent event = ProcessedEvent.from(normalized()
                .warnings(Set.of(NormalizationWarning.TIMESTAMP_FALLBACK, NormalizationWarning.SECTOR_UNRESOLVED))
                .build(), 0.7, NOW);

        assertThat(event.getDataQualityScore()).isCloseTo(0.6, within(1e-9));
        assertThat(event.getWarnings()).hasSize(2);
    }

    @Test
    void primaryRegionPrefersCountryThenName() {
        assertThat(ProcessedEvent.from(normalized().build(), 1.0, NOW).primaryRegion()).isEqualTo("Netherlands");

        StandardizedLocation unresolved = StandardizedLocation.builder()
                .standardName("Smallville").country("").region("").coordinates(Coordinates.UNKNOWN).build();
        assertThat(ProcessedEvent.from(normalized().location(unresolved).build(), 1.0, NOW).primaryRegion())
                .isEqualTo("Smallville");

        assertThat(ProcessedEvent.builder().id("x").build().primaryRegion()).isEqualTo("Global");
    }

    @Test
    void markProcessedSucceedsOnlyOnceAcrossThreads() throws Exception {
        ProcessedEvent event = ProcessedEvent.from(normalized().build(), 1.0, NOW);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return event.markProcessed();
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        assertThat(winners).isEqualTo(1);
        assertThat(event.isProcessed()).isTrue();
    }
}
