package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.config.PipelineProperties;
import com.supplychain.pipeline.domain.DuplicateReason;
import com.supplychain.pipeline.domain.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DuplicateDetector over the in-memory store.
 */
class DuplicateDetectorTest {

    private PipelineProperties properties;
    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        detector = new DuplicateDetector(new InMemorySignatureStore(Duration.ofSeconds(1)), properties);
    }

    private static RawEvent canalBlocked() {
        return RawEvent.builder()
                .title("Container ship blocks Suez Canal")
                .description("A grounded vessel has halted all traffic through the canal since dawn.")
                .location("Suez Canal")
                .severity(0.9)
                .build();
    }

    @Test
    void secondIdenticalEventIsExactDuplicate() {
        assertThat(detector.check(canalBlocked()).isDuplicate()).isFalse();

        DuplicateCheck second = detector.check(canalBlocked());

        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.getReason()).isEqualTo(DuplicateReason.EXACT);
    }

    @Test
    void nearDuplicateIsCaughtByFuzzySignature() {
        detector.check(canalBlocked());

        DuplicateCheck reworded = detector.check(RawEvent.builder()
                .title("Suez Canal blocks: container ship")
                .description("Traffic halted through the canal since dawn: grounded vessel")
                .location("Egypt")
                .severity(0.9)
                .build());

        assertThat(reworded.getReason()).isEqualTo(DuplicateReason.FUZZY);
    }

    @Test
    void releaseAllowsRedelivery() {
        DuplicateCheck first = detector.check(canalBlocked());

        detector.release(first.getSignatures());

        assertThat(detector.check(canalBlocked()).getReason()).isEqualTo(DuplicateReason.NONE);
    }

    @Test
    void purgeExpiredUsesRetentionWindow() {
        properties.getDedup().setRetention(Duration.ofMinutes(5));
        detector.check(canalBlocked());

        assertThat(detector.purgeExpired(Instant.now())).isZero();
        assertThat(detector.purgeExpired(Instant.now().plus(Duration.ofMinutes(10)))).isEqualTo(3);
        assertThat(detector.check(canalBlocked()).isDuplicate()).isFalse();
    }

    @Test
    void concurrentIdenticalEventsAreAcceptedExactlyOnce() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DuplicateCheck>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return detector.check(canalBlocked());
            }));
        }
        start.countDown();

        int accepted = 0;
        for (Future<DuplicateCheck> future : futures) {
            if (!future.get(5, TimeUnit.SECONDS).isDuplicate()) {
                accepted++;
            }
        }
        pool.shutdown();

        assertThat(accepted).isEqualTo(1);
    }

    @Test
    void eventsWithOnlyShortWordsAreNotFuzzyDuplicatesOfEachOther() {
        RawEvent fog = RawEvent.builder().title("Fog at sea").description("No ops, so we sit").severity(0.2).build();
        RawEvent ice = RawEvent.builder().title("Ice jam on bay").description("Icy, no go for now").severity(0.3).build();

        assertThat(detector.check(fog).getReason()).isEqualTo(DuplicateReason.NONE);
        assertThat(detector.check(ice).getReason()).isEqualTo(DuplicateReason.NONE);
        assertThat(detector.check(fog).getReason()).isEqualTo(DuplicateReason.EXACT);
    }
}
