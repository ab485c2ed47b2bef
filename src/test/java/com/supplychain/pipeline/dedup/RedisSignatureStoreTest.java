package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.DuplicateReason;
import com.supplychain.pipeline.domain.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RedisSignatureStore with a mocked template.
 */
@ExtendWith(MockitoExtension.class)
class RedisSignatureStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    private RedisSignatureStore store;
    private EventSignatures signatures;

    @BeforeEach
    void setUp() {
        store = new RedisSignatureStore(redisTemplate, Duration.ofHours(24));
        signatures = EventSignatures.of(RawEvent.builder()
                .title("Cyber attack halts Maersk booking systems")
                .description("Bookings unavailable across terminals for the second day")
                .severity(0.7)
                .build(), 10);
    }

    @Test
    void keysArePrefixedPerSignatureKind() {
        List<String> keys = RedisSignatureStore.keys(signatures);

        assertThat(keys).containsExactly(
                "dedup:exact:" + signatures.getExact(),
                "dedup:content:" + signatures.getContent(),
                "dedup:fuzzy:" + signatures.getFuzzy());
    }

    @Test
    void fuzzyKeyIsLeftOutWhenEventHasNoSignificantTokens() {
        EventSignatures shortText = EventSignatures.of(RawEvent.builder()
                .title("Fog at sea").description("No ops, so we sit").severity(0.2).build(), 10);

        assertThat(RedisSignatureStore.keys(shortText)).containsExactly(
                "dedup:exact:" + shortText.getExact(),
                "dedup:content:" + shortText.getContent());
    }

    @Test
    void scriptResultMapsToDuplicateReason() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any()))
                .thenReturn(0L, 1L, 2L, 3L);
        Instant now = Instant.now();

        assertThat(store.checkAndInsert(signatures, now)).isEqualTo(DuplicateReason.NONE);
        assertThat(store.checkAndInsert(signatures, now)).isEqualTo(DuplicateReason.EXACT);
        assertThat(store.checkAndInsert(signatures, now)).isEqualTo(DuplicateReason.CONTENT);
        assertThat(store.checkAndInsert(signatures, now)).isEqualTo(DuplicateReason.FUZZY);
    }

    @Test
    void checkPassesKeysAndRetentionToScript() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any())).thenReturn(0L);

        store.checkAndInsert(signatures, now);

        verify(redisTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(),
                eq(RedisSignatureStore.keys(signatures)), eq(now.toString()), eq("86400000"));
    }

    @Test
    void missingScriptResultIsAnError() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), any(), any())).thenReturn(null);

        assertThatThrownBy(() -> store.checkAndInsert(signatures, Instant.now()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void releaseDeletesAllThreeKeys() {
        store.release(signatures);

        verify(redisTemplate).delete(RedisSignatureStore.keys(signatures));
    }

    @Test
    void purgeIsANoOpBecauseKeysExpire() {
        assertThat(store.purgeOlderThan(Instant.now())).isZero();
    }
}
