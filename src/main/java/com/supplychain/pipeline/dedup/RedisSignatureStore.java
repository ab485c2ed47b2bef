package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.DuplicateReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Shared store for multi-instance deployments. One Lua script checks and records all
 * three signatures, so two instances cannot both accept the same event. Retention is
 * the key TTL, so there is nothing to purge.
 */
@Slf4j
public class RedisSignatureStore implements SignatureStore {

    static final String KEY_PREFIX = "dedup:";

    private static final RedisScript<Long> CHECK_AND_INSERT = RedisScript.of(
            "for i = 1, #KEYS do " +
            "  if redis.call('exists', KEYS[i]) == 1 then return i end " +
            "end " +
            "for i = 1, #KEYS do " +
            "  redis.call('set', KEYS[i], ARGV[1], 'PX', ARGV[2]) " +
            "end " +
            "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration retention;

    public RedisSignatureStore(StringRedisTemplate redisTemplate, Duration retention) {
        this.redisTemplate = redisTemplate;
        this.retention = retention;
    }

    @Override
    public DuplicateReason checkAndInsert(EventSignatures signatures, Instant seenAt) {
        Long result = redisTemplate.execute(CHECK_AND_INSERT, keys(signatures),
                seenAt.toString(), String.valueOf(retention.toMillis()));
        if (result == null) {
            throw new IllegalStateException("Signature check returned no result");
        }
        switch (result.intValue()) {
            case 0:
                return DuplicateReason.NONE;
            case 1:
                return DuplicateReason.EXACT;
            case 2:
                return DuplicateReason.CONTENT;
            case 3:
                return DuplicateReason.FUZZY;
            default:
                throw new IllegalStateException("Unexpected signature check result: " + result);
        }
    }

    @Override
    public void release(EventSignatures signatures) {
        Long removed = redisTemplate.delete(keys(signatures));
        log.debug("Released {} signatures", removed);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        return 0;
    }

    /**
     * Exact, content and (when present) fuzzy keys, in check order.
     */
    static List<String> keys(EventSignatures signatures) {
        String exact = KEY_PREFIX + "exact:" + signatures.getExact();
        String content = KEY_PREFIX + "content:" + signatures.getContent();
        if (!signatures.hasFuzzy()) {
            return List.of(exact, content);
        }
        return List.of(exact, content, KEY_PREFIX + "fuzzy:" + signatures.getFuzzy());
    }
}
