package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.config.PipelineProperties;
import com.supplychain.pipeline.domain.DuplicateReason;
import com.supplychain.pipeline.domain.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Suppresses events already accepted within the retention window. The first caller
 * for a given event wins; every later identical or near-identical event is reported
 * with the kind of signature that matched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateDetector {

    private final SignatureStore store;
    private final PipelineProperties properties;

    public DuplicateCheck check(RawEvent event) {
        EventSignatures signatures = EventSignatures.of(event, properties.getDedup().getFuzzyTokenCount());
        DuplicateReason reason = store.checkAndInsert(signatures, Instant.now());
        if (reason.isDuplicate()) {
            log.debug("Duplicate event: reason={}, title='{}'", reason, event.getTitle());
        }
        return new DuplicateCheck(reason, signatures);
    }

    /**
     * Forgets a previously accepted event so its next delivery is processed again.
     */
    public void release(EventSignatures signatures) {
        store.release(signatures);
    }

    public int purgeExpired(Instant now) {
        return store.purgeOlderThan(now.minus(properties.getDedup().getRetention()));
    }
}
