package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.DuplicateReason;

import java.time.Instant;

/**
 * Remembers signatures of accepted events for the retention window.
 */
public interface SignatureStore {

    /**
     * Atomically checks exact, content and fuzzy signatures in that order. On a miss all
     * three are recorded with {@code seenAt}; on a hit nothing is recorded.
     *
     * @return the first matching kind, or {@link DuplicateReason#NONE} when the event is new
     */
    DuplicateReason checkAndInsert(EventSignatures signatures, Instant seenAt);

    /**
     * Forgets an event's signatures so a re-delivery is treated as new.
     */
    void release(EventSignatures signatures);

    /**
     * Drops signatures recorded before {@code cutoff}.
     *
     * @return number of signatures removed, or -1 when the purge was skipped
     */
    int purgeOlderThan(Instant cutoff);
}
