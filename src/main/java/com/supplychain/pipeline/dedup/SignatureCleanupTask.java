package com.supplychain.pipeline.dedup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Periodically drops signatures older than the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignatureCleanupTask {

    private final DuplicateDetector duplicateDetector;

    @Scheduled(fixedDelayString = "${supplychain.pipeline.dedup.cleanup-interval:PT10M}",
            initialDelayString = "${supplychain.pipeline.dedup.cleanup-interval:PT10M}")
    public void purgeExpiredSignatures() {
        try {
            int removed = duplicateDetector.purgeExpired(Instant.now());
            if (removed > 0) {
                log.info("Signature cleanup removed {} expired signatures", removed);
            } else if (removed < 0) {
                log.info("Signature cleanup skipped this cycle: store busy");
            }
        } catch (Exception e) {
            log.warn("Signature cleanup failed", e);
        }
    }
}
