package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.DuplicateReason;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-instance store. Check-and-insert holds one lock; purges only wait
 * {@code lockTimeout} for it and skip the cycle otherwise.
 */
@Slf4j
public class InMemorySignatureStore implements SignatureStore {

    private final Map<String, Instant> exact = new HashMap<>();
    private final Map<String, Instant> content = new HashMap<>();
    private final Map<String, Instant> fuzzy = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration lockTimeout;

    public InMemorySignatureStore(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    @Override
    public DuplicateReason checkAndInsert(EventSignatures signatures, Instant seenAt) {
        lock.lock();
        try {
            if (exact.containsKey(signatures.getExact())) {
                return DuplicateReason.EXACT;
            }
            if (content.containsKey(signatures.getContent())) {
                return DuplicateReason.CONTENT;
            }
            if (signatures.hasFuzzy() && fuzzy.containsKey(signatures.getFuzzy())) {
                return DuplicateReason.FUZZY;
            }
            exact.put(signatures.getExact(), seenAt);
            content.put(signatures.getContent(), seenAt);
            if (signatures.hasFuzzy()) {
                fuzzy.put(signatures.getFuzzy(), seenAt);
            }
            return DuplicateReason.NONE;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(EventSignatures signatures) {
        lock.lock();
        try {
            exact.remove(signatures.getExact());
            content.remove(signatures.getContent());
            if (signatures.hasFuzzy()) {
                fuzzy.remove(signatures.getFuzzy());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Signature purge interrupted while waiting for the store lock");
            return -1;
        }
        if (!acquired) {
            log.debug("Signature purge skipped: store busy for more than {}", lockTimeout);
            return -1;
        }
        try {
            int removed = purge(exact, cutoff) + purge(content, cutoff) + purge(fuzzy, cutoff);
            log.debug("Purged {} signatures older than {}", removed, cutoff);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return exact.size() + content.size() + fuzzy.size();
        } finally {
            lock.unlock();
        }
    }

    private static int purge(Map<String, Instant> signatures, Instant cutoff) {
        int before = signatures.size();
        signatures.values().removeIf(seenAt -> seenAt.isBefore(cutoff));
        return before - signatures.size();
    }
}
