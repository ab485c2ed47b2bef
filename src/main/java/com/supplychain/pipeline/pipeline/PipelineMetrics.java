package com.supplychain.pipeline.pipeline;

import com.supplychain.pipeline.domain.DuplicateReason;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process pipeline counters. Safe for concurrent workers.
 */
@Component
public class PipelineMetrics {

    private final LongAdder received = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder processed = new LongAdder();
    private final LongAdder alreadyProcessed = new LongAdder();
    private final LongAdder sinkFailures = new LongAdder();
    private final LongAdder scoringFailures = new LongAdder();
    private final LongAdder normalizationWarnings = new LongAdder();
    private final LongAdder assessmentsProduced = new LongAdder();
    private final Map<DuplicateReason, LongAdder> duplicates = new EnumMap<>(DuplicateReason.class);

    public PipelineMetrics() {
        for (DuplicateReason reason : DuplicateReason.values()) {
            if (reason.isDuplicate()) {
                duplicates.put(reason, new LongAdder());
            }
        }
    }

    public void recordReceived() {
        received.increment();
    }

    public void recordRejected() {
        rejected.increment();
    }

    public void recordDuplicate(DuplicateReason reason) {
        LongAdder counter = duplicates.get(reason);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordNormalizationWarnings(int count) {
        normalizationWarnings.add(count);
    }

    public void recordScoring(int assessments, int failedPairs) {
        assessmentsProduced.add(assessments);
        scoringFailures.add(failedPairs);
    }

    public void recordSinkFailure() {
        sinkFailures.increment();
    }

    public void recordAlreadyProcessed() {
        alreadyProcessed.increment();
    }

    public void recordProcessed() {
        processed.increment();
    }

    public Snapshot snapshot() {
        Map<DuplicateReason, Long> dupes = new EnumMap<>(DuplicateReason.class);
        duplicates.forEach((reason, counter) -> dupes.put(reason, counter.sum()));
        return new Snapshot(received.sum(), rejected.sum(), Collections.unmodifiableMap(dupes),
                processed.sum(), alreadyProcessed.sum(), sinkFailures.sum(), scoringFailures.sum(),
                normalizationWarnings.sum(), assessmentsProduced.sum());
    }

    @Value
    public static class Snapshot {
        long received;
        long rejected;
        Map<DuplicateReason, Long> duplicates;
        long processed;
        long alreadyProcessed;
        long sinkFailures;
        long scoringFailures;
        long normalizationWarnings;
        long assessmentsProduced;

        public long totalDuplicates() {
            return duplicates.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
