package com.supplychain.pipeline.pipeline;

import com.supplychain.pipeline.dedup.DuplicateCheck;
import com.supplychain.pipeline.dedup.DuplicateDetector;
import com.supplychain.pipeline.domain.NormalizedEvent;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RawEvent;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.ValidationResult;
import com.supplychain.pipeline.normalize.EventNormalizer;
import com.supplychain.pipeline.risk.engine.RiskEngine;
import com.supplychain.pipeline.risk.engine.ScoringReport;
import com.supplychain.pipeline.sink.AssessmentSinkWriter;
import com.supplychain.pipeline.sink.SinkFailureException;
import com.supplychain.pipeline.validation.EventValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a raw event through validate, dedupe, normalize, score and the sinks. Each
 * accepted event is marked processed at most once; an event whose sinks fail is left
 * unprocessed and its signatures are released so a redelivery is accepted.
 */
@Slf4j
@Service
public class EventPipeline {

    private final EventValidator validator;
    private final DuplicateDetector duplicateDetector;
    private final EventNormalizer normalizer;
    private final RiskEngine riskEngine;
    private final AssessmentSinkWriter sinkWriter;
    private final PipelineMetrics metrics;
    private final Executor executor;

    public EventPipeline(EventValidator validator,
                         DuplicateDetector duplicateDetector,
                         EventNormalizer normalizer,
                         RiskEngine riskEngine,
                         AssessmentSinkWriter sinkWriter,
                         PipelineMetrics metrics,
                         @Qualifier("pipelineExecutor") Executor executor) {
        this.validator = validator;
        this.duplicateDetector = duplicateDetector;
        this.normalizer = normalizer;
        this.riskEngine = riskEngine;
        this.sinkWriter = sinkWriter;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Runs {@link #process} on the pipeline worker pool. A full queue completes the
     * future exceptionally with {@link RejectedExecutionException}.
     */
    public CompletableFuture<PipelineOutcome> submit(RawEvent raw) {
        try {
            return CompletableFuture.supplyAsync(() -> process(raw), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Pipeline queue full, event not accepted: title='{}'", raw.getTitle());
            return CompletableFuture.failedFuture(e);
        }
    }

    public PipelineOutcome process(RawEvent raw) {
        metrics.recordReceived();

        ValidationResult validation = validator.validate(raw);
        if (!validation.isValid()) {
            metrics.recordRejected();
            log.warn("Rejected event title='{}', source={}: quality={}, errors={}",
                    raw.getTitle(), raw.getSource(), validation.getQualityScore(), validation.getErrors());
            return PipelineOutcome.rejected(validation.getErrors(), validation.getQualityScore());
        }

        DuplicateCheck duplicate = duplicateDetector.check(raw);
        if (duplicate.isDuplicate()) {
            metrics.recordDuplicate(duplicate.getReason());
            log.info("Discarded duplicate event title='{}', reason={}", raw.getTitle(), duplicate.getReason());
            return PipelineOutcome.duplicate(duplicate.getReason(), validation.getQualityScore());
        }

        ProcessedEvent event;
        ScoringReport report;
        try {
            NormalizedEvent normalized = normalizer.normalize(raw);
            if (!normalized.getWarnings().isEmpty()) {
                metrics.recordNormalizationWarnings(normalized.getWarnings().size());
                log.debug("Normalization warnings for title='{}': {}", raw.getTitle(), normalized.getWarnings());
            }
            event = ProcessedEvent.from(normalized, validation.getQualityScore(), Instant.now());
            report = riskEngine.scoreEvent(event);
        } catch (RuntimeException e) {
            duplicateDetector.release(duplicate.getSignatures());
            throw e;
        }
        metrics.recordScoring(report.getAssessments().size(), report.getFailedPairs());
        if (report.hasFailures()) {
            log.warn("Event {} scored with {}/{} failed pairs", event.getId(), report.getFailedPairs(), report.getAttemptedPairs());
        }

        List<RiskAssessment> assessments = report.getAssessments();
        boolean stored;
        try {
            sinkWriter.write(event, assessments);
            stored = sinkWriter.markProcessed(event.getId());
        } catch (SinkFailureException e) {
            metrics.recordSinkFailure();
            duplicateDetector.release(duplicate.getSignatures());
            log.error("[OPS-ALERT] Sink '{}' exhausted retries for event {} ('{}'); left unprocessed, signatures released",
                    e.getSink(), event.getId(), event.getTitle(), e);
            return PipelineOutcome.sinkFailed(event.getId(), event.getQualityScore(), e.getMessage());
        }

        if (!stored || !event.markProcessed()) {
            metrics.recordAlreadyProcessed();
            log.warn("Event {} was already marked processed by another worker", event.getId());
            return PipelineOutcome.alreadyProcessed(event.getId(), event.getQualityScore());
        }

        metrics.recordProcessed();
        log.info("Processed event {} title='{}', region={}, assessments={}, topRisk={}",
                event.getId(), event.getTitle(), event.primaryRegion(), assessments.size(),
                assessments.isEmpty() ? 0.0 : assessments.get(0).getRiskLevel());
        return PipelineOutcome.processed(event.getId(), event.getQualityScore(), assessments);
    }
}
