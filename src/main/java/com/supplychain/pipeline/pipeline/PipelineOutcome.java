package com.supplychain.pipeline.pipeline;

import com.supplychain.pipeline.domain.DuplicateReason;
import com.supplychain.pipeline.domain.RiskAssessment;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Terminal result of running one raw event through the pipeline.
 */
@Value
@Builder
public class PipelineOutcome {

    PipelineStage stage;
    /** Null unless the event got past deduplication. */
    String eventId;
    @Builder.Default
    DuplicateReason duplicateReason = DuplicateReason.NONE;
    double qualityScore;
    @Builder.Default
    List<String> errors = List.of();
    @Builder.Default
    List<RiskAssessment> assessments = List.of();
    String detail;

    public boolean isProcessed() {
        return stage == PipelineStage.PROCESSED;
    }

    static PipelineOutcome rejected(List<String> errors, double qualityScore) {
        return PipelineOutcome.builder()
                .stage(PipelineStage.REJECTED)
                .errors(List.copyOf(errors))
                .qualityScore(qualityScore)
                .detail("validation failed")
                .build();
    }

    static PipelineOutcome duplicate(DuplicateReason reason, double qualityScore) {
        return PipelineOutcome.builder()
                .stage(PipelineStage.DISCARDED)
                .duplicateReason(reason)
                .qualityScore(qualityScore)
                .detail(reason.name().toLowerCase() + " duplicate")
                .build();
    }

    static PipelineOutcome alreadyProcessed(String eventId, double qualityScore) {
        return PipelineOutcome.builder()
                .stage(PipelineStage.DISCARDED)
                .eventId(eventId)
                .qualityScore(qualityScore)
                .detail("already processed")
                .build();
    }

    static PipelineOutcome sinkFailed(String eventId, double qualityScore, String message) {
        return PipelineOutcome.builder()
                .stage(PipelineStage.SINK_FAILED)
                .eventId(eventId)
                .qualityScore(qualityScore)
                .detail(message)
                .build();
    }

    static PipelineOutcome processed(String eventId, double qualityScore, List<RiskAssessment> assessments) {
        return PipelineOutcome.builder()
                .stage(PipelineStage.PROCESSED)
                .eventId(eventId)
                .qualityScore(qualityScore)
                .assessments(List.copyOf(assessments))
                .build();
    }
}
