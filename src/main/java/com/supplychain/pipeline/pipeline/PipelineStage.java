package com.supplychain.pipeline.pipeline;

/**
 * Stages an event passes through. REJECTED, DISCARDED, PROCESSED and SINK_FAILED are terminal.
 */
public enum PipelineStage {
    RECEIVED,
    VALIDATED,
    REJECTED,
    DEDUPLICATED,
    DISCARDED,
    NORMALIZED,
    SCORED,
    STORED,
    PROCESSED,
    SINK_FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == DISCARDED || this == PROCESSED || this == SINK_FAILED;
    }
}
