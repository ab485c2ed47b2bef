package com.supplychain.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Verdict of the validator. Errors make an event invalid; warnings only lower confidence.
 */
@Value
@Builder
public class ValidationResult {

    boolean valid;
    /** 0.0–1.0 */
    double qualityScore;
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;
}
