package com.supplychain.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Event as delivered by a collector (news feed, weather service, port telemetry...).
 * Nothing here is trusted; the validator decides whether it enters the pipeline.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RawEvent {

    String title;
    String description;
    String source;
    String location;
    /** Number or numeric string, whatever the collector sent. */
    Object severity;
    List<String> impactSectors;
    /** Free-form label: news, weather, economic, geopolitical, shipping, ... */
    String eventType;
    @JsonAlias("timestamp")
    String publishedAt;
    String url;

    /**
     * Severity as a finite number, or empty when missing or not numeric.
     */
    public OptionalDouble numericSeverity() {
        if (severity == null) {
            return OptionalDouble.empty();
        }
        double value;
        if (severity instanceof Number) {
            value = ((Number) severity).doubleValue();
        } else {
            String text = severity.toString().trim();
            if (text.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
