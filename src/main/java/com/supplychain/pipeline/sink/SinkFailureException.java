package com.supplychain.pipeline.sink;

import lombok.Getter;

/**
 * Raised when a sink write still fails after all retry attempts.
 */
@Getter
public class SinkFailureException extends RuntimeException {

    private final String sink;
    private final String eventId;

    public SinkFailureException(String sink, String eventId, Throwable cause) {
        super("Sink '" + sink + "' failed for event " + eventId + ": " + cause.getMessage(), cause);
        this.sink = sink;
        this.eventId = eventId;
    }
}
