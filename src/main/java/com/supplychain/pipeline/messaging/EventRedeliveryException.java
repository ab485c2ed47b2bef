package com.supplychain.pipeline.messaging;

import lombok.Getter;

/**
 * Thrown from the raw-event listener so the container seeks back and delivers the
 * record again instead of committing its offset.
 */
@Getter
public class EventRedeliveryException extends RuntimeException {

    private final String eventId;

    public EventRedeliveryException(String eventId, String reason) {
        super("Event " + eventId + " left unprocessed, requesting redelivery: " + reason);
        this.eventId = eventId;
    }
}
