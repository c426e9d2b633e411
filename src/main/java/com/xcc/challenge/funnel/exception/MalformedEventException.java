package com.xcc.challenge.funnel.exception;

import lombok.Getter;

/**
 * A raw record violates the event data contract: a required field is missing
 * or the timestamp cannot be parsed. Aborts normalization as a whole.
 */
@Getter
public class MalformedEventException extends RuntimeException {

    private final int recordIndex;
    private final String eventId;

    public MalformedEventException(int recordIndex, String eventId, String reason) {
        this(recordIndex, eventId, reason, null);
    }

    public MalformedEventException(int recordIndex, String eventId, String reason, Throwable cause) {
        super("Malformed event at index " + recordIndex
                + (eventId != null ? " (id=" + eventId + ")" : "")
                + ": " + reason, cause);
        this.recordIndex = recordIndex;
        this.eventId = eventId;
    }
}
