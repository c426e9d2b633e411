package com.xcc.challenge.funnel.model;

import java.time.Instant;

/**
 * An event together with the seconds elapsed since the same customer's previous event.
 * {@code timeDiff} is 0 for a customer's first event and never negative.
 */
public record TimedEvent(
        Event event,
        double timeDiff
) {

    public String id() {
        return event.id();
    }

    public String type() {
        return event.type();
    }

    public String customerId() {
        return event.customerId();
    }

    public Instant timestamp() {
        return event.timestamp();
    }
}
