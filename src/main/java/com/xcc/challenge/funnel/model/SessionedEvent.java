package com.xcc.challenge.funnel.model;

import java.time.Instant;

/**
 * A timed event assigned to a browsing session.
 *
 * Session ids come from one running counter over the whole scan. Only their
 * relative order within one customer is meaningful downstream.
 */
public record SessionedEvent(
        TimedEvent timedEvent,
        long sessionId,
        boolean thereIsBuy
) {

    public static SessionedEvent of(TimedEvent timedEvent, long sessionId) {
        return new SessionedEvent(timedEvent, sessionId, timedEvent.event().isPurchase());
    }

    public String id() {
        return timedEvent.id();
    }

    public String type() {
        return timedEvent.type();
    }

    public String customerId() {
        return timedEvent.customerId();
    }

    public Instant timestamp() {
        return timedEvent.timestamp();
    }

    public double timeDiff() {
        return timedEvent.timeDiff();
    }
}
