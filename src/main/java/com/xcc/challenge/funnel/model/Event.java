package com.xcc.challenge.funnel.model;

import java.time.Instant;

/**
 * A normalized event. {@code customerId} is never null once normalization is done.
 */
public record Event(
        String id,
        String type,
        String customerId,
        Instant timestamp
) {

    public static final String PLACED_ORDER = "placed_order";

    public boolean isPurchase() {
        return PLACED_ORDER.equals(type);
    }
}
