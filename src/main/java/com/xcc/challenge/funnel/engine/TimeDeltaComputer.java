package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.TimedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders events per customer and computes seconds since the customer's previous event.
 */
@Slf4j
@Component
public class TimeDeltaComputer {

    /**
     * Canonical order. Event id breaks timestamp ties so the result is deterministic.
     */
    static final Comparator<Event> CANONICAL_ORDER = Comparator
            .comparing(Event::customerId)
            .thenComparing(Event::timestamp)
            .thenComparing(Event::id);

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    /**
     * - Sort by (customer, timestamp, id)
     * - First event of each customer gets 0
     * - Every other event gets the gap to its predecessor, in seconds
     *
     * @param events normalized events, customer id non-null
     * @return events in canonical order with time deltas
     */
    public CustomerOrderedEvents compute(List<Event> events) {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(CANONICAL_ORDER);

        List<TimedEvent> timed = new ArrayList<>(sorted.size());
        Event previous = null;
        for (Event event : sorted) {
            double timeDiff = 0d;
            if (previous != null && previous.customerId().equals(event.customerId())) {
                timeDiff = secondsBetween(previous, event);
            }
            timed.add(new TimedEvent(event, timeDiff));
            previous = event;
        }

        CustomerOrderedEvents result = new CustomerOrderedEvents(timed);
        log.debug("Computed time deltas for {} events of {} customers",
                result.size(), result.customerCount());
        return result;
    }

    private static double secondsBetween(Event from, Event to) {
        // toNanos() overflows past ~292 years
        Duration gap = Duration.between(from.timestamp(), to.timestamp());
        return gap.getSeconds() + gap.getNano() / NANOS_PER_SECOND;
    }
}
