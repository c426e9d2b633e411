package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.TimedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timed events sorted by (customer id, timestamp, event id).
 *
 * Only {@link TimeDeltaComputer} creates instances, so holding one proves the
 * order the session scan relies on.
 */
public final class CustomerOrderedEvents {

    private final List<TimedEvent> events;

    /**
     * customer id -> that customer's events, in canonical customer order
     */
    private final Map<String, List<TimedEvent>> byCustomer;

    CustomerOrderedEvents(List<TimedEvent> sortedEvents) {
        this.events = List.copyOf(sortedEvents);

        Map<String, List<TimedEvent>> grouped = new LinkedHashMap<>();
        for (TimedEvent event : events) {
            grouped.computeIfAbsent(event.customerId(), c -> new ArrayList<>()).add(event);
        }
        grouped.replaceAll((customerId, list) -> Collections.unmodifiableList(list));
        this.byCustomer = Collections.unmodifiableMap(grouped);
    }

    public List<TimedEvent> events() {
        return events;
    }

    public Map<String, List<TimedEvent>> byCustomer() {
        return byCustomer;
    }

    public int size() {
        return events.size();
    }

    public int customerCount() {
        return byCustomer.size();
    }
}
