package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.exception.MalformedEventException;
import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.RawEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens raw nested records into {@link Event}s.
 *
 * - id, type, event and event.timestamp are required; a missing one fails the whole batch
 * - records without a customer id are anonymous visitors and are dropped
 */
@Slf4j
@Component
public class EventNormalizer {

    /**
     * Normalize a batch of raw records, keeping input order.
     *
     * @param rawEvents records as read from the event log
     * @return events that carry a customer id
     * @throws MalformedEventException if any record breaks the data contract
     */
    public List<Event> normalize(List<RawEvent> rawEvents) {
        List<Event> events = new ArrayList<>(rawEvents.size());
        int dropped = 0;

        for (int i = 0; i < rawEvents.size(); i++) {
            Event event = flatten(i, rawEvents.get(i));
            if (event.customerId() == null || event.customerId().isBlank()) {
                dropped++;
                continue;
            }
            events.add(event);
        }

        if (dropped > 0) {
            log.debug("Dropped {} events without customer id", dropped);
        }
        return events;
    }

    private Event flatten(int index, RawEvent raw) {
        if (raw == null) {
            throw new MalformedEventException(index, null, "record is null");
        }
        String id = raw.getId();
        if (id == null) {
            throw new MalformedEventException(index, null, "missing field 'id'");
        }
        if (raw.getType() == null) {
            throw new MalformedEventException(index, id, "missing field 'type'");
        }
        RawEvent.Payload payload = raw.getEvent();
        if (payload == null) {
            throw new MalformedEventException(index, id, "missing field 'event'");
        }
        if (payload.getTimestamp() == null) {
            throw new MalformedEventException(index, id, "missing field 'event.timestamp'");
        }

        return new Event(
                id,
                raw.getType(),
                payload.getCustomerId(),
                parseTimestamp(index, id, payload.getTimestamp())
        );
    }

    /**
     * ISO-8601 date-time; an offset-less value is read as UTC.
     */
    static Instant parseTimestamp(int index, String id, String text) {
        String value = text.trim();
        // "2020-01-01 10:00:00" is accepted as well
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedEventException(index, id, "unparsable timestamp '" + text + "'", e);
        }
    }
}
