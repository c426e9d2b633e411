package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.SessionedEvent;
import com.xcc.challenge.funnel.model.TimedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a session id to every event with a cumulative-inactivity rule.
 *
 * The rule is a left-to-right automaton ({@link SessionScanState}) that resets on every
 * customer change, so each customer can be segmented on its own. In parallel mode
 * customers are segmented independently and their local ids are shifted by an
 * exclusive prefix sum of session counts, which gives exactly the ids of the
 * sequential scan.
 */
@Slf4j
@Component
public class SessionSegmenter {

    // Inactivity after which a new session starts, per gap and cumulative since session start
    public static final Duration SESSION_TIMEOUT = Duration.ofHours(1);

    static final double SESSION_TIMEOUT_SECONDS = SESSION_TIMEOUT.getSeconds();

    private final boolean parallel;

    public SessionSegmenter(@Value("${funnel.pipeline.parallel:false}") boolean parallel) {
        this.parallel = parallel;
        log.info("Initialized SessionSegmenter (timeout={}s, parallel={})",
                SESSION_TIMEOUT.getSeconds(), parallel);
    }

    /**
     * Segment events into sessions.
     *
     * @param ordered events in canonical customer-then-time order
     * @return one sessioned event per input event, same order
     */
    public List<SessionedEvent> segment(CustomerOrderedEvents ordered) {
        List<SessionedEvent> result = parallel
                ? segmentPerCustomer(ordered)
                : segmentSequentially(ordered);

        if (!result.isEmpty()) {
            log.debug("Segmented {} events into {} sessions",
                    result.size(), result.get(result.size() - 1).sessionId());
        }
        return result;
    }

    List<SessionedEvent> segmentSequentially(CustomerOrderedEvents ordered) {
        List<SessionedEvent> result = new ArrayList<>(ordered.size());
        SessionScanState state = SessionScanState.initial();
        for (TimedEvent event : ordered.events()) {
            state = state.next(event);
            result.add(SessionedEvent.of(event, state.currentSession()));
        }
        return result;
    }

    List<SessionedEvent> segmentPerCustomer(CustomerOrderedEvents ordered) {
        List<List<TimedEvent>> customers = new ArrayList<>(ordered.byCustomer().values());

        List<long[]> localIds = customers.parallelStream()
                .map(SessionSegmenter::localSessionIds)
                .toList();

        List<SessionedEvent> result = new ArrayList<>(ordered.size());
        long offset = 0;
        for (int c = 0; c < customers.size(); c++) {
            List<TimedEvent> events = customers.get(c);
            long[] ids = localIds.get(c);
            for (int i = 0; i < ids.length; i++) {
                result.add(SessionedEvent.of(events.get(i), offset + ids[i]));
            }
            // local ids start at 1, so the last one is the customer's session count
            offset += ids[ids.length - 1];
        }
        return result;
    }

    private static long[] localSessionIds(List<TimedEvent> customerEvents) {
        long[] ids = new long[customerEvents.size()];
        SessionScanState state = SessionScanState.initial();
        for (int i = 0; i < ids.length; i++) {
            state = state.next(customerEvents.get(i));
            ids[i] = state.currentSession();
        }
        return ids;
    }
}
