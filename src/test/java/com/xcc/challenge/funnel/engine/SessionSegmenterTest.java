package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.SessionedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static com.xcc.challenge.funnel.testutil.TestFactory.customerAScenario;
import static com.xcc.challenge.funnel.testutil.TestFactory.event;
import static org.assertj.core.api.Assertions.assertThat;

public class SessionSegmenterTest {

    private final TimeDeltaComputer timeDeltaComputer = new TimeDeltaComputer();
    private final SessionSegmenter segmenter = new SessionSegmenter(false);

    private List<SessionedEvent> segment(List<Event> events) {
        return segmenter.segment(timeDeltaComputer.compute(events));
    }

    /**
     * view@0, view@1800, view@5000, placed_order@5100, view@10000
     * - view@5000: cumulative 1800 + 3200 > 3600, new session
     * - view@10000: gap 4900 >= 3600, new session
     */
    @Test
    void testScenarioSessions() {
        List<SessionedEvent> result = segment(customerAScenario());

        assertThat(result).extracting(SessionedEvent::sessionId).containsExactly(1L, 1L, 2L, 2L, 3L);
        assertThat(result).extracting(SessionedEvent::thereIsBuy).containsExactly(false, false, false, true, false);
    }

    /**
     * A cumulative gap of exactly one hour stays in the session; only > 3600 rolls over.
     */
    @Test
    void testCumulativeGapOfExactlyOneHourStaysInSession() {
        List<SessionedEvent> result = segment(List.of(
                event("a1", "view", "A", 0),
                event("a2", "view", "A", 1800),
                event("a3", "view", "A", 3600),
                event("a4", "view", "A", 3601)
        ));

        assertThat(result).extracting(SessionedEvent::sessionId).containsExactly(1L, 1L, 1L, 2L);
    }

    @Test
    void testSingleGapOfExactlyOneHourStartsSession() {
        List<SessionedEvent> result = segment(List.of(
                event("a1", "view", "A", 0),
                event("a2", "view", "A", 3600)
        ));

        assertThat(result).extracting(SessionedEvent::sessionId).containsExactly(1L, 2L);
    }

    /**
     * The gap that triggers a rollover is not carried into the new session.
     *
     * Gaps: 3000, 1000 (total 4000, new session, reset), 3000 (total 3000), 700 (total 3700, new session)
     */
    @Test
    void testExcessOverTimeoutIsDiscarded() {
        List<SessionedEvent> result = segment(List.of(
                event("a1", "view", "A", 0),
                event("a2", "view", "A", 3000),
                event("a3", "view", "A", 4000),
                event("a4", "view", "A", 7000),
                event("a5", "view", "A", 7700)
        ));

        assertThat(result).extracting(SessionedEvent::sessionId).containsExactly(1L, 1L, 2L, 2L, 3L);
    }

    /**
     * Session ids come from one counter across customers; a customer change always starts a session.
     */
    @Test
    void testNewCustomerStartsNewSession() {
        List<SessionedEvent> result = segment(List.of(
                event("a1", "view", "A", 0),
                event("a2", "view", "A", 60),
                event("b1", "view", "B", 90),
                event("b2", "placed_order", "B", 120)
        ));

        assertThat(result).extracting(SessionedEvent::customerId).containsExactly("A", "A", "B", "B");
        assertThat(result).extracting(SessionedEvent::sessionId).containsExactly(1L, 1L, 2L, 2L);
    }

    @Test
    void testSessionIdsNeverDecreaseAndStepByOne() {
        List<SessionedEvent> result = segment(randomEvents(new Random(7), 20, 30));

        Map<String, List<SessionedEvent>> byCustomer = result.stream()
                .collect(Collectors.groupingBy(SessionedEvent::customerId));

        byCustomer.values().forEach(events -> {
            for (int i = 1; i < events.size(); i++) {
                long step = events.get(i).sessionId() - events.get(i - 1).sessionId();
                assertThat(step).isBetween(0L, 1L);
            }
        });
    }

    /**
     * Per-customer segmentation with prefix-sum renumbering gives exactly the sequential ids.
     */
    @Test
    void testParallelSegmentationMatchesSequential() {
        List<Event> events = randomEvents(new Random(42), 50, 40);
        CustomerOrderedEvents ordered = timeDeltaComputer.compute(events);

        List<SessionedEvent> sequential = new SessionSegmenter(false).segment(ordered);
        List<SessionedEvent> parallel = new SessionSegmenter(true).segment(ordered);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void testEmptyInput() {
        assertThat(segment(List.of())).isEmpty();
        assertThat(new SessionSegmenter(true).segment(timeDeltaComputer.compute(List.of()))).isEmpty();
    }

    private static List<Event> randomEvents(Random random, int customers, int maxEventsPerCustomer) {
        List<Event> events = new ArrayList<>();
        for (int c = 0; c < customers; c++) {
            String customer = "customer-" + c;
            long t = random.nextInt(86_400);
            int n = 1 + random.nextInt(maxEventsPerCustomer);
            for (int i = 0; i < n; i++) {
                // mostly short gaps, sometimes longer than the timeout
                t += random.nextInt(10) == 0 ? 3000 + random.nextInt(4000) : random.nextInt(1500);
                String type = random.nextInt(8) == 0 ? Event.PLACED_ORDER : "view";
                events.add(event(customer + "-" + i, type, customer, t));
            }
        }
        return events;
    }
}
