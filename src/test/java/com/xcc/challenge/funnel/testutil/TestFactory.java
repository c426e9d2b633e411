package com.xcc.challenge.funnel.testutil;

import com.xcc.challenge.funnel.config.JacksonConfig;
import com.xcc.challenge.funnel.engine.EventNormalizer;
import com.xcc.challenge.funnel.engine.PurchaseFunnelAggregator;
import com.xcc.challenge.funnel.engine.SessionSegmenter;
import com.xcc.challenge.funnel.engine.TimeDeltaComputer;
import com.xcc.challenge.funnel.ingest.EventLogReader;
import com.xcc.challenge.funnel.metrics.Metrics;
import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.RawEvent;
import com.xcc.challenge.funnel.model.SessionedEvent;
import com.xcc.challenge.funnel.model.TimedEvent;
import com.xcc.challenge.funnel.output.SessionCsvWriter;
import com.xcc.challenge.funnel.output.SessionTableSink;
import com.xcc.challenge.funnel.pipeline.FunnelPipeline;
import com.xcc.challenge.funnel.state.FunnelMetricStore;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public final class TestFactory {
    private TestFactory(){}

    public static final Instant BASE = Instant.parse("2023-03-01T10:00:00Z");

    public static FunnelPipeline createPipeline(SessionTableSink sink, FunnelMetricStore store, Metrics metrics) {
        return createPipeline(sink, store, metrics, false, false);
    }

    public static FunnelPipeline createPipeline(
            SessionTableSink sink,
            FunnelMetricStore store,
            Metrics metrics,
            boolean parallel,
            boolean excludeTrailingCycles
    ) {
        return createPipeline(sink, store, metrics, parallel, excludeTrailingCycles, Path.of("./does-not-exist.json"));
    }

    public static FunnelPipeline createPipeline(
            SessionTableSink sink,
            FunnelMetricStore store,
            Metrics metrics,
            boolean parallel,
            boolean excludeTrailingCycles,
            Path defaultInput
    ) {
        return createPipeline(sink, new SessionCsvWriter(""), store, metrics, parallel, excludeTrailingCycles, defaultInput);
    }

    public static FunnelPipeline createPipeline(
            SessionTableSink sink,
            SessionCsvWriter csvWriter,
            FunnelMetricStore store,
            Metrics metrics,
            boolean parallel,
            boolean excludeTrailingCycles,
            Path defaultInput
    ) {
        return new FunnelPipeline(
                new EventLogReader(JacksonConfig.newObjectMapper()),
                new EventNormalizer(),
                new TimeDeltaComputer(),
                new SessionSegmenter(parallel),
                new PurchaseFunnelAggregator(excludeTrailingCycles, parallel),
                sink,
                csvWriter,
                store,
                metrics,
                defaultInput.toString()
        );
    }

    public static Path fixture(String name) {
        return Path.of("src/test/resources/events", name);
    }

    /**
     * Event at BASE + offsetSeconds.
     */
    public static Event event(String id, String type, String customerId, long offsetSeconds) {
        return new Event(id, type, customerId, BASE.plusSeconds(offsetSeconds));
    }

    public static RawEvent raw(String id, String type, String customerId, String timestamp) {
        return RawEvent.builder()
                .id(id)
                .type(type)
                .event(RawEvent.Payload.builder()
                        .customerId(customerId)
                        .timestamp(timestamp)
                        .build())
                .build();
    }

    public static SessionedEvent sessioned(String id, String type, String customerId, double timeDiff, long session) {
        return SessionedEvent.of(
                new TimedEvent(new Event(id, type, customerId, BASE), timeDiff),
                session
        );
    }

    /**
     * Customer "A": view@0, view@1800, view@5000, placed_order@5100, view@10000.
     */
    public static List<Event> customerAScenario() {
        return List.of(
                event("a1", "view", "A", 0),
                event("a2", "view", "A", 1800),
                event("a3", "view", "A", 5000),
                event("a4", Event.PLACED_ORDER, "A", 5100),
                event("a5", "view", "A", 10000)
        );
    }
}
