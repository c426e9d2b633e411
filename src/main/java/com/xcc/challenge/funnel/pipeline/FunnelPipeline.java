package com.xcc.challenge.funnel.pipeline;

import com.xcc.challenge.funnel.engine.CustomerOrderedEvents;
import com.xcc.challenge.funnel.engine.EventNormalizer;
import com.xcc.challenge.funnel.engine.FunnelAggregation;
import com.xcc.challenge.funnel.engine.PurchaseFunnelAggregator;
import com.xcc.challenge.funnel.engine.SessionSegmenter;
import com.xcc.challenge.funnel.engine.TimeDeltaComputer;
import com.xcc.challenge.funnel.ingest.EventLogReader;
import com.xcc.challenge.funnel.metrics.Metrics;
import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.RawEvent;
import com.xcc.challenge.funnel.model.SessionedEvent;
import com.xcc.challenge.funnel.output.SessionCsvWriter;
import com.xcc.challenge.funnel.output.SessionTableSink;
import com.xcc.challenge.funnel.state.FunnelMetricStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs the batch end to end:
 *
 *   read -> normalize -> time deltas -> sessions -> csv -> persist (replace) -> read back
 *        -> purchase funnel -> publish
 *
 * Any failure aborts the run before publication; the previously published
 * summaries and the session table stay in place. The CSV export is written
 * before the table is replaced. Runs are serialized.
 */
@Slf4j
@Component
public class FunnelPipeline {

    private final EventLogReader reader;
    private final EventNormalizer normalizer;
    private final TimeDeltaComputer timeDeltaComputer;
    private final SessionSegmenter segmenter;
    private final PurchaseFunnelAggregator aggregator;
    private final SessionTableSink sessionTableSink;
    private final SessionCsvWriter csvWriter;
    private final FunnelMetricStore metricStore;
    private final Metrics metrics;
    private final Path defaultInput;

    public FunnelPipeline(
            EventLogReader reader,
            EventNormalizer normalizer,
            TimeDeltaComputer timeDeltaComputer,
            SessionSegmenter segmenter,
            PurchaseFunnelAggregator aggregator,
            SessionTableSink sessionTableSink,
            SessionCsvWriter csvWriter,
            FunnelMetricStore metricStore,
            Metrics metrics,
            @Value("${funnel.input.path:./data/events.json}") String inputPath
    ) {
        this.reader = reader;
        this.normalizer = normalizer;
        this.timeDeltaComputer = timeDeltaComputer;
        this.segmenter = segmenter;
        this.aggregator = aggregator;
        this.sessionTableSink = sessionTableSink;
        this.csvWriter = csvWriter;
        this.metricStore = metricStore;
        this.metrics = metrics;
        this.defaultInput = Path.of(inputPath);
    }

    /**
     * Run on the configured event log.
     */
    public PipelineRunReport run() {
        return run(defaultInput);
    }

    public synchronized PipelineRunReport run(Path input) {
        metrics.onRunStarted();
        long startNanos = System.nanoTime();
        try {
            List<RawEvent> rawEvents = reader.read(input);
            metrics.onEventsRead(rawEvents.size());

            List<Event> events = normalizer.normalize(rawEvents);
            long dropped = rawEvents.size() - events.size();
            metrics.onEventsNormalized(events.size());
            metrics.onEventsDropped(dropped);
            if (dropped > 0) {
                log.warn("Dropped {} of {} events without customer id", dropped, rawEvents.size());
            }

            CustomerOrderedEvents ordered = timeDeltaComputer.compute(events);
            List<SessionedEvent> sessioned = segmenter.segment(ordered);
            long sessions = sessioned.stream().mapToLong(SessionedEvent::sessionId).distinct().count();
            metrics.onSessionsDetected(sessions);
            log.info("Sessionized {} events of {} customers into {} sessions",
                    sessioned.size(), ordered.customerCount(), sessions);

            csvWriter.write(sessioned);
            FunnelAggregation aggregation = persistAndAggregate(sessioned);
            metrics.onEligibleCustomers(aggregation.eligibleCustomers());
            metrics.onCyclesComputed(aggregation.cycles().size());

            metricStore.replace(aggregation.summaries());

            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.onRunCompleted(duration);
            log.info("Pipeline run on {} completed in {} ms: {} eligible customers, {} purchase cycles",
                    input, duration.toMillis(), aggregation.eligibleCustomers(), aggregation.cycles().size());

            return new PipelineRunReport(
                    input.toString(),
                    rawEvents.size(),
                    dropped,
                    events.size(),
                    ordered.customerCount(),
                    sessions,
                    aggregation.eligibleCustomers(),
                    aggregation.cycles().size(),
                    duration.toMillis(),
                    Instant.now()
            );
        } catch (RuntimeException e) {
            metrics.onRunFailed();
            log.error("Pipeline run on {} failed", input, e);
            throw e;
        }
    }

    /**
     * Replace the session table and aggregate what was read back. If anything fails
     * after the replace, the previous table is put back so it stays in step with the
     * published summaries.
     */
    private FunnelAggregation persistAndAggregate(List<SessionedEvent> sessioned) {
        List<SessionedEvent> previous = sessionTableSink.loadAll();
        sessionTableSink.replaceAll(sessioned);
        try {
            return aggregator.aggregate(sessionTableSink.loadAll());
        } catch (RuntimeException e) {
            log.warn("Restoring previous session table ({} rows)", previous.size());
            try {
                sessionTableSink.replaceAll(previous);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }
}
