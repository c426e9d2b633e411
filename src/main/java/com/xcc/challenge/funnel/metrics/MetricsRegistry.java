package com.xcc.challenge.funnel.metrics;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong runsStarted = new AtomicLong();
    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsFailed = new AtomicLong();

    private final AtomicLong eventsRead = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong eventsNormalized = new AtomicLong();
    private final AtomicLong sessionsDetected = new AtomicLong();
    private final AtomicLong eligibleCustomers = new AtomicLong();
    private final AtomicLong cyclesComputed = new AtomicLong();

    private final AtomicReference<Duration> lastRunDuration = new AtomicReference<>();
    private final AtomicReference<Instant> lastRunCompletedAt = new AtomicReference<>();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    @Override
    public void onRunStarted() {
        runsStarted.incrementAndGet();
        touch();
    }

    @Override
    public void onEventsRead(long count) {
        eventsRead.set(count);
        touch();
    }

    @Override
    public void onEventsDropped(long count) {
        eventsDropped.set(count);
        touch();
    }

    @Override
    public void onEventsNormalized(long count) {
        eventsNormalized.set(count);
        touch();
    }

    @Override
    public void onSessionsDetected(long count) {
        sessionsDetected.set(count);
        touch();
    }

    @Override
    public void onEligibleCustomers(long count) {
        eligibleCustomers.set(count);
        touch();
    }

    @Override
    public void onCyclesComputed(long count) {
        cyclesComputed.set(count);
        touch();
    }

    @Override
    public void onRunCompleted(Duration duration) {
        runsCompleted.incrementAndGet();
        lastRunDuration.set(duration);
        lastRunCompletedAt.set(Instant.now());
        touch();
    }

    @Override
    public void onRunFailed() {
        runsFailed.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        Duration duration = lastRunDuration.get();
        return new MetricsSnapshot(
                runsStarted.get(),
                runsCompleted.get(),
                runsFailed.get(),
                eventsRead.get(),
                eventsDropped.get(),
                eventsNormalized.get(),
                sessionsDetected.get(),
                eligibleCustomers.get(),
                cyclesComputed.get(),
                duration != null ? duration.toMillis() : null,
                lastRunCompletedAt.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
