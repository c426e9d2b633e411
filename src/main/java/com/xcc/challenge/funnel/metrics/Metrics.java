package com.xcc.challenge.funnel.metrics;

import java.time.Duration;

/**
 * Lightweight metrics API used by FunnelPipeline and exposed via /metrics.
 */
public interface Metrics {

    void onRunStarted();

    void onEventsRead(long count);

    void onEventsDropped(long count);

    void onEventsNormalized(long count);

    void onSessionsDetected(long count);

    void onEligibleCustomers(long count);

    void onCyclesComputed(long count);

    void onRunCompleted(Duration duration);

    void onRunFailed();

    MetricsSnapshot snapshot();
}
