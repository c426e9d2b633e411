package com.xcc.challenge.funnel.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of pipeline metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "no completed run yet"
 */
public record MetricsSnapshot(

        /* -------- Runs (cumulative) -------- */
        long runsStarted,
        long runsCompleted,
        long runsFailed,

        /* -------- Last run -------- */
        long eventsRead,
        long eventsDropped,
        long eventsNormalized,
        long sessionsDetected,
        long eligibleCustomers,
        long cyclesComputed,
        Long lastRunDurationMillis,
        Instant lastRunCompletedAt,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
