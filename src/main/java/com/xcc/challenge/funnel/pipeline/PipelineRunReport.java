package com.xcc.challenge.funnel.pipeline;

import java.time.Instant;

/**
 * Counts and timing of one successful pipeline run.
 */
public record PipelineRunReport(
        String input,
        long eventsRead,
        long eventsDropped,
        long eventsNormalized,
        long customers,
        long sessions,
        long eligibleCustomers,
        long cycles,
        long durationMillis,
        Instant completedAt
) {}
