package com.xcc.challenge.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-customer funnel statistics: means over the customer's purchase cycles.
 */
public record CustomerFunnelSummary(

        @JsonProperty("customer_id")
        String customerId,

        @JsonProperty("average_sessions_until_buy")
        double averageSessionsUntilBuy,

        @JsonProperty("average_elapsed_seconds_until_buy")
        double averageElapsedSecondsUntilBuy,

        @JsonProperty("cycle_count")
        int cycleCount
) {}
