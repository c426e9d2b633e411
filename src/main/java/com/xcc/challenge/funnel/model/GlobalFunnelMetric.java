package com.xcc.challenge.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Average of the per-customer summaries across all eligible customers.
 *
 * Averages are null when there is no eligible customer.
 */
public record GlobalFunnelMetric(

        @JsonProperty("customer_count")
        int customerCount,

        @JsonProperty("average_sessions_until_buy")
        Double averageSessionsUntilBuy,

        @JsonProperty("average_elapsed_seconds_until_buy")
        Double averageElapsedSecondsUntilBuy
) {

    public static GlobalFunnelMetric of(Collection<CustomerFunnelSummary> summaries) {
        if (summaries.isEmpty()) {
            return new GlobalFunnelMetric(0, null, null);
        }
        double sessions = 0;
        double elapsed = 0;
        for (CustomerFunnelSummary summary : summaries) {
            sessions += summary.averageSessionsUntilBuy();
            elapsed += summary.averageElapsedSecondsUntilBuy();
        }
        int n = summaries.size();
        return new GlobalFunnelMetric(n, sessions / n, elapsed / n);
    }
}
