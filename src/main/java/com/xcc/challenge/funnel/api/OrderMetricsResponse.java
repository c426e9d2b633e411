package com.xcc.challenge.funnel.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Per-customer funnel metric under the keys existing consumers read.
 *
 * Both maps hold MEANS over the customer's purchase cycles, not medians, and the
 * duration is in seconds. The key names are kept for compatibility.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderMetricsResponse {

    // customer id -> mean sessions per purchase cycle
    @JsonProperty("median_visits_before_order")
    private Map<String, Double> visitsBeforeOrder;

    // customer id -> mean elapsed seconds per purchase cycle
    @JsonProperty("median_session_duration_minutes_before_order")
    private Map<String, Double> durationBeforeOrder;
}
