package com.xcc.challenge.funnel.api;

import com.xcc.challenge.funnel.exception.CustomerNotFoundException;
import com.xcc.challenge.funnel.model.CustomerFunnelSummary;
import com.xcc.challenge.funnel.model.GlobalFunnelMetric;
import com.xcc.challenge.funnel.state.FunnelMetricStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves the published purchase funnel metrics.
 */
@RestController
@RequiredArgsConstructor
public class FunnelMetricsController {

    private final FunnelMetricStore metricStore;

    @GetMapping("/metrics/orders")
    public OrderMetricsResponse orders() {
        Map<String, Double> visits = new LinkedHashMap<>();
        Map<String, Double> duration = new LinkedHashMap<>();
        metricStore.getAll().forEach((customerId, summary) -> {
            visits.put(customerId, summary.averageSessionsUntilBuy());
            duration.put(customerId, summary.averageElapsedSecondsUntilBuy());
        });
        return OrderMetricsResponse.builder()
                .visitsBeforeOrder(visits)
                .durationBeforeOrder(duration)
                .build();
    }

    @GetMapping("/metrics/orders/global")
    public GlobalFunnelMetric global() {
        return metricStore.global();
    }

    @GetMapping("/metrics/orders/{customerId}")
    public CustomerFunnelSummary customer(@PathVariable String customerId) {
        return metricStore.find(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }
}
