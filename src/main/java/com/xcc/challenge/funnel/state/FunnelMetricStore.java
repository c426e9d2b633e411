package com.xcc.challenge.funnel.state;

import com.xcc.challenge.funnel.model.CustomerFunnelSummary;
import com.xcc.challenge.funnel.model.GlobalFunnelMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the per-customer funnel summaries of the latest successful run.
 *
 * Each run replaces the whole content at once, so readers always see one
 * complete run, never a mix of two.
 */
@Slf4j
@Component
public class FunnelMetricStore {

    private final AtomicReference<Published> current =
            new AtomicReference<>(new Published(Map.of(), null));

    /**
     * Replace the published summaries.
     *
     * @param summaries customer id -> summary, in the order to serve them
     */
    public void replace(Map<String, CustomerFunnelSummary> summaries) {
        Map<String, CustomerFunnelSummary> copy =
                Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        current.set(new Published(copy, Instant.now()));
        log.info("Published funnel summaries for {} customers", copy.size());
    }

    public Map<String, CustomerFunnelSummary> getAll() {
        return current.get().summaries();
    }

    public Optional<CustomerFunnelSummary> find(String customerId) {
        return Optional.ofNullable(current.get().summaries().get(customerId));
    }

    /**
     * Average of the per-customer averages across all published customers.
     */
    public GlobalFunnelMetric global() {
        return GlobalFunnelMetric.of(current.get().summaries().values());
    }

    /**
     * @return time of the last publication, or null if nothing was published yet
     */
    public Instant getPublishedAt() {
        return current.get().publishedAt();
    }

    private record Published(Map<String, CustomerFunnelSummary> summaries, Instant publishedAt) {}
}
