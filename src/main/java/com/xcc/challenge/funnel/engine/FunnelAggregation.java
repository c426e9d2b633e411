package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.CustomerFunnelSummary;
import com.xcc.challenge.funnel.model.PurchaseCycle;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link PurchaseFunnelAggregator}: cycles of all eligible customers and
 * one summary per eligible customer, keyed and ordered by customer id.
 */
public record FunnelAggregation(
        List<PurchaseCycle> cycles,
        Map<String, CustomerFunnelSummary> summaries
) {

    public int eligibleCustomers() {
        return summaries.size();
    }

    public boolean isEmpty() {
        return summaries.isEmpty();
    }
}
