package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.CustomerFunnelSummary;
import com.xcc.challenge.funnel.model.PurchaseCycle;
import com.xcc.challenge.funnel.model.SessionedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Groups sessions into purchase cycles and computes funnel statistics per customer.
 *
 * For a customer's sessions in session id order, with {@code cumBuy} the running count
 * of purchase sessions including the current one:
 *
 *   cycle = 1 + cumBuy - (session has a purchase ? 1 : 0)
 *
 * so a purchase session closes its cycle and the next session opens a new one. Sessions
 * after the last purchase form a trailing cycle without a purchase.
 */
@Slf4j
@Component
public class PurchaseFunnelAggregator {

    private final boolean excludeTrailingCycles;
    private final boolean parallel;

    public PurchaseFunnelAggregator(
            @Value("${funnel.aggregation.exclude-trailing-cycles:false}") boolean excludeTrailingCycles,
            @Value("${funnel.pipeline.parallel:false}") boolean parallel
    ) {
        this.excludeTrailingCycles = excludeTrailingCycles;
        this.parallel = parallel;
        if (excludeTrailingCycles) {
            log.warn("Trailing cycles without a purchase are excluded from customer averages");
        }
    }

    /**
     * Compute cycles and per-customer summaries.
     *
     * Customers without any purchase are left out. No eligible customer gives an empty result.
     *
     * @param events sessioned events, any order
     */
    public FunnelAggregation aggregate(List<SessionedEvent> events) {
        Map<String, List<SessionedEvent>> byCustomer = new TreeMap<>();
        for (SessionedEvent event : events) {
            byCustomer.computeIfAbsent(event.customerId(), c -> new ArrayList<>()).add(event);
        }

        Stream<List<SessionedEvent>> customers = parallel
                ? byCustomer.values().parallelStream()
                : byCustomer.values().stream();

        List<List<PurchaseCycle>> cyclesPerCustomer = customers
                .map(PurchaseFunnelAggregator::cyclesOf)
                .filter(cycles -> !cycles.isEmpty())
                .toList();

        List<PurchaseCycle> allCycles = new ArrayList<>();
        Map<String, CustomerFunnelSummary> summaries = new LinkedHashMap<>();
        for (List<PurchaseCycle> cycles : cyclesPerCustomer) {
            allCycles.addAll(cycles);
            CustomerFunnelSummary summary = summarize(cycles);
            summaries.put(summary.customerId(), summary);
        }

        if (summaries.isEmpty()) {
            log.warn("No customer with a purchase among {} customers", byCustomer.size());
        } else {
            log.debug("{} of {} customers purchased at least once ({} cycles)",
                    summaries.size(), byCustomer.size(), allCycles.size());
        }
        return new FunnelAggregation(
                Collections.unmodifiableList(allCycles),
                Collections.unmodifiableMap(summaries)
        );
    }

    /**
     * Purchase cycles of one customer, empty if the customer never purchased.
     */
    static List<PurchaseCycle> cyclesOf(List<SessionedEvent> customerEvents) {
        String customerId = customerEvents.get(0).customerId();

        TreeMap<Long, SessionStats> sessions = new TreeMap<>();
        for (SessionedEvent event : customerEvents) {
            sessions.computeIfAbsent(event.sessionId(), id -> new SessionStats()).add(event);
        }
        if (sessions.values().stream().noneMatch(s -> s.hasBuy)) {
            return List.of();
        }

        List<PurchaseCycle> cycles = new ArrayList<>();
        int cumBuy = 0;
        int currentCycle = 0;
        int sessionCount = 0;
        double elapsed = 0d;
        boolean endsWithPurchase = false;

        for (SessionStats session : sessions.values()) {
            int buy = session.hasBuy ? 1 : 0;
            cumBuy += buy;
            int cycle = 1 + cumBuy - buy;

            if (cycle != currentCycle) {
                if (currentCycle != 0) {
                    cycles.add(new PurchaseCycle(customerId, currentCycle, sessionCount, elapsed, endsWithPurchase));
                }
                currentCycle = cycle;
                sessionCount = 0;
                elapsed = 0d;
            }
            sessionCount++;
            elapsed += session.timeDiffSum;
            endsWithPurchase = session.hasBuy;
        }
        cycles.add(new PurchaseCycle(customerId, currentCycle, sessionCount, elapsed, endsWithPurchase));
        return cycles;
    }

    private CustomerFunnelSummary summarize(List<PurchaseCycle> cycles) {
        List<PurchaseCycle> counted = excludeTrailingCycles
                ? cycles.stream().filter(PurchaseCycle::endsWithPurchase).toList()
                : cycles;

        // an eligible customer always has a cycle ending with a purchase
        double sessions = 0d;
        double elapsed = 0d;
        for (PurchaseCycle cycle : counted) {
            sessions += cycle.sessionsUntilBuy();
            elapsed += cycle.elapsedSeconds();
        }
        int n = counted.size();
        return new CustomerFunnelSummary(cycles.get(0).customerId(), sessions / n, elapsed / n, n);
    }

    /**
     * Per-session accumulator.
     */
    private static final class SessionStats {
        boolean hasBuy;
        double timeDiffSum;

        void add(SessionedEvent event) {
            hasBuy |= event.thereIsBuy();
            timeDiffSum += event.timeDiff();
        }
    }
}
