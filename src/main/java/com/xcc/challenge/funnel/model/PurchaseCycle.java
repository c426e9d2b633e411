package com.xcc.challenge.funnel.model;

/**
 * A run of consecutive sessions of one customer that ends with a purchase session.
 * The run after a customer's last purchase forms a cycle too, with
 * {@code endsWithPurchase = false}.
 */
public record PurchaseCycle(
        String customerId,
        int cycle,
        int sessionsUntilBuy,
        double elapsedSeconds,
        boolean endsWithPurchase
) {}
