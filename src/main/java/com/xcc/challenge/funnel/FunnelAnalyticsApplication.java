package com.xcc.challenge.funnel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Purchase Funnel Analytics service.
 *
 * Sessionizes a customer event log and serves how many sessions, and how much
 * browsing time, precede a purchase.
 */
@Slf4j
@SpringBootApplication
public class FunnelAnalyticsApplication {

    public static void main(String[] args) {
        log.info("Starting Purchase Funnel Analytics Application...");
        SpringApplication.run(FunnelAnalyticsApplication.class, args);
        log.info("Purchase Funnel Analytics Application started successfully");
    }
}
