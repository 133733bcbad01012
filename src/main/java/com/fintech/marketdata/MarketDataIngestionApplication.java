package com.fintech.marketdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Market Data Ingestion Service
 *
 * Bulk download of historical OHLCV bars into a month-partitioned store.
 *
 * Key Features:
 * - Persisted, resumable task registry (JSON document or Chronicle Map)
 * - Worker pool with backoff, pacing and rate-limit pauses
 * - Provider-sized range splitting without partial bars
 * - Month-partitioned CSV store with merge-on-append
 * - TradingView-compatible read API and operator endpoints
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class MarketDataIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataIngestionApplication.class, args);
    }
}
