package com.fintech.marketdata.api;

/**
 * Requested category, symbol or timeframe has no stored data.
 */
public class SeriesNotFoundException extends RuntimeException {

    public SeriesNotFoundException(String message) {
        super(message);
    }
}
