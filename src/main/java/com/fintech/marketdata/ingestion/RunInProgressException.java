package com.fintech.marketdata.ingestion;

/**
 * A run was requested while another one is active.
 */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException() {
        super("An ingestion run is already in progress");
    }
}
