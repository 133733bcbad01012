package com.fintech.marketdata.ingestion;

/**
 * Why a run stopped dispatching before the registry drained.
 */
public enum HaltReason {
    AUTH_FAILURE,
    RATE_LIMIT_EXHAUSTED,
    STOP_REQUESTED,
    INTERRUPTED
}
