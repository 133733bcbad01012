package com.fintech.marketdata.domain;

/**
 * Why a task failed. Drives the operator's next step: fix credentials for
 * {@link #AUTH}, resume for {@link #TRANSIENT} and {@link #RATE_LIMIT}, review data
 * for {@link #DATA_INTEGRITY}.
 */
public enum ErrorCategory {
    AUTH,
    RATE_LIMIT,
    TRANSIENT,
    DATA_INTEGRITY,
    STORAGE,
    /** Claimed by a worker that never reported back. */
    STALE,
    UNKNOWN
}
