package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.ErrorCategory;

/**
 * Typed failure of a history fetch. The category decides whether the
 * orchestrator retries, pauses dispatch or stops the run.
 */
public abstract class FetchException extends RuntimeException {

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory category();

    /** Returns true if the same request may succeed when repeated later. */
    public abstract boolean isRetryable();
}
