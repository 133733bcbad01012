package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.ErrorCategory;

/**
 * Provider-side quota exceeded. Retryable once the quota window resets.
 */
public class RateLimitException extends FetchException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.RATE_LIMIT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
