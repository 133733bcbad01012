package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.ErrorCategory;

/**
 * Network failure, timeout or provider-side 5xx.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.TRANSIENT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
