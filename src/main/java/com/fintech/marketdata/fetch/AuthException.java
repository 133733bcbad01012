package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.ErrorCategory;

/**
 * Credentials were rejected. Fatal for the whole run: every further call
 * would fail the same way until the token is refreshed.
 */
public class AuthException extends FetchException {

    public AuthException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.AUTH;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
