package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.ErrorCategory;

/**
 * A fetched window contained bars that break the OHLC invariant or fall
 * outside the requested range. The window is discarded, never stored.
 */
public class DataIntegrityException extends FetchException {

    private final int offendingBars;

    public DataIntegrityException(String message, int offendingBars) {
        super(message);
        this.offendingBars = offendingBars;
    }

    public int offendingBars() {
        return offendingBars;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.DATA_INTEGRITY;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
