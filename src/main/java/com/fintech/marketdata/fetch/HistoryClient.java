package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.SeriesKey;

import java.util.List;

/**
 * Boundary to the external quote-history service. One call covers one window
 * no longer than the provider's per-request limit.
 */
public interface HistoryClient {

    /**
     * Fetches the bars of a series whose open time lies in {@code [fromEpoch, toEpoch]}.
     *
     * @param key Series to fetch (category decides provider options such as continuous contracts)
     * @param fromEpoch First bar-open time, epoch seconds
     * @param toEpoch Last bar-open time, epoch seconds
     * @return Bars in provider order; empty when the window has no data
     * @throws AuthException if credentials are rejected
     * @throws RateLimitException if the provider throttles the call
     * @throws TransientFetchException on network or server failure
     */
    List<Bar> fetch(SeriesKey key, long fromEpoch, long toEpoch);
}
