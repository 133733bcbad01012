package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.SeriesKey;

/**
 * One provider call planned from a {@link FetchRequest}.
 *
 * @param key Series
 * @param dates Calendar window this call covers
 * @param fromEpoch First bar-open time (epoch seconds)
 * @param toEpoch Last bar-open time (epoch seconds), possibly capped before the forming bar
 * @param index Position in the plan, zero based
 * @param count Number of windows in the plan
 */
public record WindowRequest(SeriesKey key, DateWindow dates, long fromEpoch, long toEpoch, int index, int count) {

    public boolean isLast() {
        return index == count - 1;
    }

    @Override
    public String toString() {
        return key + " " + dates.from() + ".." + dates.to() + " [" + (index + 1) + "/" + count + "]";
    }
}
