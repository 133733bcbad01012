package com.fintech.marketdata.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.marketdata.domain.Bar;

import java.util.ArrayList;
import java.util.List;

/**
 * Response format compatible with TradingView Lightweight Charts.
 *
 * Columnar: each OHLCV component in its own array, timestamps in epoch seconds.
 * <pre>
 * {
 *   "s": "ok",
 *   "t": [1672713000, 1672799400],
 *   "o": [1812.5, 1820.0],
 *   "h": [1830.0, 1825.4],
 *   "l": [1801.2, 1811.0],
 *   "c": [1820.0, 1815.3],
 *   "v": [120345, 98002]
 * }
 * </pre>
 * {@code "s": "no_data"} marks an existing series with nothing in the requested range.
 */
public record HistoryResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("v") List<Long> volume
) {

    public static HistoryResponse fromBars(List<Bar> bars) {
        if (bars.isEmpty()) {
            return new HistoryResponse("no_data", List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        }
        int size = bars.size();
        List<Long> time = new ArrayList<>(size);
        List<Double> open = new ArrayList<>(size);
        List<Double> high = new ArrayList<>(size);
        List<Double> low = new ArrayList<>(size);
        List<Double> close = new ArrayList<>(size);
        List<Long> volume = new ArrayList<>(size);

        for (Bar bar : bars) {
            time.add(bar.timestamp());
            open.add(bar.open());
            high.add(bar.high());
            low.add(bar.low());
            close.add(bar.close());
            volume.add(bar.volume());
        }
        return new HistoryResponse("ok", time, open, high, low, close, volume);
    }
}
