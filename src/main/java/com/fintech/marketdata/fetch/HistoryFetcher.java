package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.Timeframe;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a logical history request into provider-sized calls.
 *
 * Responsibilities:
 * - Split the date range into windows no longer than the timeframe's limit
 * - Keep the still-forming bar out of the last window unless asked for
 * - Pass every call through the shared provider rate limiter
 * - Reject windows whose bars break the OHLC invariant
 *
 * Windows are fetched in chronological order; {@link #fetchWindow} is exposed
 * so the orchestrator can retry and store one window at a time.
 */
public class HistoryFetcher {

    private static final Logger log = LoggerFactory.getLogger(HistoryFetcher.class);

    private final HistoryClient client;
    private final Map<Timeframe, Integer> maxWindowDays;
    private final ZoneId marketZone;
    private final Clock clock;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;

    public HistoryFetcher(
            HistoryClient client,
            Map<Timeframe, Integer> maxWindowDays,
            ZoneId marketZone,
            Clock clock,
            RateLimiter rateLimiter,
            MeterRegistry meterRegistry) {
        this.client = client;
        this.maxWindowDays = new EnumMap<>(maxWindowDays);
        this.marketZone = marketZone;
        this.clock = clock;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
        for (Timeframe tf : Timeframe.values()) {
            if (!this.maxWindowDays.containsKey(tf)) {
                throw new IllegalArgumentException("No max window configured for timeframe " + tf.code());
            }
        }
    }

    /** Returns the per-call window limit for a timeframe, in calendar days. */
    public int maxWindowDays(Timeframe timeframe) {
        return maxWindowDays.get(timeframe);
    }

    public ZoneId marketZone() {
        return marketZone;
    }

    /**
     * Plans the provider calls for a request.
     *
     * Unless the request includes partial bars, intraday windows end one bar
     * interval before now, so a bar that has not closed yet is never requested
     * whatever session grid the provider uses. Daily windows end before today.
     * Windows that start after the cap are dropped.
     *
     * @return Ordered windows, possibly empty
     */
    public List<WindowRequest> plan(FetchRequest request) {
        Timeframe timeframe = request.key().timeframe();
        List<DateWindow> dates = RangeSplitter.split(request.from(), request.to(), maxWindowDays(timeframe));
        if (dates.isEmpty()) {
            return Collections.emptyList();
        }

        long cap = request.includePartialBar() ? Long.MAX_VALUE : closedBarCap(timeframe);

        List<long[]> bounds = new ArrayList<>(dates.size());
        List<DateWindow> kept = new ArrayList<>(dates.size());
        for (DateWindow window : dates) {
            long fromEpoch = window.from().atStartOfDay(marketZone).toEpochSecond();
            long toEpoch = window.to().plusDays(1).atStartOfDay(marketZone).toEpochSecond() - 1;
            if (fromEpoch > cap) {
                break;
            }
            bounds.add(new long[] {fromEpoch, Math.min(toEpoch, cap)});
            kept.add(window);
        }

        List<WindowRequest> plan = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            plan.add(new WindowRequest(request.key(), kept.get(i), bounds.get(i)[0], bounds.get(i)[1], i, kept.size()));
        }
        return plan;
    }

    /**
     * Executes one planned call.
     *
     * @return Bars of the window, sorted by timestamp
     * @throws DataIntegrityException if any bar is invalid or outside the window
     * @throws RateLimitException if the provider or the local limiter throttles the call
     * @throws FetchException for other classified failures
     */
    public List<Bar> fetchWindow(WindowRequest window) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "ok";
        try {
            List<Bar> bars = rateLimiter.executeSupplier(
                () -> client.fetch(window.key(), window.fromEpoch(), window.toEpoch()));
            if (bars == null || bars.isEmpty()) {
                outcome = "empty";
                return Collections.emptyList();
            }
            checkIntegrity(window, bars);
            List<Bar> sorted = new ArrayList<>(bars);
            sorted.sort((a, b) -> Long.compare(a.timestamp(), b.timestamp()));
            return sorted;
        } catch (RequestNotPermitted e) {
            outcome = "throttled";
            throw new RateLimitException("Local rate limiter refused call for " + window, e);
        } catch (FetchException e) {
            outcome = e.category().name().toLowerCase();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("history.fetch.calls",
                "timeframe", window.key().timeframe().code(), "outcome", outcome));
        }
    }

    /**
     * Fetches a whole request window by window, in order, and concatenates the results.
     * Any window failure aborts the request.
     */
    public List<Bar> fetchRange(FetchRequest request) {
        List<Bar> result = new ArrayList<>();
        for (WindowRequest window : plan(request)) {
            result.addAll(fetchWindow(window));
        }
        log.debug("Fetched range: key={}, from={}, to={}, bars={}",
            request.key(), request.from(), request.to(), result.size());
        return result;
    }

    /** Returns today's date in the market zone. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(marketZone));
    }

    private long closedBarCap(Timeframe timeframe) {
        if (timeframe.isIntraday()) {
            return clock.instant().getEpochSecond() - timeframe.seconds();
        }
        return today().atStartOfDay(marketZone).toEpochSecond() - 1;
    }

    private void checkIntegrity(WindowRequest window, List<Bar> bars) {
        int invalid = 0;
        int outside = 0;
        for (Bar bar : bars) {
            if (!bar.isValid()) {
                invalid++;
            } else if (bar.timestamp() < window.fromEpoch() || bar.timestamp() > window.toEpoch()) {
                outside++;
            }
        }
        if (invalid > 0 || outside > 0) {
            log.warn("Rejecting window: window={}, invalidOhlc={}, outOfRange={}", window, invalid, outside);
            throw new DataIntegrityException(String.format(
                "%d invalid and %d out-of-range bars in %s", invalid, outside, window), invalid + outside);
        }
    }
}
