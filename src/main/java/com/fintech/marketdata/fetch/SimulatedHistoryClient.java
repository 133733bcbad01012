package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline {@link HistoryClient} producing random-walk bars for weekday sessions.
 *
 * Output is deterministic per (symbol, timeframe, bar time), so fetching the
 * same window twice returns identical bars and overlapping fetches agree.
 * Enabled with {@code ingestion.fetch.provider=simulated}.
 */
public class SimulatedHistoryClient implements HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedHistoryClient.class);

    private static final LocalTime SESSION_OPEN = LocalTime.of(9, 15);
    private static final LocalTime SESSION_CLOSE = LocalTime.of(15, 30);
    private static final double VOLATILITY = 0.002;

    private final ZoneId marketZone;
    private final AtomicLong callCount = new AtomicLong();

    public SimulatedHistoryClient(ZoneId marketZone) {
        this.marketZone = marketZone;
    }

    @Override
    public List<Bar> fetch(SeriesKey key, long fromEpoch, long toEpoch) {
        callCount.incrementAndGet();
        List<Bar> bars = new ArrayList<>();
        LocalDate day = LocalDate.ofInstant(Instant.ofEpochSecond(fromEpoch), marketZone);
        LocalDate last = LocalDate.ofInstant(Instant.ofEpochSecond(toEpoch), marketZone);
        while (!day.isAfter(last)) {
            if (day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY) {
                addSession(key, day, fromEpoch, toEpoch, bars);
            }
            day = day.plusDays(1);
        }
        log.debug("Simulated fetch: key={}, from={}, to={}, bars={}", key, fromEpoch, toEpoch, bars.size());
        return bars;
    }

    /** Returns the number of fetch calls served. */
    public long callCount() {
        return callCount.get();
    }

    private void addSession(SeriesKey key, LocalDate day, long fromEpoch, long toEpoch, List<Bar> out) {
        Timeframe tf = key.timeframe();
        if (!tf.isIntraday()) {
            long ts = day.atStartOfDay(marketZone).toEpochSecond();
            if (ts >= fromEpoch && ts <= toEpoch) {
                out.add(barAt(key, ts));
            }
            return;
        }
        ZonedDateTime open = ZonedDateTime.of(day, SESSION_OPEN, marketZone);
        long closeEpoch = ZonedDateTime.of(day, SESSION_CLOSE, marketZone).toEpochSecond();
        for (long ts = open.toEpochSecond(); ts < closeEpoch; ts += tf.seconds()) {
            if (ts >= fromEpoch && ts <= toEpoch) {
                out.add(barAt(key, ts));
            }
        }
    }

    private Bar barAt(SeriesKey key, long timestamp) {
        SplittableRandom random = new SplittableRandom(
            31L * key.symbol().hashCode() + 17L * key.timeframe().ordinal() + timestamp);
        double base = 100.0 + Math.floorMod(key.symbol().hashCode(), 4_900);
        double open = base * (1 + (random.nextDouble() - 0.5) * 0.1);
        double close = open * (1 + (random.nextDouble() - 0.5) * 2 * VOLATILITY);
        double high = Math.max(open, close) * (1 + random.nextDouble() * VOLATILITY);
        double low = Math.min(open, close) * (1 - random.nextDouble() * VOLATILITY);
        long volume = 100 + random.nextLong(10_000);
        return new Bar(timestamp, round(open), round(high), round(low), round(close), volume);
    }

    private static double round(double price) {
        return Math.round(price * 100.0) / 100.0;
    }
}
