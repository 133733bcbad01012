package com.fintech.marketdata.store;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.PartitionKey;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.domain.WriteMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PartitionedCsvBarStore Tests")
class PartitionedCsvBarStoreTest {

    // 2023-01-02T03:45:00Z, 09:15 IST
    private static final long JAN_2_OPEN = 1_672_631_100L;
    private static final long DAY = 86_400L;
    private static final SeriesKey DAILY = new SeriesKey("nifty50", "RELIANCE", Timeframe.D1);
    private static final SeriesKey FIVE_MIN = new SeriesKey("nifty50", "RELIANCE", Timeframe.M5);

    private Path baseDir;
    private PartitionedCsvBarStore store;

    @BeforeEach
    void setUp() {
        baseDir = Path.of("target/test-bars-" + System.nanoTime());
        store = new PartitionedCsvBarStore(baseDir);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (Files.exists(baseDir)) {
            try (Stream<Path> paths = Files.walk(baseDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    private static Bar bar(long timestamp, double close) {
        return new Bar(timestamp, close, close + 1, close - 1, close, 100L);
    }

    private static List<Bar> dailyBars(long start, int count) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bars.add(bar(start + i * DAY, 100 + i));
        }
        return bars;
    }

    @Test
    @DisplayName("Partition files follow the category/symbol/timeframe/year/month layout")
    void testLayout() {
        store.write(DAILY, List.of(bar(JAN_2_OPEN, 100)), WriteMode.APPEND);

        Path expected = baseDir.resolve("nifty50/RELIANCE/1D/2023/01/RELIANCE_1D_2023_01.csv");
        assertThat(expected).exists();
        assertThat(store.partitionFile(new PartitionKey(DAILY, YearMonth.of(2023, 1)))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Prices and volumes read back exactly as written")
    void testNumericRoundTrip() throws IOException {
        Bar odd = new Bar(JAN_2_OPEN, 0.1 + 0.2, 1234.5678901234567, 0.05, 1e-3 + 0.25, 9_007_199_254_740_993L);
        store.write(DAILY, List.of(odd), WriteMode.APPEND);

        assertThat(store.readRange(DAILY, null, null)).containsExactly(odd);
        assertThat(Files.readAllLines(store.partitionFile(new PartitionKey(DAILY, YearMonth.of(2023, 1)))).get(0))
            .isEqualTo("timestamp,open,high,low,close,volume");
    }

    @Test
    @DisplayName("Appending the same batch twice changes nothing")
    void testAppendIdempotent() throws IOException {
        List<Bar> batch = dailyBars(JAN_2_OPEN, 10);
        store.write(DAILY, batch, WriteMode.APPEND);
        Path file = store.partitionFile(new PartitionKey(DAILY, YearMonth.of(2023, 1)));
        String first = Files.readString(file);

        store.write(DAILY, batch, WriteMode.APPEND);

        assertThat(Files.readString(file)).isEqualTo(first);
        assertThat(store.readRange(DAILY, null, null)).isEqualTo(batch);
    }

    @Test
    @DisplayName("Append merges by timestamp and the new bar wins")
    void testAppendNewWins() {
        store.write(DAILY, List.of(bar(JAN_2_OPEN, 100), bar(JAN_2_OPEN + DAY, 101)), WriteMode.APPEND);

        store.write(DAILY, List.of(bar(JAN_2_OPEN + DAY, 150), bar(JAN_2_OPEN + 2 * DAY, 102)), WriteMode.APPEND);

        assertThat(store.readRange(DAILY, null, null)).containsExactly(
            bar(JAN_2_OPEN, 100), bar(JAN_2_OPEN + DAY, 150), bar(JAN_2_OPEN + 2 * DAY, 102));
    }

    @Test
    @DisplayName("Unsorted batches with repeated timestamps are stored sorted and unique")
    void testBatchDedup() {
        int written = store.write(DAILY,
            List.of(bar(JAN_2_OPEN + DAY, 1), bar(JAN_2_OPEN, 2), bar(JAN_2_OPEN + DAY, 3)), WriteMode.APPEND);

        assertThat(written).isEqualTo(2);
        assertThat(store.readRange(DAILY, null, null)).containsExactly(bar(JAN_2_OPEN, 2), bar(JAN_2_OPEN + DAY, 3));
    }

    @Test
    @DisplayName("Overwrite replaces the touched partitions only")
    void testOverwrite() {
        List<Bar> janToFeb = dailyBars(JAN_2_OPEN, 45);
        store.write(DAILY, janToFeb, WriteMode.APPEND);

        store.write(DAILY, List.of(bar(JAN_2_OPEN + 5 * DAY, 999)), WriteMode.OVERWRITE);

        List<Bar> stored = store.readRange(DAILY, null, null);
        assertThat(stored).filteredOn(b -> PartitionKey.monthOf(b.timestamp()).getMonthValue() == 1)
            .containsExactly(bar(JAN_2_OPEN + 5 * DAY, 999));
        assertThat(stored).filteredOn(b -> PartitionKey.monthOf(b.timestamp()).getMonthValue() == 2)
            .hasSize(15);
    }

    @Test
    @DisplayName("Reads are independent of how writes were split across partitions")
    void testCrossPartitionEquivalence() {
        List<Bar> bars = dailyBars(JAN_2_OPEN, 80);
        SeriesKey other = new SeriesKey("nifty50", "TCS", Timeframe.D1);

        store.write(DAILY, bars, WriteMode.APPEND);
        store.write(other, bars.subList(0, 30), WriteMode.APPEND);
        store.write(other, bars.subList(30, 55), WriteMode.APPEND);
        store.write(other, bars.subList(55, 80), WriteMode.APPEND);

        assertThat(store.partitions(DAILY)).hasSize(3);
        long from = JAN_2_OPEN + 20 * DAY;
        long to = JAN_2_OPEN + 60 * DAY;
        assertThat(store.readRange(DAILY, from, to))
            .isEqualTo(store.readRange(other, from, to))
            .isEqualTo(bars.subList(20, 61));
    }

    @Test
    @DisplayName("Missing series reads as empty")
    void testMissingSeries() {
        assertThat(store.exists(DAILY)).isFalse();
        assertThat(store.readRange(DAILY, null, null)).isEmpty();
        assertThat(store.lastTimestamp(DAILY)).isEmpty();
        assertThat(store.readRange(DAILY, 10L, 5L)).isEmpty();
    }

    @Test
    @DisplayName("Last timestamp spans partitions")
    void testLastTimestamp() {
        store.write(DAILY, dailyBars(JAN_2_OPEN, 40), WriteMode.APPEND);

        assertThat(store.lastTimestamp(DAILY)).hasValue(JAN_2_OPEN + 39 * DAY);
    }

    @Test
    @DisplayName("Invalid bars reject the whole batch")
    void testRejectsInvalidBars() {
        Bar broken = new Bar(JAN_2_OPEN + DAY, 100, 90, 95, 100, 1);

        assertThatThrownBy(() -> store.write(DAILY, List.of(bar(JAN_2_OPEN, 1), broken), WriteMode.APPEND))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.exists(DAILY)).isFalse();
    }

    @Test
    @DisplayName("Validation reports a healthy series")
    void testValidateHealthy() {
        store.write(DAILY, dailyBars(JAN_2_OPEN, 40), WriteMode.APPEND);

        ValidationReport report = store.validate(DAILY);

        assertThat(report.valid()).isTrue();
        assertThat(report.recordCount()).isEqualTo(40);
        assertThat(report.partitionCount()).isEqualTo(2);
        assertThat(report.firstTimestamp()).isEqualTo(JAN_2_OPEN);
        assertThat(report.lastTimestamp()).isEqualTo(JAN_2_OPEN + 39 * DAY);
    }

    @Test
    @DisplayName("Validation finds duplicates, nulls, broken OHLC and missing columns")
    void testValidateDamaged() throws IOException {
        Path file = store.partitionFile(new PartitionKey(DAILY, YearMonth.of(2023, 1)));
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n",
            "timestamp,open,high,low,close",
            JAN_2_OPEN + ",100,101,99,100",
            JAN_2_OPEN + ",100,101,99,100",
            (JAN_2_OPEN + DAY) + ",100,90,95,100",
            (JAN_2_OPEN + 2 * DAY) + ",,101,99,100",
            ""));

        ValidationReport report = store.validate(DAILY);

        assertThat(report.valid()).isFalse();
        assertThat(report.recordCount()).isEqualTo(4);
        assertThat(report.missingColumns()).containsExactly("volume");
        assertThat(report.duplicateCount()).isEqualTo(1);
        assertThat(report.nullCounts()).containsEntry("open", 1L).containsEntry("volume", 4L);
        assertThat(store.readRange(DAILY, null, null)).isEmpty();
    }

    @Test
    @DisplayName("Intraday gaps ignore session breaks")
    void testIntradayGaps() {
        store.write(FIVE_MIN, List.of(
            bar(JAN_2_OPEN, 1),
            bar(JAN_2_OPEN + 300, 1),
            bar(JAN_2_OPEN + 1_200, 1),
            bar(JAN_2_OPEN + DAY, 1)), WriteMode.APPEND);

        assertThat(store.findGaps(FIVE_MIN, null, null))
            .containsExactly(new Gap(JAN_2_OPEN + 300, JAN_2_OPEN + 1_200, 2));
    }

    @Test
    @DisplayName("Daily gaps tolerate weekends and short holidays")
    void testDailyGaps() {
        // Mon, Tue, Fri, next Mon, then a two-week hole
        store.write(DAILY, List.of(
            bar(JAN_2_OPEN, 1),
            bar(JAN_2_OPEN + DAY, 1),
            bar(JAN_2_OPEN + 4 * DAY, 1),
            bar(JAN_2_OPEN + 7 * DAY, 1),
            bar(JAN_2_OPEN + 21 * DAY, 1)), WriteMode.APPEND);

        assertThat(store.findGaps(DAILY, null, null))
            .containsExactly(new Gap(JAN_2_OPEN + 7 * DAY, JAN_2_OPEN + 21 * DAY, 13));
    }

    @Test
    @DisplayName("Catalogue lists categories, symbols and timeframes")
    void testCatalogue() {
        store.write(DAILY, List.of(bar(JAN_2_OPEN, 1)), WriteMode.APPEND);
        store.write(FIVE_MIN, List.of(bar(JAN_2_OPEN, 1)), WriteMode.APPEND);
        store.write(new SeriesKey("indices", "NIFTY", Timeframe.D1), List.of(bar(JAN_2_OPEN, 1)), WriteMode.APPEND);

        assertThat(store.categories()).containsExactly("indices", "nifty50");
        assertThat(store.symbols("nifty50")).containsExactly("RELIANCE");
        assertThat(store.timeframes("nifty50", "RELIANCE")).containsExactly(Timeframe.M5, Timeframe.D1);
        assertThat(store.symbols("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Concurrent appends to one series lose no bars")
    void testConcurrentAppends() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int worker = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        long ts = JAN_2_OPEN + (worker * 10L + i) * 300L;
                        store.write(FIVE_MIN, List.of(bar(ts, 100)), WriteMode.APPEND);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.readRange(FIVE_MIN, null, null)).hasSize(80);
        assertThat(store.validate(FIVE_MIN).valid()).isTrue();
    }
}
