package com.fintech.marketdata.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.PartitionKey;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.domain.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link BarStore} keeping one CSV file per series and calendar month:
 * <pre>
 * {base}/{category}/{symbol}/{timeframe}/{yyyy}/{MM}/{symbol}_{timeframe}_{yyyy}_{MM}.csv
 * </pre>
 * with header {@code timestamp,open,high,low,close,volume}. Month membership
 * is decided in UTC.
 *
 * Files are replaced through a temp file and an atomic move, so readers see
 * either the old or the new content. Writers of the same series serialize on a
 * per-series lock; readers never lock.
 */
public class PartitionedCsvBarStore implements BarStore {

    private static final Logger log = LoggerFactory.getLogger(PartitionedCsvBarStore.class);

    static final List<String> COLUMNS = List.of("timestamp", "open", "high", "low", "close", "volume");
    private static final long INTRADAY_SESSION_BREAK_SECONDS = 6 * 3_600L;
    private static final long DAILY_GAP_TOLERANCE_DAYS = 4;

    private final Path baseDir;
    private final CsvMapper csvMapper;
    private final CsvSchema writeSchema;
    private final Map<SeriesKey, ReentrantLock> seriesLocks = new ConcurrentHashMap<>();

    public PartitionedCsvBarStore(Path baseDir) {
        this.baseDir = baseDir;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
        this.writeSchema = CsvSchema.builder()
            .addColumn("timestamp", CsvSchema.ColumnType.NUMBER)
            .addColumn("open", CsvSchema.ColumnType.NUMBER)
            .addColumn("high", CsvSchema.ColumnType.NUMBER)
            .addColumn("low", CsvSchema.ColumnType.NUMBER)
            .addColumn("close", CsvSchema.ColumnType.NUMBER)
            .addColumn("volume", CsvSchema.ColumnType.NUMBER)
            .setUseHeader(true)
            .build();
        log.info("Partitioned bar store: baseDir={}", baseDir.toAbsolutePath());
    }

    public Path baseDir() {
        return baseDir;
    }

    @Override
    public int write(SeriesKey key, List<Bar> bars, WriteMode mode) {
        if (bars.isEmpty()) {
            return 0;
        }
        long invalid = bars.stream().filter(bar -> !bar.isValid()).count();
        if (invalid > 0) {
            throw new IllegalArgumentException(invalid + " of " + bars.size() + " bars break the OHLC invariant for " + key);
        }

        Map<YearMonth, NavigableMap<Long, Bar>> byMonth = new TreeMap<>();
        for (Bar bar : bars) {
            byMonth.computeIfAbsent(PartitionKey.monthOf(bar.timestamp()), month -> new TreeMap<>())
                .put(bar.timestamp(), bar);
        }

        ReentrantLock lock = seriesLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            int written = 0;
            for (Map.Entry<YearMonth, NavigableMap<Long, Bar>> entry : byMonth.entrySet()) {
                PartitionKey partition = new PartitionKey(key, entry.getKey());
                Path file = partitionFile(partition);
                NavigableMap<Long, Bar> merged = new TreeMap<>();
                if (mode == WriteMode.APPEND && Files.exists(file)) {
                    for (Bar existing : readBars(file)) {
                        merged.put(existing.timestamp(), existing);
                    }
                }
                merged.putAll(entry.getValue());
                writePartition(file, new ArrayList<>(merged.values()));
                written += entry.getValue().size();
                log.debug("Partition written: partition={}/{}, mode={}, incoming={}, rows={}",
                    key, entry.getKey(), mode, entry.getValue().size(), merged.size());
            }
            return written;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Bar> readRange(SeriesKey key, Long from, Long to) {
        long lower = from != null ? from : Long.MIN_VALUE;
        long upper = to != null ? to : Long.MAX_VALUE;
        if (lower > upper) {
            return Collections.emptyList();
        }
        NavigableMap<Long, Bar> merged = new TreeMap<>();
        for (PartitionKey partition : partitions(key)) {
            if (partition.endEpochSecond() < lower || partition.startEpochSecond() > upper) {
                continue;
            }
            for (Bar bar : readBars(partitionFile(partition))) {
                merged.put(bar.timestamp(), bar);
            }
        }
        return new ArrayList<>(merged.subMap(lower, true, upper, true).values());
    }

    @Override
    public OptionalLong lastTimestamp(SeriesKey key) {
        List<PartitionKey> partitions = partitions(key);
        // newest partition first; an empty or unreadable file falls through to the previous month
        for (int i = partitions.size() - 1; i >= 0; i--) {
            OptionalLong max = readBars(partitionFile(partitions.get(i))).stream()
                .mapToLong(Bar::timestamp)
                .max();
            if (max.isPresent()) {
                return max;
            }
        }
        return OptionalLong.empty();
    }

    @Override
    public ValidationReport validate(SeriesKey key) {
        List<PartitionKey> partitions = partitions(key);
        Set<String> missingColumns = new TreeSet<>();
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        COLUMNS.forEach(column -> nullCounts.put(column, 0L));
        Set<Long> seen = new HashSet<>();
        long records = 0;
        long duplicates = 0;
        long invalidOhlc = 0;
        Long first = null;
        Long last = null;

        for (PartitionKey partition : partitions) {
            Rows rows = readRows(partitionFile(partition));
            Map<String, Integer> index = rows.columnIndex();
            for (String column : COLUMNS) {
                if (!index.containsKey(column)) {
                    missingColumns.add(column);
                }
            }
            for (List<String> row : rows.values()) {
                records++;
                boolean complete = true;
                for (String column : COLUMNS) {
                    if (parseValue(row, index, column) == null) {
                        nullCounts.merge(column, 1L, Long::sum);
                        complete = false;
                    }
                }
                Long ts = parseWhole(row, index.get("timestamp"));
                if (ts != null) {
                    long timestamp = ts;
                    if (!seen.add(timestamp)) {
                        duplicates++;
                    }
                    first = first == null ? timestamp : Math.min(first, timestamp);
                    last = last == null ? timestamp : Math.max(last, timestamp);
                }
                if (complete && !toBar(row, index).isValid()) {
                    invalidOhlc++;
                }
            }
        }

        long nulls = nullCounts.values().stream().mapToLong(Long::longValue).sum();
        boolean valid = missingColumns.isEmpty() && nulls == 0 && duplicates == 0 && invalidOhlc == 0;
        return new ValidationReport(valid, records, partitions.size(), new ArrayList<>(missingColumns),
            nullCounts, duplicates, invalidOhlc, first, last);
    }

    @Override
    public List<Gap> findGaps(SeriesKey key, Long from, Long to) {
        List<Bar> bars = readRange(key, from, to);
        Timeframe timeframe = key.timeframe();
        List<Gap> gaps = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            long previous = bars.get(i - 1).timestamp();
            long current = bars.get(i).timestamp();
            long delta = current - previous;
            if (timeframe.isIntraday()) {
                // session breaks (overnight, weekends) are not gaps
                if (delta > timeframe.seconds() && delta < INTRADAY_SESSION_BREAK_SECONDS) {
                    gaps.add(new Gap(previous, current, delta / timeframe.seconds() - 1));
                }
            } else if (delta > DAILY_GAP_TOLERANCE_DAYS * timeframe.seconds()) {
                gaps.add(new Gap(previous, current, delta / timeframe.seconds() - 1));
            }
        }
        return gaps;
    }

    @Override
    public boolean exists(SeriesKey key) {
        return !partitions(key).isEmpty();
    }

    @Override
    public List<PartitionKey> partitions(SeriesKey key) {
        Path seriesDir = seriesDir(key);
        if (!Files.isDirectory(seriesDir)) {
            return Collections.emptyList();
        }
        List<PartitionKey> partitions = new ArrayList<>();
        for (String year : listDirectories(seriesDir)) {
            for (String month : listDirectories(seriesDir.resolve(year))) {
                try {
                    PartitionKey partition = new PartitionKey(key, YearMonth.parse(year + "-" + month));
                    if (Files.isRegularFile(partitionFile(partition))) {
                        partitions.add(partition);
                    }
                } catch (DateTimeParseException e) {
                    log.debug("Ignoring non-partition directory: {}/{}/{}", seriesDir, year, month);
                }
            }
        }
        Collections.sort(partitions);
        return partitions;
    }

    @Override
    public List<String> categories() {
        return listDirectories(baseDir);
    }

    @Override
    public List<String> symbols(String category) {
        return listDirectories(baseDir.resolve(category));
    }

    @Override
    public List<Timeframe> timeframes(String category, String symbol) {
        List<Timeframe> timeframes = new ArrayList<>();
        for (String code : listDirectories(baseDir.resolve(category).resolve(symbol))) {
            try {
                timeframes.add(Timeframe.fromCode(code));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown timeframe directory: {}/{}/{}", category, symbol, code);
            }
        }
        Collections.sort(timeframes);
        return timeframes;
    }

    /** Returns the file of a partition, whether or not it exists. */
    public Path partitionFile(PartitionKey partition) {
        SeriesKey key = partition.series();
        String year = String.format("%04d", partition.month().getYear());
        String month = String.format("%02d", partition.month().getMonthValue());
        String fileName = String.format("%s_%s_%s_%s.csv", key.symbol(), key.timeframe().code(), year, month);
        return seriesDir(key).resolve(year).resolve(month).resolve(fileName);
    }

    private Path seriesDir(SeriesKey key) {
        return baseDir.resolve(key.category()).resolve(key.symbol()).resolve(key.timeframe().code());
    }

    private List<Bar> readBars(Path file) {
        Rows rows = readRows(file);
        Map<String, Integer> index = rows.columnIndex();
        List<Bar> bars = new ArrayList<>(rows.values().size());
        int malformed = 0;
        for (List<String> row : rows.values()) {
            boolean complete = COLUMNS.stream().allMatch(column -> parseValue(row, index, column) != null);
            if (complete) {
                bars.add(toBar(row, index));
            } else {
                malformed++;
            }
        }
        if (malformed > 0) {
            log.warn("Skipped {} malformed rows: file={}", malformed, file);
        }
        return bars;
    }

    private Rows readRows(Path file) {
        if (!Files.exists(file)) {
            return new Rows(List.of(), List.of());
        }
        try (MappingIterator<List<String>> iterator = csvMapper
                .readerForListOf(String.class)
                .readValues(file.toFile())) {
            List<List<String>> all = iterator.readAll();
            if (all.isEmpty()) {
                return new Rows(List.of(), List.of());
            }
            return new Rows(all.get(0), all.subList(1, all.size()));
        } catch (IOException e) {
            throw new StoreException("Failed to read partition " + file, e);
        }
    }

    private void writePartition(Path file, List<Bar> bars) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            csvMapper.writer(writeSchema).writeValue(tmp.toFile(), bars);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write partition " + file, e);
        }
    }

    private static Bar toBar(List<String> row, Map<String, Integer> index) {
        return new Bar(
            parseWhole(row, index.get("timestamp")),
            parseNumber(row, index.get("open")),
            parseNumber(row, index.get("high")),
            parseNumber(row, index.get("low")),
            parseNumber(row, index.get("close")),
            parseWhole(row, index.get("volume")));
    }

    private static Object parseValue(List<String> row, Map<String, Integer> index, String column) {
        Integer position = index.get(column);
        return "timestamp".equals(column) || "volume".equals(column)
            ? parseWhole(row, position)
            : parseNumber(row, position);
    }

    /** Parses an integer column exactly; integral decimals such as {@code 100.0} are accepted. */
    private static Long parseWhole(List<String> row, Integer position) {
        if (position == null || position >= row.size()) {
            return null;
        }
        String raw = row.get(position);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            Double value = parseNumber(row, position);
            if (value == null || value.isInfinite() || value != Math.rint(value)) {
                return null;
            }
            return value.longValue();
        }
    }

    private static Double parseNumber(List<String> row, Integer position) {
        if (position == null || position >= row.size()) {
            return null;
        }
        String raw = row.get(position);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> listDirectories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path child : stream) {
                names.add(child.getFileName().toString());
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list " + dir, e);
        }
        Collections.sort(names);
        return names;
    }

    private record Rows(List<String> header, List<List<String>> values) {

        Map<String, Integer> columnIndex() {
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < header.size(); i++) {
                index.putIfAbsent(header.get(i).trim().toLowerCase(), i);
            }
            return index;
        }
    }
}
