package com.fintech.marketdata.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.Task;
import net.openhft.chronicle.map.ChronicleMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry backed by a persisted Chronicle Map keyed by {@code category|symbol|timeframe}.
 *
 * Each task is one entry (JSON encoded), so a status change costs one put
 * instead of a whole-registry rewrite. The map is memory-mapped and survives
 * a process crash. Entries that cannot be decoded are moved aside under
 * {@code #bad:<key>} on load so they stay available for inspection.
 */
public class ChronicleMapTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(ChronicleMapTaskStore.class);

    static final String META_STARTED_AT = "#meta:startedAt";
    static final String META_UPDATED_AT = "#meta:updatedAt";
    static final String META_STATISTICS = "#meta:statistics";
    static final String BAD_PREFIX = "#bad:";

    private final File dataFile;
    private final ObjectMapper mapper;
    private final ChronicleMap<String, String> entries;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ChronicleMapTaskStore(File dataFile, long maxEntries) {
        this.dataFile = dataFile;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            File parentDir = dataFile.getAbsoluteFile().getParentFile();
            if (parentDir != null && !parentDir.exists() && parentDir.mkdirs()) {
                log.info("Created registry directory: {}", parentDir.getAbsolutePath());
            }
            this.entries = ChronicleMap
                .of(String.class, String.class)
                .name("task-registry")
                .entries(maxEntries)
                .averageKeySize(40)
                .averageValueSize(360)
                .createOrRecoverPersistedTo(dataFile);
            log.info("Chronicle Map registry opened: path={}, entries={}", dataFile.getAbsolutePath(), entries.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Chronicle Map registry initialization failed: " + dataFile, e);
        }
    }

    @Override
    public Snapshot load() {
        List<Task> tasks = new ArrayList<>(entries.size());
        Map<String, String> unreadable = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getKey().startsWith("#")) {
                continue;
            }
            try {
                tasks.add(mapper.readValue(entry.getValue(), Task.class));
            } catch (JsonProcessingException e) {
                unreadable.put(entry.getKey(), entry.getValue());
                log.error("Unreadable registry entry: key={}, error={}", entry.getKey(), e.getOriginalMessage());
            }
        }
        for (Map.Entry<String, String> bad : unreadable.entrySet()) {
            entries.put(BAD_PREFIX + bad.getKey(), bad.getValue());
            entries.remove(bad.getKey());
        }
        if (!unreadable.isEmpty()) {
            log.warn("Moved {} unreadable registry entries aside under '{}': keys={}. "
                + "Their series will be generated again as pending.", unreadable.size(), BAD_PREFIX, unreadable.keySet());
        }
        String started = entries.get(META_STARTED_AT);
        return new Snapshot(started != null ? Instant.parse(started) : null, tasks);
    }

    /** Raw values of entries moved aside because they could not be decoded, by original key. */
    public Map<String, String> quarantined() {
        Map<String, String> result = new TreeMap<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(BAD_PREFIX)) {
                result.put(entry.getKey().substring(BAD_PREFIX.length()), entry.getValue());
            }
        }
        return result;
    }

    /** Aggregate counts written with the last change, empty if none were written yet. */
    public Optional<RegistryStats> statistics() {
        String json = entries.get(META_STATISTICS);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(json, RegistryStats.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot decode registry statistics", e);
        }
    }

    @Override
    public void write(Collection<Task> changed, RegistryStats stats) {
        for (Task task : changed) {
            try {
                entries.put(task.key().toStringKey(), mapper.writeValueAsString(task));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot encode task " + task.key(), e);
            }
        }
        if (stats.startedAt() != null) {
            entries.putIfAbsent(META_STARTED_AT, stats.startedAt().toString());
        }
        if (stats.updatedAt() != null) {
            entries.put(META_UPDATED_AT, stats.updatedAt().toString());
        }
        try {
            entries.put(META_STATISTICS, mapper.writeValueAsString(stats));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode registry statistics", e);
        }
    }

    @Override
    public String describe() {
        return "chronicle-map:" + dataFile.getAbsolutePath();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing Chronicle Map registry: entries={}", entries.size());
            entries.close();
        }
    }
}
