package com.fintech.marketdata.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry persisted as one JSON document:
 * <pre>
 * {
 *   "startedAt": "...", "updatedAt": "...",
 *   "statistics": {"total": 2, "pending": 0, ...},
 *   "tasks": {"nifty50|AAA|1D": {...}, ...}
 * }
 * </pre>
 * Every write rewrites the whole document through a temp file and an atomic
 * move, so readers never see a half-written file. Suited to registries of a
 * few thousand tasks; use {@link ChronicleMapTaskStore} beyond that.
 *
 * A file that cannot be parsed is moved aside to {@code <name>.bad-<timestamp>}
 * and an empty registry is started.
 */
public class JsonFileTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskStore.class);
    private static final DateTimeFormatter BACKUP_SUFFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private Instant startedAt;

    public JsonFileTaskStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized Snapshot load() {
        tasks.clear();
        startedAt = null;
        if (!Files.exists(file)) {
            log.info("No registry file yet: path={}", file.toAbsolutePath());
            return Snapshot.empty();
        }
        try {
            Document document = mapper.readValue(file.toFile(), Document.class);
            if (document.tasks() != null) {
                tasks.putAll(document.tasks());
            }
            startedAt = document.startedAt();
            log.info("Registry loaded: path={}, tasks={}", file.toAbsolutePath(), tasks.size());
            return new Snapshot(startedAt, new ArrayList<>(tasks.values()));
        } catch (IOException e) {
            Path backup = file.resolveSibling(file.getFileName() + ".bad-" + BACKUP_SUFFIX.format(Instant.now()));
            log.error("Corrupt registry file, moving aside: path={}, backup={}, error={}",
                file, backup, e.getMessage());
            try {
                Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new UncheckedIOException("Cannot move corrupt registry file " + file, moveError);
            }
            return Snapshot.empty();
        }
    }

    @Override
    public synchronized void write(Collection<Task> changed, RegistryStats stats) {
        for (Task task : changed) {
            tasks.put(task.key().toStringKey(), task);
        }
        if (startedAt == null) {
            startedAt = stats.startedAt();
        }
        Document document = new Document(startedAt, stats.updatedAt(), stats, tasks);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist registry to " + file, e);
        }
    }

    @Override
    public String describe() {
        return "json:" + file.toAbsolutePath();
    }

    @Override
    public void close() {
        // every write is already on disk
    }

    record Document(Instant startedAt, Instant updatedAt, RegistryStats statistics, Map<String, Task> tasks) {
    }
}
