package com.fintech.marketdata.registry;

import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.ErrorCategory;
import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Task;
import com.fintech.marketdata.domain.TaskStatus;
import com.fintech.marketdata.domain.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable record of what ingestion work exists and what remains.
 *
 * All state transitions run under one lock and are written through to the
 * {@link TaskStore} before the method returns, so two workers never claim the
 * same task and a crash loses at most the claims in flight. Tasks are claimed
 * in creation order.
 *
 * Thread-safe.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private static final Comparator<Task> CLAIM_ORDER = Comparator
        .comparing(Task::createdAt)
        .thenComparing(Task::key);

    private final TaskStore store;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private Instant startedAt;

    public TaskRegistry(TaskStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        TaskStore.Snapshot snapshot = store.load();
        snapshot.tasks().stream()
            .sorted(CLAIM_ORDER)
            .forEach(task -> tasks.put(task.key().toStringKey(), task));
        this.startedAt = snapshot.startedAt() != null ? snapshot.startedAt() : clock.instant();
        RegistryStats stats = stats();
        log.info("Task registry ready: store={}, total={}, pending={}, inProgress={}, completed={}, failed={}",
            store.describe(), stats.total(), stats.pending(), stats.inProgress(), stats.completed(), stats.failed());
    }

    /**
     * Adds a pending task for every (category, symbol, timeframe) not yet known.
     * Existing tasks keep their status whatever it is.
     *
     * @param symbolsByCategory Symbols per category
     * @param timeframes Timeframes to cover for every symbol
     * @param window Optional date window for the new tasks; null uses the run default
     * @return Statistics over the merged registry
     */
    public RegistryStats generate(Map<String, ? extends Collection<String>> symbolsByCategory,
                                  Collection<Timeframe> timeframes,
                                  DateWindow window) {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Task> added = new ArrayList<>();
            for (Map.Entry<String, ? extends Collection<String>> category : symbolsByCategory.entrySet()) {
                for (String symbol : category.getValue()) {
                    for (Timeframe timeframe : timeframes) {
                        SeriesKey key = new SeriesKey(category.getKey(), symbol, timeframe);
                        if (!tasks.containsKey(key.toStringKey())) {
                            added.add(Task.pending(key, window, now));
                        }
                    }
                }
            }
            added.sort(CLAIM_ORDER);
            for (Task task : added) {
                tasks.put(task.key().toStringKey(), task);
            }
            RegistryStats stats = persist(added, now);
            log.info("Generated tasks: added={}, total={}, categories={}, timeframes={}",
                added.size(), stats.total(), symbolsByCategory.keySet(), timeframes);
            return stats;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically moves the oldest pending task to in-progress.
     *
     * @return The claimed task, or empty when nothing is pending
     */
    public Optional<Task> claimNext() {
        lock.lock();
        try {
            for (Task task : tasks.values()) {
                if (task.status() == TaskStatus.PENDING) {
                    Instant now = clock.instant();
                    Task claimed = replace(task.claimed(now));
                    persist(List.of(claimed), now);
                    return Optional.of(claimed);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks an in-progress task completed.
     *
     * @throws IllegalStateException if the task is unknown or not in progress
     */
    public Task complete(Task task, long recordsWritten) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Task done = replace(requireInProgress(task).completed(recordsWritten, now));
            persist(List.of(done), now);
            return done;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks an in-progress task failed, incrementing its attempt count.
     * The task stays failed until {@link #resumeFailed()}.
     */
    public Task fail(Task task, String error, ErrorCategory category) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Task failed = replace(requireInProgress(task).failed(error, category, now));
            persist(List.of(failed), now);
            log.debug("Task failed: key={}, category={}, attempts={}", failed.key(), category, failed.attemptCount());
            return failed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an in-progress task to pending without counting an attempt.
     * Used when dispatch is halted before the task could finish.
     */
    public Task release(Task task) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Task released = replace(requireInProgress(task).requeued(now));
            persist(List.of(released), now);
            return released;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves every failed task back to pending.
     *
     * @return Number of tasks re-queued
     */
    public int resumeFailed() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Task> requeued = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (task.status() == TaskStatus.FAILED) {
                    requeued.add(task.requeued(now));
                }
            }
            requeued.forEach(this::replace);
            persist(requeued, now);
            log.info("Resumed failed tasks: count={}", requeued.size());
            return requeued.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails in-progress tasks that have not changed for longer than the threshold.
     * Such tasks were claimed by a process that died; once failed they can be resumed.
     *
     * @return Number of tasks repaired
     */
    public int repairStale(Duration threshold) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant cutoff = now.minus(threshold);
            List<Task> repaired = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (task.status() == TaskStatus.IN_PROGRESS && task.updatedAt().isBefore(cutoff)) {
                    repaired.add(task.failed("Stale in-progress task since " + task.updatedAt(), ErrorCategory.STALE, now));
                }
            }
            repaired.forEach(this::replace);
            persist(repaired, now);
            if (!repaired.isEmpty()) {
                log.warn("Repaired stale in-progress tasks: count={}, threshold={}", repaired.size(), threshold);
            }
            return repaired.size();
        } finally {
            lock.unlock();
        }
    }

    /** Returns counts recomputed from current task statuses. */
    public RegistryStats stats() {
        lock.lock();
        try {
            Instant updatedAt = tasks.values().stream()
                .map(Task::updatedAt)
                .max(Comparator.naturalOrder())
                .orElse(startedAt);
            return RegistryStats.of(tasks.values(), startedAt, updatedAt);
        } finally {
            lock.unlock();
        }
    }

    /** Returns the number of failed tasks per error category. */
    public Map<ErrorCategory, Long> failureBreakdown() {
        lock.lock();
        try {
            Map<ErrorCategory, Long> breakdown = new EnumMap<>(ErrorCategory.class);
            for (Task task : tasks.values()) {
                if (task.status() == TaskStatus.FAILED) {
                    ErrorCategory category = task.errorCategory() != null ? task.errorCategory() : ErrorCategory.UNKNOWN;
                    breakdown.merge(category, 1L, Long::sum);
                }
            }
            return breakdown;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> find(SeriesKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(key.toStringKey()));
        } finally {
            lock.unlock();
        }
    }

    /** Returns a snapshot of all tasks in claim order. */
    public List<Task> tasks() {
        lock.lock();
        try {
            return List.copyOf(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    private Task requireInProgress(Task task) {
        Task current = tasks.get(task.key().toStringKey());
        if (current == null) {
            throw new IllegalStateException("Unknown task " + task.key());
        }
        if (current.status() != TaskStatus.IN_PROGRESS) {
            throw new IllegalStateException("Task " + task.key() + " is " + current.status() + ", not IN_PROGRESS");
        }
        return current;
    }

    private Task replace(Task task) {
        tasks.put(task.key().toStringKey(), task);
        return task;
    }

    private RegistryStats persist(Collection<Task> changed, Instant now) {
        RegistryStats stats = RegistryStats.of(tasks.values(), startedAt, now);
        if (!changed.isEmpty()) {
            store.write(changed, stats);
        }
        return stats;
    }
}
