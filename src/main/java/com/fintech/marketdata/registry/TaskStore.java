package com.fintech.marketdata.registry;

import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.Task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Durable backing for the task registry.
 *
 * Implementations must have written the given tasks durably when
 * {@link #write} returns; the registry relies on this to survive a crash
 * with at most the in-flight claims lost.
 */
public interface TaskStore extends AutoCloseable {

    /**
     * Loads the persisted registry.
     *
     * @return Stored tasks and the registry start time; an empty registry if nothing was stored
     */
    Snapshot load();

    /**
     * Persists changed tasks together with the refreshed summary.
     *
     * @param changed Tasks inserted or updated since the last write
     * @param stats Summary recomputed over all tasks
     */
    void write(Collection<Task> changed, RegistryStats stats);

    /** Returns a short description for logs, e.g. the backing file. */
    String describe();

    @Override
    void close();

    /**
     * Persisted registry content.
     *
     * @param startedAt When the registry was first created, null if never persisted
     * @param tasks All stored tasks, in no particular order
     */
    record Snapshot(Instant startedAt, List<Task> tasks) {

        public static Snapshot empty() {
            return new Snapshot(null, List.of());
        }
    }
}
