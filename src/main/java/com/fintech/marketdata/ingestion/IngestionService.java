package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.config.IngestionProperties;
import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.registry.TaskRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Operator facade: start a run for a category/timeframe subset, resume
 * failures, repair stale claims and report progress.
 *
 * Runs execute one at a time on a background thread; the report of the last
 * finished run is kept for status queries.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final IngestionOrchestrator orchestrator;
    private final TaskRegistry registry;
    private final SymbolUniverse universe;
    private final IngestionProperties properties;
    private final Clock clock;
    private final ExecutorService runner;

    private Future<RunReport> activeRun;
    private volatile RunReport lastReport;

    public IngestionService(
            IngestionOrchestrator orchestrator,
            SymbolUniverse universe,
            IngestionProperties properties,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.registry = orchestrator.registry();
        this.universe = universe;
        this.properties = properties;
        this.clock = clock;
        this.runner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ingest-runner");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Generates tasks for the request, fails stale claims and starts a run in the background.
     *
     * @return Registry statistics after generation
     * @throws RunInProgressException if a run is active
     * @throws IllegalArgumentException on unknown categories or timeframes
     */
    public synchronized RegistryStats start(RunRequest request) {
        requireIdle();
        RegistryStats stats = prepare(request);
        activeRun = runner.submit(() -> execute(workers(request.workers()), incremental(request.incremental())));
        return stats;
    }

    /**
     * Same as {@link #start} but blocks until the run finishes.
     */
    public RunReport startAndWait(RunRequest request) throws InterruptedException {
        Future<RunReport> run;
        synchronized (this) {
            requireIdle();
            prepare(request);
            run = runner.submit(() -> execute(workers(request.workers()), incremental(request.incremental())));
            activeRun = run;
        }
        return await(run);
    }

    /**
     * Re-queues failed tasks and starts a run in the background.
     *
     * @return Number of tasks re-queued
     */
    public synchronized int resume(Integer workers, Boolean incremental) {
        requireIdle();
        int requeued = registry.resumeFailed();
        activeRun = runner.submit(() -> execute(workers(workers), incremental(incremental)));
        return requeued;
    }

    /** Fails in-progress tasks older than the stale threshold so they can be resumed. */
    public synchronized int repair() {
        requireIdle();
        return registry.repairStale(properties.getRegistry().getStaleThreshold());
    }

    public void stop() {
        orchestrator.stop();
    }

    /**
     * Progress snapshot. While a run is active the ETA uses that run's own
     * completion rate; otherwise it falls back to the registry's lifetime figures.
     */
    public IngestionStatus status() {
        RegistryStats stats = registry.stats();
        Optional<RunProgress> progress = orchestrator.progress();
        Optional<Duration> remaining = progress.isPresent()
            ? stats.estimateRemaining(Duration.between(progress.get().startedAt(), clock.instant()),
                progress.get().completed())
            : stats.estimateRemaining(Duration.between(stats.startedAt(), clock.instant()));
        Long eta = remaining.map(Duration::getSeconds).orElse(null);
        return new IngestionStatus(isRunning(), stats, eta, registry.failureBreakdown(), lastReport);
    }

    public Optional<RunReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public synchronized boolean isRunning() {
        return activeRun != null && !activeRun.isDone();
    }

    /** Waits for the active run, if any. */
    public Optional<RunReport> awaitCurrentRun() throws InterruptedException {
        Future<RunReport> run;
        synchronized (this) {
            run = activeRun;
        }
        return run == null ? Optional.empty() : Optional.of(await(run));
    }

    @PreDestroy
    public void shutdown() {
        orchestrator.stop();
        runner.shutdownNow();
    }

    private RegistryStats prepare(RunRequest request) {
        List<String> categories = request.categories().isEmpty() ? universe.categories() : request.categories();
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("No categories requested and none found in the symbol universe");
        }
        List<String> codes = request.timeframes().isEmpty()
            ? properties.getDownload().getTimeframes()
            : request.timeframes();
        List<Timeframe> timeframes = codes.stream().map(Timeframe::fromCode).distinct().toList();
        DateWindow window = request.from() != null && request.to() != null
            ? new DateWindow(request.from(), request.to())
            : null;

        Map<String, List<String>> symbols = universe.symbols(categories);
        registry.repairStale(properties.getRegistry().getStaleThreshold());
        RegistryStats stats = registry.generate(symbols, timeframes, window);
        log.info("Run prepared: categories={}, timeframes={}, pending={}, total={}",
            categories, codes, stats.pending(), stats.total());
        return stats;
    }

    private RunReport execute(int workers, boolean incremental) {
        try {
            RunReport report = orchestrator.run(workers, incremental);
            lastReport = report;
            return report;
        } catch (RuntimeException e) {
            log.error("Ingestion run aborted", e);
            throw e;
        }
    }

    private RunReport await(Future<RunReport> run) throws InterruptedException {
        try {
            return run.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Ingestion run failed", cause);
        }
    }

    private void requireIdle() {
        if (isRunning() || orchestrator.isRunning()) {
            throw new RunInProgressException();
        }
    }

    private int workers(Integer requested) {
        return requested != null ? requested : properties.getWorker().getCount();
    }

    private boolean incremental(Boolean requested) {
        return requested != null ? requested : properties.getDownload().isIncremental();
    }
}
