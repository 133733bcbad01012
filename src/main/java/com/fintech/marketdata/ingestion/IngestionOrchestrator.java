package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.ErrorCategory;
import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Task;
import com.fintech.marketdata.domain.WriteMode;
import com.fintech.marketdata.fetch.AuthException;
import com.fintech.marketdata.fetch.DataIntegrityException;
import com.fintech.marketdata.fetch.FetchException;
import com.fintech.marketdata.fetch.FetchRequest;
import com.fintech.marketdata.fetch.HistoryFetcher;
import com.fintech.marketdata.fetch.RateLimitException;
import com.fintech.marketdata.fetch.WindowRequest;
import com.fintech.marketdata.registry.TaskRegistry;
import com.fintech.marketdata.store.BarStore;
import com.fintech.marketdata.store.StoreException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the task registry to completion with a fixed pool of workers.
 *
 * Each worker loops: wait for the dispatch gate, claim a task, fetch its
 * windows in chronological order (retrying transient failures with backoff),
 * append each window to the store, then complete or fail the task. Workers
 * exit when nothing is left to claim or the gate halts.
 *
 * Failure handling:
 * - Auth failure fails the task and halts dispatch for everyone
 * - Rate limit pauses dispatch and retries the same window without spending an attempt
 * - Transient failure retries with backoff until attempts run out, then fails the task
 * - Broken window is skipped; the task still fails for review after its good windows are stored
 * - Halt while a task is in flight returns it to pending
 *
 * No task is left in progress when {@link #run(int)} returns.
 */
public class IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final TaskRegistry registry;
    private final HistoryFetcher fetcher;
    private final BarStore store;
    private final BackoffPolicy backoff;
    private final OrchestratorSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunContext currentRun;

    public IngestionOrchestrator(
            TaskRegistry registry,
            HistoryFetcher fetcher,
            BarStore store,
            BackoffPolicy backoff,
            OrchestratorSettings settings,
            Clock clock,
            Sleeper sleeper,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.fetcher = fetcher;
        this.store = store;
        this.backoff = backoff;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Runs with the configured settings. */
    public RunReport run(int workerCount) {
        return run(workerCount, settings.incremental());
    }

    /**
     * Processes pending tasks until the registry drains or dispatch halts.
     *
     * @param workerCount Concurrent workers, at least 1
     * @param incremental Fetch only from the last stored bar onwards
     * @return Summary of the run
     * @throws IllegalStateException if a run is already in progress
     */
    public RunReport run(int workerCount, boolean incremental) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1: " + workerCount);
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An ingestion run is already in progress");
        }
        try {
            DispatchGate gate = new DispatchGate(clock, settings.maxRateLimitPauses());
            Instant startedAt = clock.instant();
            RunContext context = new RunContext(gate, settings.withIncremental(incremental), startedAt);
            currentRun = context;
            RegistryStats before = registry.stats();
            log.info("Ingestion run starting: workers={}, incremental={}, pending={}, total={}",
                workerCount, incremental, before.pending(), before.total());

            executeWorkers(workerCount, context);

            RegistryStats after = registry.stats();
            RunReport report = new RunReport(startedAt, clock.instant(), workerCount, before, after,
                context.completed.get(), context.failed.get(), context.released.get(), context.noData.get(),
                context.barsWritten.get(), context.windowsFetched.get(), context.retries.get(),
                context.rateLimitHits.get(), context.integrityWindows.get(), registry.failureBreakdown(),
                gate.haltReason().orElse(null), gate.haltDetail().orElse(null));
            log.info("Ingestion run finished: elapsed={}, completed={}, failed={}, released={}, noData={}, bars={}, "
                    + "retries={}, rateLimitHits={}, pending={}, halt={}",
                report.elapsed(), report.tasksCompleted(), report.tasksFailed(), report.tasksReleased(),
                report.noDataTasks(), report.barsWritten(), report.retries(), report.rateLimitHits(),
                after.pending(), report.haltReason());
            return report;
        } finally {
            currentRun = null;
            running.set(false);
        }
    }

    /** Asks the current run to stop claiming. In-flight windows finish, their tasks return to pending. */
    public void stop() {
        RunContext run = currentRun;
        if (run != null) {
            run.gate.halt(HaltReason.STOP_REQUESTED, "Stop requested by operator");
        }
    }

    /** Start time and completions of the active run, empty when idle. */
    public Optional<RunProgress> progress() {
        RunContext run = currentRun;
        if (run == null) {
            return Optional.empty();
        }
        return Optional.of(new RunProgress(run.startedAt, run.completed.get()));
    }

    private void executeWorkers(int workerCount, RunContext context) {
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, workerThreadFactory());
        List<Future<?>> futures = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            futures.add(pool.submit(() -> workerLoop(context)));
        }
        pool.shutdown();
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.gate.halt(HaltReason.INTERRUPTED, "Orchestrator interrupted");
                pool.shutdownNow();
                awaitQuietly(pool);
                return;
            } catch (ExecutionException e) {
                log.error("Worker terminated unexpectedly", e.getCause());
            }
        }
    }

    private void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate within 30s after interrupt");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void workerLoop(RunContext context) {
        RequestPacer pacer = new RequestPacer(context.settings.minCallInterval(), clock, sleeper);
        try {
            while (context.gate.awaitOpen(sleeper)) {
                Task task = registry.claimNext().orElse(null);
                if (task == null) {
                    break;
                }
                processTask(task, pacer, context);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.gate.halt(HaltReason.INTERRUPTED, "Worker interrupted");
        }
        log.debug("Worker exiting: thread={}", Thread.currentThread().getName());
    }

    private void processTask(Task task, RequestPacer pacer, RunContext context) throws InterruptedException {
        SeriesKey key = task.key();
        boolean settled = false;
        try {
            List<WindowRequest> plan = plan(task, context.settings);
            long written = 0;
            DataIntegrityException integrityFailure = null;

            for (WindowRequest window : plan) {
                WindowOutcome outcome = fetchWithRetry(window, pacer, context);
                if (outcome.halted) {
                    registry.release(task);
                    context.released.incrementAndGet();
                    settled = true;
                    return;
                }
                if (outcome.failure instanceof DataIntegrityException integrity) {
                    context.integrityWindows.incrementAndGet();
                    integrityFailure = integrity;
                    continue;
                }
                if (outcome.failure != null) {
                    failTask(task, outcome.failure.getMessage(), outcome.failure.category(), context);
                    if (outcome.failure instanceof AuthException) {
                        context.gate.halt(HaltReason.AUTH_FAILURE, outcome.failure.getMessage());
                    }
                    settled = true;
                    return;
                }
                if (!outcome.bars.isEmpty()) {
                    written += store.write(key, outcome.bars, WriteMode.APPEND);
                }
            }

            if (integrityFailure != null) {
                failTask(task, integrityFailure.getMessage(), ErrorCategory.DATA_INTEGRITY, context);
            } else {
                registry.complete(task, written);
                context.completed.incrementAndGet();
                context.barsWritten.addAndGet(written);
                if (written == 0) {
                    context.noData.incrementAndGet();
                }
                meterRegistry.counter("ingestion.tasks", "outcome", "completed").increment();
                meterRegistry.counter("ingestion.bars.written").increment(written);
                log.info("Task completed: key={}, windows={}, bars={}", key, plan.size(), written);
            }
            settled = true;
        } catch (StoreException | IllegalArgumentException e) {
            failTask(task, e.getMessage(), ErrorCategory.STORAGE, context);
            settled = true;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing task: key={}", key, e);
            failTask(task, e.getClass().getSimpleName() + ": " + e.getMessage(), ErrorCategory.UNKNOWN, context);
            settled = true;
        } finally {
            if (!settled) {
                // interrupted mid-task
                registry.release(task);
                context.released.incrementAndGet();
            }
        }
    }

    private List<WindowRequest> plan(Task task, OrchestratorSettings runSettings) {
        LocalDate today = fetcher.today();
        DateWindow window = task.window()
            .orElseGet(() -> new DateWindow(today.minusDays(runSettings.lookbackDays()), today));
        LocalDate from = window.from();
        if (runSettings.incremental()) {
            OptionalLong last = store.lastTimestamp(task.key());
            if (last.isPresent()) {
                // re-fetch the day of the last bar so a partially stored day gets completed
                LocalDate lastDay = LocalDate.ofInstant(Instant.ofEpochSecond(last.getAsLong()), fetcher.marketZone());
                if (lastDay.isAfter(from)) {
                    from = lastDay;
                }
            }
        }
        if (from.isAfter(window.to())) {
            return List.of();
        }
        return fetcher.plan(FetchRequest.closedBars(task.key(), from, window.to()));
    }

    private WindowOutcome fetchWithRetry(WindowRequest window, RequestPacer pacer, RunContext context)
            throws InterruptedException {
        RetryState state = backoff.newState();
        while (true) {
            if (!context.gate.awaitOpen(sleeper)) {
                return WindowOutcome.HALTED;
            }
            if (!state.canAttempt(clock.instant())) {
                sleeper.sleep(state.delayUntilEligible(clock.instant()));
                continue;
            }
            pacer.awaitTurn();
            try {
                List<Bar> bars = fetcher.fetchWindow(window);
                state.recordSuccess();
                context.windowsFetched.incrementAndGet();
                return WindowOutcome.success(bars);
            } catch (RateLimitException e) {
                context.rateLimitHits.incrementAndGet();
                meterRegistry.counter("ingestion.rate_limit.hits").increment();
                if (!context.gate.onRateLimit(context.settings.rateLimitCooldown(), e.getMessage())) {
                    return WindowOutcome.HALTED;
                }
            } catch (DataIntegrityException e) {
                return WindowOutcome.failure(e);
            } catch (FetchException e) {
                RetryState.Phase phase = state.recordFailure(e, clock.instant());
                if (phase == RetryState.Phase.EXHAUSTED) {
                    log.warn("Window failed: window={}, category={}, attempts={}, error={}",
                        window, e.category(), state.attempts(), e.getMessage());
                    return WindowOutcome.failure(e);
                }
                context.retries.incrementAndGet();
                meterRegistry.counter("ingestion.retries", "category", e.category().name()).increment();
                log.debug("Retrying window: window={}, attempt={}, nextAt={}, error={}",
                    window, state.attempts(), state.nextEligibleAt(), e.getMessage());
            }
        }
    }

    private void failTask(Task task, String error, ErrorCategory category, RunContext context) {
        Task failed = registry.fail(task, error, category);
        context.failed.incrementAndGet();
        meterRegistry.counter("ingestion.tasks", "outcome", "failed", "category", category.name()).increment();
        log.warn("Task failed: key={}, category={}, attempts={}, error={}",
            failed.key(), category, failed.attemptCount(), error);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                log.error("Uncaught exception in worker thread {}", t.getName(), e));
            return thread;
        };
    }

    /** Per-run shared state. */
    private static final class RunContext {
        final DispatchGate gate;
        final OrchestratorSettings settings;
        final Instant startedAt;
        final AtomicLong completed = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final AtomicLong released = new AtomicLong();
        final AtomicLong noData = new AtomicLong();
        final AtomicLong barsWritten = new AtomicLong();
        final AtomicLong windowsFetched = new AtomicLong();
        final AtomicLong retries = new AtomicLong();
        final AtomicLong rateLimitHits = new AtomicLong();
        final AtomicLong integrityWindows = new AtomicLong();

        RunContext(DispatchGate gate, OrchestratorSettings settings, Instant startedAt) {
            this.gate = gate;
            this.settings = settings;
            this.startedAt = startedAt;
        }
    }

    private static final class WindowOutcome {
        static final WindowOutcome HALTED = new WindowOutcome(List.of(), null, true);

        final List<Bar> bars;
        final FetchException failure;
        final boolean halted;

        private WindowOutcome(List<Bar> bars, FetchException failure, boolean halted) {
            this.bars = bars;
            this.failure = failure;
            this.halted = halted;
        }

        static WindowOutcome success(List<Bar> bars) {
            return new WindowOutcome(bars, null, false);
        }

        static WindowOutcome failure(FetchException failure) {
            return new WindowOutcome(List.of(), failure, false);
        }
    }
}
