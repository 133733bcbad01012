package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.DateWindow;
import com.fintech.marketdata.domain.ErrorCategory;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Task;
import com.fintech.marketdata.domain.TaskStatus;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.domain.WriteMode;
import com.fintech.marketdata.fetch.AuthException;
import com.fintech.marketdata.fetch.HistoryClient;
import com.fintech.marketdata.fetch.HistoryFetcher;
import com.fintech.marketdata.fetch.RateLimitException;
import com.fintech.marketdata.fetch.SimulatedHistoryClient;
import com.fintech.marketdata.fetch.TransientFetchException;
import com.fintech.marketdata.registry.JsonFileTaskStore;
import com.fintech.marketdata.registry.TaskRegistry;
import com.fintech.marketdata.store.PartitionedCsvBarStore;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IngestionOrchestrator Tests")
class IngestionOrchestratorTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    // Fri 2024-03-01 .. Fri 2024-03-08: six trading days
    private static final DateWindow WINDOW = new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8));
    private static final SeriesKey AAA = new SeriesKey("nifty50", "AAA", Timeframe.D1);
    private static final SeriesKey BBB = new SeriesKey("nifty50", "BBB", Timeframe.D1);

    private Path workDir;
    private MutableClock clock;
    private ScriptedClient client;
    private TaskRegistry registry;
    private PartitionedCsvBarStore store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() throws IOException {
        workDir = Files.createDirectories(Path.of("target/test-orchestrator-" + System.nanoTime()));
        clock = new MutableClock(Instant.parse("2024-03-15T10:07:30Z"));
        client = new ScriptedClient();
        registry = new TaskRegistry(new JsonFileTaskStore(workDir.resolve("registry.json")), clock);
        store = new PartitionedCsvBarStore(workDir.resolve("raw"));
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(workDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private IngestionOrchestrator orchestrator(int dailyWindowDays, int maxRateLimitPauses, boolean incremental) {
        Map<Timeframe, Integer> windowDays = new EnumMap<>(Timeframe.class);
        for (Timeframe tf : Timeframe.values()) {
            windowDays.put(tf, tf.isIntraday() ? 100 : dailyWindowDays);
        }
        HistoryFetcher fetcher = new HistoryFetcher(client, windowDays, IST, clock,
            RateLimiter.ofDefaults("test-history"), meterRegistry);
        BackoffPolicy backoff = BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(10))
            .multiplier(2.0)
            .maxAttempts(3)
            .jitter(Duration.ZERO)
            .build();
        OrchestratorSettings settings = new OrchestratorSettings(
            Duration.ZERO, Duration.ofSeconds(60), maxRateLimitPauses, 30, incremental);
        return new IngestionOrchestrator(registry, fetcher, store, backoff, settings,
            clock, clock.sleeper(), meterRegistry);
    }

    private IngestionOrchestrator orchestrator() {
        return orchestrator(366, 2, false);
    }

    private void generate(String... symbols) {
        registry.generate(Map.of("nifty50", List.of(symbols)), List.of(Timeframe.D1), WINDOW);
    }

    private Task task(SeriesKey key) {
        return registry.find(key).orElseThrow();
    }

    @Test
    @DisplayName("All tasks complete and their bars are stored")
    void testHappyPath() {
        generate("AAA", "BBB");

        RunReport report = orchestrator().run(2);

        assertThat(report.tasksCompleted()).isEqualTo(2);
        assertThat(report.barsWritten()).isEqualTo(12);
        assertThat(report.halted()).isFalse();
        assertThat(report.after().completed()).isEqualTo(2);
        assertThat(task(AAA).recordsWritten()).isEqualTo(6);
        assertThat(store.readRange(AAA, null, null)).hasSize(6);
        assertThat(meterRegistry.counter("ingestion.tasks", "outcome", "completed").count()).isEqualTo(2.0);
        assertThat(registry.stats().inProgress()).isZero();
    }

    @Test
    @DisplayName("Re-running after completion fetches nothing and leaves the store unchanged")
    void testIdempotentResume() {
        generate("AAA", "BBB");
        IngestionOrchestrator orchestrator = orchestrator();
        orchestrator.run(2);
        List<Bar> stored = store.readRange(AAA, null, null);
        int calls = client.calls().size();

        generate("AAA", "BBB");
        RunReport second = orchestrator.run(2);

        assertThat(second.tasksCompleted()).isZero();
        assertThat(client.calls()).hasSize(calls);
        assertThat(store.readRange(AAA, null, null)).isEqualTo(stored);
    }

    @Test
    @DisplayName("Only unfinished tasks are processed after an interruption")
    void testResumeSkipsCompleted() {
        generate("AAA", "BBB");
        Task first = registry.claimNext().orElseThrow();
        registry.complete(first, 6);

        RunReport report = orchestrator().run(1);

        assertThat(report.tasksCompleted()).isEqualTo(1);
        assertThat(client.calls()).extracting(Call::symbol).containsExactly("BBB");
    }

    @Test
    @DisplayName("Transient failures are retried with backoff")
    void testTransientRetry() {
        generate("AAA");
        client.script("AAA", new TransientFetchException("HTTP 502"), new TransientFetchException("HTTP 503"));

        RunReport report = orchestrator().run(1);

        assertThat(report.tasksCompleted()).isEqualTo(1);
        assertThat(report.retries()).isEqualTo(2);
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("Exhausted retries fail the task with the transient category")
    void testTransientExhausted() {
        generate("AAA");
        client.script("AAA", new TransientFetchException("HTTP 502"), new TransientFetchException("HTTP 502"),
            new TransientFetchException("HTTP 502"));

        RunReport report = orchestrator().run(1);

        assertThat(report.tasksFailed()).isEqualTo(1);
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task(AAA).errorCategory()).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(task(AAA).attemptCount()).isEqualTo(1);
        assertThat(report.failureBreakdown()).containsEntry(ErrorCategory.TRANSIENT, 1L);
    }

    @Test
    @DisplayName("Auth failure fails the task and stops all dispatch")
    void testAuthHalts() {
        generate("AAA", "BBB");
        client.script("AAA", new AuthException("Provider code -16: token expired"));

        RunReport report = orchestrator().run(1);

        assertThat(report.haltReason()).isEqualTo(HaltReason.AUTH_FAILURE);
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task(AAA).errorCategory()).isEqualTo(ErrorCategory.AUTH);
        assertThat(task(BBB).status()).isEqualTo(TaskStatus.PENDING);
        assertThat(client.calls()).hasSize(1);
    }

    @Test
    @DisplayName("Rate limit pauses dispatch and retries without spending an attempt")
    void testRateLimitPause() {
        generate("AAA");
        client.script("AAA", new RateLimitException("HTTP 429"));

        RunReport report = orchestrator().run(1);

        assertThat(report.tasksCompleted()).isEqualTo(1);
        assertThat(report.rateLimitHits()).isEqualTo(1);
        assertThat(report.retries()).isZero();
        assertThat(clock.totalSlept()).isEqualTo(Duration.ofSeconds(60));
        assertThat(task(AAA).attemptCount()).isZero();
    }

    @Test
    @DisplayName("Rate limit beyond the pause allowance halts and leaves work pending")
    void testRateLimitHalts() {
        generate("AAA", "BBB");
        client.script("AAA", new RateLimitException("HTTP 429"));

        RunReport report = orchestrator(366, 0, false).run(1);

        assertThat(report.haltReason()).isEqualTo(HaltReason.RATE_LIMIT_EXHAUSTED);
        assertThat(report.tasksReleased()).isEqualTo(1);
        assertThat(registry.stats().pending()).isEqualTo(2);
        assertThat(registry.stats().inProgress()).isZero();
        assertThat(task(AAA).attemptCount()).isZero();
    }

    @Test
    @DisplayName("Broken window is skipped, good windows stored, task failed for review")
    void testDataIntegrity() {
        generate("AAA");
        long firstDay = LocalDate.of(2024, 3, 1).atStartOfDay(IST).toEpochSecond();
        client.script("AAA", List.of(new Bar(firstDay, 100, 90, 95, 100, 1)));

        RunReport report = orchestrator(5, 2, false).run(1);

        assertThat(report.integrityWindows()).isEqualTo(1);
        assertThat(report.windowsFetched()).isEqualTo(1);
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task(AAA).errorCategory()).isEqualTo(ErrorCategory.DATA_INTEGRITY);
        // Mar 6..8 survives
        assertThat(store.readRange(AAA, null, null)).hasSize(3);
    }

    @Test
    @DisplayName("Incremental runs start at the day of the last stored bar")
    void testIncremental() {
        generate("AAA");
        long mar6 = LocalDate.of(2024, 3, 6).atStartOfDay(IST).toEpochSecond();
        store.write(AAA, List.of(new Bar(mar6, 10, 11, 9, 10, 1)), WriteMode.APPEND);

        orchestrator(366, 2, true).run(1);

        assertThat(client.calls()).hasSize(1);
        assertThat(client.calls().get(0).from()).isEqualTo(mar6);
        assertThat(store.readRange(AAA, null, null)).hasSize(3);
    }

    @Test
    @DisplayName("Tasks without data complete with zero bars")
    void testNoData() {
        generate("AAA");
        client.script("AAA", List.of());

        RunReport report = orchestrator().run(1);

        assertThat(report.noDataTasks()).isEqualTo(1);
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(store.exists(AAA)).isFalse();
    }

    @Test
    @DisplayName("Stop halts dispatch after the in-flight task")
    void testStop() {
        generate("AAA", "BBB");
        IngestionOrchestrator orchestrator = orchestrator();
        client.onCall(orchestrator::stop);

        RunReport report = orchestrator.run(1);

        assertThat(report.haltReason()).isEqualTo(HaltReason.STOP_REQUESTED);
        assertThat(task(AAA).status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task(BBB).status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    @DisplayName("Progress reports the active run's start and completions")
    void testProgress() {
        generate("AAA", "BBB");
        IngestionOrchestrator orchestrator = orchestrator();
        Instant startedAt = clock.instant();
        List<RunProgress> seen = Collections.synchronizedList(new ArrayList<>());
        client.onCall(() -> seen.add(orchestrator.progress().orElseThrow()));

        orchestrator.run(1);

        assertThat(seen).hasSize(2);
        assertThat(seen).extracting(RunProgress::startedAt).containsOnly(startedAt);
        assertThat(seen).extracting(RunProgress::completed).containsExactly(0L, 1L);
        assertThat(orchestrator.progress()).isEmpty();
    }

    @Test
    @DisplayName("Worker count must be positive")
    void testInvalidWorkers() {
        assertThatThrownBy(() -> orchestrator().run(0)).isInstanceOf(IllegalArgumentException.class);
    }

    record Call(String symbol, long from, long to) {
    }

    /**
     * Replays scripted responses per symbol, then falls back to simulated sessions.
     */
    static final class ScriptedClient implements HistoryClient {

        private final SimulatedHistoryClient simulated = new SimulatedHistoryClient(IST);
        private final Map<String, Deque<Object>> scripts = new ConcurrentHashMap<>();
        private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
        private volatile Runnable onCall = () -> { };

        void script(String symbol, Object... responses) {
            scripts.computeIfAbsent(symbol, s -> new ArrayDeque<>()).addAll(List.of(responses));
        }

        void onCall(Runnable hook) {
            this.onCall = hook;
        }

        List<Call> calls() {
            return calls;
        }

        @Override
        @SuppressWarnings("unchecked")
        public List<Bar> fetch(SeriesKey key, long fromEpoch, long toEpoch) {
            calls.add(new Call(key.symbol(), fromEpoch, toEpoch));
            onCall.run();
            Deque<Object> script = scripts.get(key.symbol());
            Object next;
            synchronized (this) {
                next = script != null ? script.poll() : null;
            }
            if (next instanceof RuntimeException failure) {
                throw failure;
            }
            if (next instanceof List<?> bars) {
                return (List<Bar>) bars;
            }
            return simulated.fetch(key, fromEpoch, toEpoch);
        }
    }
}
