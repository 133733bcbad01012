package com.fintech.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.fetch.ConfiguredCredentialsProvider;
import com.fintech.marketdata.fetch.CredentialsProvider;
import com.fintech.marketdata.fetch.FyersHistoryClient;
import com.fintech.marketdata.fetch.HistoryClient;
import com.fintech.marketdata.fetch.HistoryFetcher;
import com.fintech.marketdata.fetch.SimulatedHistoryClient;
import com.fintech.marketdata.ingestion.BackoffPolicy;
import com.fintech.marketdata.ingestion.CsvSymbolUniverse;
import com.fintech.marketdata.ingestion.IngestionOrchestrator;
import com.fintech.marketdata.ingestion.OrchestratorSettings;
import com.fintech.marketdata.ingestion.Sleeper;
import com.fintech.marketdata.ingestion.SymbolUniverse;
import com.fintech.marketdata.registry.ChronicleMapTaskStore;
import com.fintech.marketdata.registry.JsonFileTaskStore;
import com.fintech.marketdata.registry.TaskRegistry;
import com.fintech.marketdata.registry.TaskStore;
import com.fintech.marketdata.store.BarStore;
import com.fintech.marketdata.store.PartitionedCsvBarStore;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;

/**
 * Spring configuration for the ingestion pipeline. Every component is a plain
 * object wired here from {@link IngestionProperties}.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public BarStore barStore(IngestionProperties properties) {
        return new PartitionedCsvBarStore(Path.of(properties.getStorage().getBasePath()));
    }

    @Bean(destroyMethod = "close")
    public TaskStore taskStore(IngestionProperties properties) {
        IngestionProperties.Registry registry = properties.getRegistry();
        String backend = registry.getBackend().trim().toLowerCase();
        switch (backend) {
            case "json":
                return new JsonFileTaskStore(Path.of(registry.getPath()));
            case "chronicle-map":
                return new ChronicleMapTaskStore(new File(registry.getPath()), registry.getMaxEntries());
            default:
                throw new IllegalArgumentException(
                    "Unsupported registry backend '" + registry.getBackend() + "'. Allowed: json, chronicle-map");
        }
    }

    @Bean
    public TaskRegistry taskRegistry(TaskStore taskStore, Clock clock) {
        return new TaskRegistry(taskStore, clock);
    }

    @Bean
    public CredentialsProvider credentialsProvider(IngestionProperties properties) {
        IngestionProperties.Fetch fetch = properties.getFetch();
        Path tokenFile = fetch.getTokenFile() != null ? Path.of(fetch.getTokenFile()) : null;
        return new ConfiguredCredentialsProvider(fetch.getAppId(), fetch.getAccessToken(), tokenFile);
    }

    @Bean
    public HistoryClient historyClient(
            IngestionProperties properties,
            RestClient.Builder restClientBuilder,
            CredentialsProvider credentialsProvider,
            ObjectMapper objectMapper) {
        IngestionProperties.Fetch fetch = properties.getFetch();
        String provider = fetch.getProvider().trim().toLowerCase();
        if ("simulated".equals(provider)) {
            log.warn("Using simulated history provider; no external calls will be made");
            return new SimulatedHistoryClient(ZoneId.of(fetch.getMarketZone()));
        }
        if (!"fyers".equals(provider)) {
            throw new IllegalArgumentException("Unsupported provider '" + fetch.getProvider() + "'. Allowed: fyers, simulated");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) fetch.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) fetch.getReadTimeout().toMillis());
        RestClient restClient = restClientBuilder
            .baseUrl(fetch.getBaseUrl())
            .requestFactory(requestFactory)
            .build();
        return new FyersHistoryClient(restClient, credentialsProvider, objectMapper,
            fetch.getSymbolFormat(), new HashSet<>(fetch.getContinuousCategories()));
    }

    @Bean
    public RateLimiter historyRateLimiter(RateLimiterRegistry rateLimiterRegistry, IngestionProperties properties) {
        IngestionProperties.Fetch.RateLimit limit = properties.getFetch().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(limit.getCallsPerSecond())
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(limit.getAcquireTimeout())
            .build();
        return rateLimiterRegistry.rateLimiter("history-api", config);
    }

    @Bean
    public HistoryFetcher historyFetcher(
            HistoryClient historyClient,
            IngestionProperties properties,
            Clock clock,
            RateLimiter historyRateLimiter,
            MeterRegistry meterRegistry) {
        Map<Timeframe, Integer> windowDays = new EnumMap<>(Timeframe.class);
        properties.getFetch().getMaxWindowDays()
            .forEach((code, days) -> windowDays.put(Timeframe.fromCode(code), days));
        return new HistoryFetcher(historyClient, windowDays, ZoneId.of(properties.getFetch().getMarketZone()),
            clock, historyRateLimiter, meterRegistry);
    }

    @Bean
    public BackoffPolicy backoffPolicy(IngestionProperties properties) {
        IngestionProperties.Worker worker = properties.getWorker();
        return BackoffPolicy.builder()
            .initialDelay(worker.getInitialBackoff())
            .maxDelay(worker.getMaxBackoff())
            .multiplier(worker.getBackoffMultiplier())
            .maxAttempts(worker.getMaxAttempts())
            .jitter(worker.getJitter())
            .build();
    }

    @Bean
    public IngestionOrchestrator ingestionOrchestrator(
            TaskRegistry taskRegistry,
            HistoryFetcher historyFetcher,
            BarStore barStore,
            BackoffPolicy backoffPolicy,
            IngestionProperties properties,
            Clock clock,
            Sleeper sleeper,
            MeterRegistry meterRegistry) {
        IngestionProperties.Worker worker = properties.getWorker();
        OrchestratorSettings settings = new OrchestratorSettings(
            worker.getMinCallInterval(),
            worker.getRateLimitCooldown(),
            worker.getMaxRateLimitPauses(),
            properties.getDownload().getLookbackDays(),
            properties.getDownload().isIncremental());
        return new IngestionOrchestrator(taskRegistry, historyFetcher, barStore, backoffPolicy, settings,
            clock, sleeper, meterRegistry);
    }

    @Bean
    public SymbolUniverse symbolUniverse(IngestionProperties properties) {
        return new CsvSymbolUniverse(Path.of(properties.getDownload().getSymbolsDir()));
    }
}
