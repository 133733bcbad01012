package com.fintech.marketdata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the ingestion service.
 * Maps to 'ingestion.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private Storage storage = new Storage();
    private Registry registry = new Registry();
    private Fetch fetch = new Fetch();
    private Worker worker = new Worker();
    private Download download = new Download();
    private Cli cli = new Cli();

    @Data
    public static class Storage {
        private String basePath = "data/historical/raw";
    }

    @Data
    public static class Registry {
        /** json or chronicle-map */
        private String backend = "json";
        private String path = "data/historical/download_status.json";
        private long maxEntries = 500_000L;
        private Duration staleThreshold = Duration.ofMinutes(30);
    }

    @Data
    public static class Fetch {
        /** fyers or simulated */
        private String provider = "fyers";
        private String baseUrl = "https://api-t1.fyers.in/api/v3";
        private String appId;
        private String accessToken;
        private String tokenFile;
        private String symbolFormat = "NSE:%s-EQ";
        private List<String> continuousCategories = List.of("futures", "options", "derivatives", "fo");
        private String marketZone = "Asia/Kolkata";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(25);
        /** Calendar days per call, keyed by timeframe code. */
        private Map<String, Integer> maxWindowDays = defaultWindowDays();
        private RateLimit rateLimit = new RateLimit();

        private static Map<String, Integer> defaultWindowDays() {
            Map<String, Integer> days = new LinkedHashMap<>();
            days.put("1m", 100);
            days.put("5m", 100);
            days.put("15m", 100);
            days.put("30m", 100);
            days.put("60m", 100);
            days.put("1D", 366);
            return days;
        }

        @Data
        public static class RateLimit {
            private int callsPerSecond = 5;
            private Duration acquireTimeout = Duration.ofSeconds(30);
        }
    }

    @Data
    public static class Worker {
        private int count = 10;
        private Duration minCallInterval = Duration.ofMillis(200);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double backoffMultiplier = 1.5;
        private Duration jitter = Duration.ofMillis(300);
        private Duration rateLimitCooldown = Duration.ofSeconds(60);
        private int maxRateLimitPauses = 2;
    }

    @Data
    public static class Download {
        private int lookbackDays = 5 * 365;
        private List<String> timeframes = List.of("1D");
        private String symbolsDir = "data/consolidated_symbols";
        private boolean incremental = true;
    }

    @Data
    public static class Cli {
        /** start, resume, repair or status; empty disables the command-line runner */
        private String command;
        private List<String> categories = List.of();
        private List<String> timeframes = List.of();
        private Integer workers;
    }
}
