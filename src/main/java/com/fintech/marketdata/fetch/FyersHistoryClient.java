package com.fintech.marketdata.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@link HistoryClient} for the Fyers {@code /data/history} endpoint.
 *
 * Response body: {@code {"s":"ok","candles":[[ts,o,h,l,c,v],...]}}. Errors come
 * back either as HTTP status codes or as {@code {"s":"error","code":-16,...}}
 * with HTTP 200, so both are inspected.
 */
public class FyersHistoryClient implements HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(FyersHistoryClient.class);

    /** Provider codes for invalid, expired or missing tokens. */
    static final Set<Integer> AUTH_ERROR_CODES = Set.of(-8, -15, -16, -17, -300);
    static final int RATE_LIMIT_CODE = 429;

    private final RestClient restClient;
    private final CredentialsProvider credentials;
    private final ObjectMapper objectMapper;
    private final String symbolFormat;
    private final Set<String> continuousCategories;

    public FyersHistoryClient(
            RestClient restClient,
            CredentialsProvider credentials,
            ObjectMapper objectMapper,
            String symbolFormat,
            Set<String> continuousCategories) {
        this.restClient = restClient;
        this.credentials = credentials;
        this.objectMapper = objectMapper;
        this.symbolFormat = symbolFormat;
        this.continuousCategories = continuousCategories;
    }

    @Override
    public List<Bar> fetch(SeriesKey key, long fromEpoch, long toEpoch) {
        String providerSymbol = providerSymbol(key.symbol());
        int contFlag = continuousCategories.contains(key.category()) ? 1 : 0;
        String authorization = credentials.authorizationHeader();

        String body;
        try {
            body = restClient.get()
                .uri(uri -> uri.path("/data/history")
                    .queryParam("symbol", providerSymbol)
                    .queryParam("resolution", key.timeframe().resolution())
                    .queryParam("date_format", 0)
                    .queryParam("range_from", fromEpoch)
                    .queryParam("range_to", toEpoch)
                    .queryParam("cont_flag", contFlag)
                    .build())
                .header(HttpHeaders.AUTHORIZATION, authorization)
                .retrieve()
                .body(String.class);
        } catch (HttpStatusCodeException e) {
            throw classifyHttpError(providerSymbol, e.getStatusCode(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientFetchException("I/O error fetching " + providerSymbol + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransientFetchException("Request failed for " + providerSymbol + ": " + e.getMessage(), e);
        }
        return parse(providerSymbol, body);
    }

    String providerSymbol(String symbol) {
        if (symbol.contains(":")) {
            return symbol;
        }
        return String.format(symbolFormat, symbol);
    }

    private FetchException classifyHttpError(String symbol, HttpStatusCode status, String body, Exception cause) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return new AuthException("HTTP " + code + " for " + symbol + ": " + truncate(body));
        }
        if (code == RATE_LIMIT_CODE) {
            return new RateLimitException("HTTP 429 for " + symbol, cause);
        }
        Integer providerCode = providerCode(body);
        if (providerCode != null && AUTH_ERROR_CODES.contains(providerCode)) {
            return new AuthException("Provider code " + providerCode + " for " + symbol + ": " + truncate(body));
        }
        return new TransientFetchException("HTTP " + code + " for " + symbol + ": " + truncate(body), cause);
    }

    private List<Bar> parse(String symbol, String body) {
        if (body == null || body.isBlank()) {
            log.warn("Empty history response: symbol={}", symbol);
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable history response treated as no data: symbol={}, error={}", symbol, e.getOriginalMessage());
            return List.of();
        }

        String status = root.path("s").asText("");
        if ("no_data".equals(status)) {
            return List.of();
        }
        if (!"ok".equals(status)) {
            int code = root.path("code").asInt(0);
            String message = root.path("message").asText("unknown error");
            if (AUTH_ERROR_CODES.contains(code)) {
                throw new AuthException("Provider code " + code + " for " + symbol + ": " + message);
            }
            if (code == RATE_LIMIT_CODE) {
                throw new RateLimitException("Provider throttled " + symbol + ": " + message);
            }
            if (message.toLowerCase().contains("no data")) {
                return List.of();
            }
            throw new TransientFetchException("Provider error " + code + " for " + symbol + ": " + message);
        }

        JsonNode candles = root.get("candles");
        if (candles == null || !candles.isArray()) {
            log.debug("No candles element: symbol={}", symbol);
            return List.of();
        }

        List<Bar> bars = new ArrayList<>(candles.size());
        int skipped = 0;
        for (JsonNode row : candles) {
            if (!row.isArray() || row.size() < 6) {
                skipped++;
                continue;
            }
            // [timestamp, open, high, low, close, volume]
            bars.add(new Bar(
                row.get(0).asLong(),
                row.get(1).asDouble(),
                row.get(2).asDouble(),
                row.get(3).asDouble(),
                row.get(4).asDouble(),
                row.get(5).asLong()));
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed candle rows: symbol={}", skipped, symbol);
        }
        return bars;
    }

    private Integer providerCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code != null && code.canConvertToInt() ? code.asInt() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
