package com.fintech.marketdata.loader;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.store.BarStore;
import com.fintech.marketdata.store.Gap;
import com.fintech.marketdata.store.ValidationReport;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-side access to stored history for downstream consumers.
 *
 * Responsibilities:
 * - Catalogue of categories, symbols and timeframes
 * - Bounded and unbounded series loads
 * - Explicit "not found" for unknown series instead of empty data
 * - Circuit breaker around store access
 *
 * Holds no state of its own.
 */
@Service
public class HistoryLoader {

    private static final Logger log = LoggerFactory.getLogger(HistoryLoader.class);

    private final BarStore store;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);

    public HistoryLoader(
            BarStore store,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("bar-store");

        meterRegistry.gauge("history.loader.validation.errors", validationErrors);
        meterRegistry.gauge("history.loader.errors", serviceErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    public List<String> availableCategories() {
        return guarded("categories", store::categories);
    }

    public List<String> availableSymbols(String category) {
        String checked = segment(category, "Category");
        return guarded("symbols", () -> store.symbols(checked));
    }

    public List<Timeframe> availableTimeframes(String category, String symbol) {
        String checkedCategory = segment(category, "Category");
        String checkedSymbol = segment(symbol, "Symbol");
        return guarded("timeframes", () -> store.timeframes(checkedCategory, checkedSymbol));
    }

    /**
     * Loads a series, optionally bounded.
     *
     * @param from Lower bound (epoch seconds, inclusive), null for unbounded
     * @param to Upper bound (epoch seconds, inclusive), null for unbounded
     * @return Sorted bars, empty list when the series exists but has nothing in range,
     *         or an empty Optional when the series does not exist
     * @throws ValidationException if arguments are invalid
     * @throws ServiceException if the store fails
     */
    public Optional<List<Bar>> load(String category, String symbol, Timeframe timeframe, Long from, Long to) {
        SeriesKey key = key(category, symbol, timeframe);
        if (from != null && to != null && from > to) {
            validationErrors.incrementAndGet();
            throw new ValidationException("From time must not be after to time");
        }
        return guarded("load", () -> {
            if (!store.exists(key)) {
                log.debug("Series not found: key={}", key);
                return Optional.empty();
            }
            List<Bar> bars = store.readRange(key, from, to);
            if (bars.size() > 500_000) {
                log.warn("Large result set: {} bars for key={}", bars.size(), key);
            }
            return Optional.of(bars);
        });
    }

    /**
     * Loads several symbols of one category. Symbols that do not exist are left out.
     *
     * @return Bars per symbol, in request order
     */
    public Map<String, List<Bar>> loadMultiple(String category, List<String> symbols, Timeframe timeframe,
                                               Long from, Long to) {
        Map<String, List<Bar>> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            load(category, symbol, timeframe, from, to).ifPresent(bars -> result.put(symbol, bars));
        }
        return result;
    }

    /** Returns the stored extent of a series, empty when it does not exist or holds no bars. */
    public Optional<Coverage> coverage(String category, String symbol, Timeframe timeframe) {
        SeriesKey key = key(category, symbol, timeframe);
        return guarded("coverage", () -> {
            List<Bar> bars = store.readRange(key, null, null);
            if (bars.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Coverage(bars.get(0).timestamp(), bars.get(bars.size() - 1).timestamp(),
                bars.size(), store.partitions(key).size()));
        });
    }

    /** Validates a stored series; empty when it does not exist. */
    public Optional<ValidationReport> validate(String category, String symbol, Timeframe timeframe) {
        SeriesKey key = key(category, symbol, timeframe);
        return guarded("validate", () -> store.exists(key) ? Optional.of(store.validate(key)) : Optional.empty());
    }

    /** Finds missing stretches in a stored series; empty when it does not exist. */
    public Optional<List<Gap>> gaps(String category, String symbol, Timeframe timeframe, Long from, Long to) {
        SeriesKey key = key(category, symbol, timeframe);
        return guarded("gaps", () -> store.exists(key) ? Optional.of(store.findGaps(key, from, to)) : Optional.empty());
    }

    /** Returns circuit breaker state for monitoring. */
    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private SeriesKey key(String category, String symbol, Timeframe timeframe) {
        if (timeframe == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Timeframe cannot be null");
        }
        return new SeriesKey(segment(category, "Category"), segment(symbol, "Symbol"), timeframe);
    }

    private String segment(String value, String name) {
        try {
            return SeriesKey.requireSegment(value, name);
        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());
        }
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting {}", operation);
            throw new ServiceException("Bar store circuit breaker is open. Store is recovering from errors.", e);
        } catch (RuntimeException e) {
            serviceErrors.incrementAndGet();
            log.error("Store error during {}: {}", operation, e.getMessage(), e);
            throw new ServiceException("Failed to " + operation + " from bar store", e);
        }
    }

    /**
     * Caller supplied invalid arguments.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Store or infrastructure failure.
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
