package com.fintech.marketdata.api;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.loader.Coverage;
import com.fintech.marketdata.loader.HistoryLoader;
import com.fintech.marketdata.store.Gap;
import com.fintech.marketdata.store.ValidationReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over stored history.
 * Bars are returned in TradingView Lightweight Charts compatible format.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "History", description = "Stored OHLCV history and catalogue")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final HistoryLoader loader;
    private final MeterRegistry meterRegistry;

    public HistoryController(HistoryLoader loader, MeterRegistry meterRegistry) {
        this.loader = loader;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/history
     *
     * @param category Symbol group, e.g. nifty50
     * @param symbol Instrument symbol
     * @param timeframe Timeframe code
     * @param from Optional start (epoch seconds, inclusive)
     * @param to Optional end (epoch seconds, inclusive)
     */
    @Operation(
        summary = "Get stored OHLCV history",
        description = """
            Returns stored bars of one series, optionally bounded.

            **Timeframes:** 1m, 5m, 15m, 30m, 60m, 1D

            **Example Request:**
            ```
            GET /api/v1/history?category=nifty50&symbol=RELIANCE&timeframe=1D&from=1672531200&to=1675209599
            ```
            """,
        tags = {"History"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Bars of the series (status no_data when the range is empty)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = HistoryResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1672713000, 1672799400],
                          "o": [2550.0, 2562.5],
                          "h": [2575.1, 2570.0],
                          "l": [2541.3, 2549.9],
                          "c": [2562.5, 2551.2],
                          "v": [4123456, 3899001]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters (e.g. unsupported timeframe)",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Series not stored",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> getHistory(
            @Parameter(description = "Symbol group", example = "nifty50", required = true)
            @RequestParam @NotBlank(message = "Category is required and cannot be blank") String category,

            @Parameter(description = "Instrument symbol", example = "RELIANCE", required = true)
            @RequestParam @NotBlank(message = "Symbol is required and cannot be blank") String symbol,

            @Parameter(description = "Timeframe: 1m, 5m, 15m, 30m, 60m, 1D", example = "1D", required = true)
            @RequestParam @NotBlank(message = "Timeframe is required and cannot be blank") String timeframe,

            @Parameter(description = "Start time (Unix seconds, inclusive)", example = "1672531200")
            @RequestParam(required = false) @PositiveOrZero(message = "From timestamp cannot be negative") Long from,

            @Parameter(description = "End time (Unix seconds, inclusive)", example = "1675209599")
            @RequestParam(required = false) @PositiveOrZero(message = "To timestamp cannot be negative") Long to) {

        Timer.Sample sample = Timer.start(meterRegistry);
        Timeframe tf = Timeframe.fromCode(timeframe);
        try {
            if (from != null && to != null && from > to) {
                throw new IllegalArgumentException(
                    String.format("Invalid time range: 'from' (%d) must not be after 'to' (%d)", from, to));
            }
            List<Bar> bars = loader.load(category, symbol, tf, from, to)
                .orElseThrow(() -> notFound(category, symbol, tf));

            log.debug("History query: category={}, symbol={}, timeframe={}, from={}, to={}, results={}",
                category, symbol, tf.code(), from, to, bars.size());
            return ResponseEntity.ok(HistoryResponse.fromBars(bars));
        } finally {
            sample.stop(meterRegistry.timer("api.history.request.time", "timeframe", tf.code()));
        }
    }

    @Operation(summary = "List stored categories", tags = {"History"})
    @GetMapping("/categories")
    public ResponseEntity<List<String>> getCategories() {
        return ResponseEntity.ok(loader.availableCategories());
    }

    @Operation(summary = "List stored symbols of a category", tags = {"History"})
    @GetMapping("/categories/{category}/symbols")
    public ResponseEntity<List<String>> getSymbols(@PathVariable String category) {
        List<String> symbols = loader.availableSymbols(category);
        if (symbols.isEmpty()) {
            throw new SeriesNotFoundException("No stored category '" + category + "'");
        }
        return ResponseEntity.ok(symbols);
    }

    @Operation(summary = "List stored timeframes of a symbol", tags = {"History"})
    @GetMapping("/categories/{category}/symbols/{symbol}/timeframes")
    public ResponseEntity<List<String>> getTimeframes(@PathVariable String category, @PathVariable String symbol) {
        List<Timeframe> timeframes = loader.availableTimeframes(category, symbol);
        if (timeframes.isEmpty()) {
            throw new SeriesNotFoundException("No stored symbol '" + symbol + "' in category '" + category + "'");
        }
        return ResponseEntity.ok(timeframes.stream().map(Timeframe::code).toList());
    }

    @Operation(summary = "Stored extent of a series", tags = {"History"})
    @GetMapping("/coverage")
    public ResponseEntity<Coverage> getCoverage(
            @RequestParam @NotBlank String category,
            @RequestParam @NotBlank String symbol,
            @RequestParam @NotBlank String timeframe) {
        Timeframe tf = Timeframe.fromCode(timeframe);
        return ResponseEntity.ok(loader.coverage(category, symbol, tf)
            .orElseThrow(() -> notFound(category, symbol, tf)));
    }

    @Operation(
        summary = "Validate a stored series",
        description = "Checks missing columns, null values, duplicate timestamps and OHLC consistency without modifying data.",
        tags = {"History"}
    )
    @GetMapping("/validation")
    public ResponseEntity<ValidationReport> getValidation(
            @RequestParam @NotBlank String category,
            @RequestParam @NotBlank String symbol,
            @RequestParam @NotBlank String timeframe) {
        Timeframe tf = Timeframe.fromCode(timeframe);
        return ResponseEntity.ok(loader.validate(category, symbol, tf)
            .orElseThrow(() -> notFound(category, symbol, tf)));
    }

    @Operation(summary = "Missing stretches within trading sessions", tags = {"History"})
    @GetMapping("/gaps")
    public ResponseEntity<List<Gap>> getGaps(
            @RequestParam @NotBlank String category,
            @RequestParam @NotBlank String symbol,
            @RequestParam @NotBlank String timeframe,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to) {
        Timeframe tf = Timeframe.fromCode(timeframe);
        return ResponseEntity.ok(loader.gaps(category, symbol, tf, from, to)
            .orElseThrow(() -> notFound(category, symbol, tf)));
    }

    private static SeriesNotFoundException notFound(String category, String symbol, Timeframe timeframe) {
        return new SeriesNotFoundException(
            String.format("No stored series for category=%s, symbol=%s, timeframe=%s", category, symbol, timeframe.code()));
    }
}
