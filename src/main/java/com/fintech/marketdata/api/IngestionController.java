package com.fintech.marketdata.api;

import com.fintech.marketdata.domain.RegistryStats;
import com.fintech.marketdata.ingestion.IngestionService;
import com.fintech.marketdata.ingestion.IngestionStatus;
import com.fintech.marketdata.ingestion.RunReport;
import com.fintech.marketdata.ingestion.RunRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for bulk downloads.
 */
@RestController
@RequestMapping("/api/v1/ingestion")
@Validated
@Tag(name = "Ingestion", description = "Start, resume and monitor bulk downloads")
public class IngestionController {

    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionService service;

    public IngestionController(IngestionService service) {
        this.service = service;
    }

    @Operation(
        summary = "Start a run",
        description = "Generates missing tasks for the requested categories and timeframes, fails stale claims and starts the workers."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Run started"),
        @ApiResponse(responseCode = "400", description = "Unknown category or timeframe"),
        @ApiResponse(responseCode = "409", description = "A run is already in progress")
    })
    @PostMapping("/runs")
    public ResponseEntity<RegistryStats> start(@Valid @RequestBody RunRequest request) {
        log.info("Run requested: categories={}, timeframes={}, workers={}",
            request.categories(), request.timeframes(), request.workers());
        return ResponseEntity.accepted().body(service.start(request));
    }

    @Operation(summary = "Resume failed tasks", description = "Moves failed tasks back to pending and starts the workers.")
    @PostMapping("/resume")
    public ResponseEntity<Map<String, Integer>> resume(
            @RequestParam(required = false) @Min(1) @Max(64) Integer workers,
            @RequestParam(required = false) Boolean incremental) {
        int requeued = service.resume(workers, incremental);
        return ResponseEntity.accepted().body(Map.of("requeued", requeued));
    }

    @Operation(summary = "Fail stale in-progress tasks so they can be resumed")
    @PostMapping("/repair")
    public ResponseEntity<Map<String, Integer>> repair() {
        return ResponseEntity.ok(Map.of("repaired", service.repair()));
    }

    @Operation(summary = "Stop the active run", description = "Workers stop claiming; in-flight tasks return to pending.")
    @PostMapping("/stop")
    public ResponseEntity<Void> stop() {
        service.stop();
        return ResponseEntity.accepted().build();
    }

    @Operation(summary = "Registry progress, ETA and failure breakdown")
    @GetMapping("/status")
    public ResponseEntity<IngestionStatus> status() {
        return ResponseEntity.ok(service.status());
    }

    @Operation(summary = "Report of the last finished run")
    @GetMapping("/runs/last")
    public ResponseEntity<RunReport> lastRun() {
        return service.lastReport()
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new SeriesNotFoundException("No run has finished yet"));
    }
}
