package com.market.anomaly.controller;

import com.market.anomaly.model.Anomaly;
import com.market.anomaly.model.AnomalyStats;
import com.market.anomaly.model.PagedResponse;
import com.market.anomaly.service.MarketQueryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Browse detected price/volume anomalies with their narratives")
public class AnomalyController {

    private static final Logger log = LoggerFactory.getLogger(AnomalyController.class);

    private final MarketQueryFacade facade;

    public AnomalyController(MarketQueryFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
               description = "Paginated, newest first. Filters combine with AND; symbol takes precedence over symbols.")
    public ResponseEntity<PagedResponse<Anomaly>> getAnomalies(
            @Parameter(description = "Page number (1-based)") @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size, clamped to [1, 100]") @RequestParam(required = false) Integer limit,
            @Parameter(description = "Single symbol filter", example = "BTC-USD") @RequestParam(required = false) String symbol,
            @Parameter(description = "Comma-separated symbols", example = "BTC-USD,ETH-USD") @RequestParam(required = false) String symbols,
            @Parameter(description = "PRICE_SPIKE, PRICE_DROP, VOLUME_SPIKE or COMBINED") @RequestParam(required = false) String anomalyType,
            @Parameter(description = "NOT_GENERATED, PENDING, VALID or INVALID") @RequestParam(required = false) String validationStatus,
            @Parameter(description = "ISO-8601 lower bound (inclusive)") @RequestParam(required = false) String startDate,
            @Parameter(description = "ISO-8601 upper bound (inclusive)") @RequestParam(required = false) String endDate) {
        PagedResponse<Anomaly> response = facade.anomalies(page, limit, symbol, symbols,
                anomalyType, validationStatus, startDate, endDate);
        log.info("Anomaly list page {} returned {} of {}",
                response.meta().page(), response.data().size(), response.meta().total());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/latest")
    @Operation(summary = "Get anomalies detected after a timestamp",
               description = "Strictly after 'since', newest first, at most 50. Intended for polling.")
    public ResponseEntity<List<Anomaly>> getLatest(
            @Parameter(description = "ISO-8601 timestamp", example = "2024-01-15T10:00:00Z") @RequestParam String since,
            @Parameter(description = "Comma-separated symbols") @RequestParam(required = false) String symbols) {
        return ResponseEntity.ok(facade.latestAnomalies(since, symbols));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get anomaly statistics",
               description = "Totals by type and validation status, plus 24h and 7d counts")
    public ResponseEntity<AnomalyStats> getStats(
            @Parameter(description = "Comma-separated symbols") @RequestParam(required = false) String symbols) {
        return ResponseEntity.ok(facade.anomalyStats(symbols));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a single anomaly with its narrative")
    public ResponseEntity<Anomaly> getAnomaly(
            @Parameter(description = "Anomaly ID") @PathVariable String id) {
        return ResponseEntity.ok(facade.anomaly(id));
    }
}
