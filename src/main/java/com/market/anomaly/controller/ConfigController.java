package com.market.anomaly.controller;

import com.market.anomaly.model.AssetThresholds;
import com.market.anomaly.model.ThresholdConfig;
import com.market.anomaly.service.MarketQueryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Detection threshold configuration and per-asset resolution")
public class ConfigController {

    private final MarketQueryFacade facade;

    public ConfigController(MarketQueryFacade facade) {
        this.facade = facade;
    }

    @Operation(summary = "Get the raw threshold document")
    @GetMapping("/thresholds")
    public ResponseEntity<ThresholdConfig> getThresholdConfig() {
        return ResponseEntity.ok(facade.thresholdConfig());
    }

    @Operation(summary = "Get resolved thresholds for every configured asset",
            description = "Union of tier members and override symbols, sorted by symbol.")
    @GetMapping("/thresholds/assets")
    public ResponseEntity<List<AssetThresholds>> getAllThresholds() {
        return ResponseEntity.ok(facade.allThresholds());
    }

    @Operation(summary = "Get resolved thresholds for one asset",
            description = "Unknown symbols resolve against the moderate tier.")
    @GetMapping("/thresholds/{symbol}")
    public ResponseEntity<AssetThresholds> getThresholds(
            @Parameter(description = "Trading symbol", example = "DOGE-USD") @PathVariable String symbol) {
        return ResponseEntity.ok(facade.thresholdsFor(symbol));
    }

    @Operation(summary = "Reload the threshold document",
            description = "Re-reads the configured file. On failure the previous configuration stays active.")
    @PostMapping("/thresholds/reload")
    public ResponseEntity<ThresholdConfig> reload() {
        return ResponseEntity.ok(facade.reloadThresholds());
    }
}
