package com.market.anomaly.controller;

import com.market.anomaly.model.SymbolInfo;
import com.market.anomaly.model.SymbolStats;
import com.market.anomaly.service.MarketQueryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/symbols")
@Tag(name = "Symbols", description = "Supported symbols and per-symbol activity")
public class SymbolController {

    private final MarketQueryFacade facade;

    public SymbolController(MarketQueryFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    @Operation(summary = "List supported symbols with their resolved thresholds")
    public ResponseEntity<List<SymbolInfo>> getSymbols() {
        return ResponseEntity.ok(facade.symbols());
    }

    @GetMapping("/stats")
    @Operation(summary = "Get anomaly and price stats for every supported symbol")
    public ResponseEntity<List<SymbolStats>> getAllSymbolStats() {
        return ResponseEntity.ok(facade.allSymbolStats());
    }

    @GetMapping("/{symbol}/stats")
    @Operation(summary = "Get anomaly and price stats for a symbol")
    public ResponseEntity<SymbolStats> getSymbolStats(
            @Parameter(description = "Trading symbol", example = "ETH-USD") @PathVariable String symbol) {
        return ResponseEntity.ok(facade.symbolStats(symbol));
    }
}
