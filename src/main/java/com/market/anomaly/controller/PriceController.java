package com.market.anomaly.controller;

import com.market.anomaly.model.PriceHistory;
import com.market.anomaly.model.PriceSample;
import com.market.anomaly.service.MarketQueryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/prices")
@Tag(name = "Prices", description = "Price history with span-based aggregation")
public class PriceController {

    private final MarketQueryFacade facade;

    public PriceController(MarketQueryFacade facade) {
        this.facade = facade;
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Get price history",
               description = "Defaults to the last 24 hours. 'auto' picks 1m/5m/1h/1d from the requested span.")
    public ResponseEntity<PriceHistory> getPriceHistory(
            @Parameter(description = "Trading symbol", example = "BTC-USD") @PathVariable String symbol,
            @Parameter(description = "ISO-8601 start") @RequestParam(required = false) String startDate,
            @Parameter(description = "ISO-8601 end") @RequestParam(required = false) String endDate,
            @Parameter(description = "auto, 1m, 5m, 1h or 1d") @RequestParam(defaultValue = "auto") String aggregation) {
        return ResponseEntity.ok(facade.priceHistory(symbol, startDate, endDate, aggregation));
    }

    @GetMapping("/{symbol}/latest")
    @Operation(summary = "Get the latest price sample")
    public ResponseEntity<PriceSample> getLatestPrice(
            @Parameter(description = "Trading symbol", example = "BTC-USD") @PathVariable String symbol) {
        return ResponseEntity.ok(facade.latestPrice(symbol));
    }
}
