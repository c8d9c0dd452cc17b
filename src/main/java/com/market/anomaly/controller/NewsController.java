package com.market.anomaly.controller;

import com.market.anomaly.model.NewsArticle;
import com.market.anomaly.model.NewsCluster;
import com.market.anomaly.model.PagedResponse;
import com.market.anomaly.service.MarketQueryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/news")
@Tag(name = "News", description = "News articles linked to anomalies, and their clusters")
public class NewsController {

    private final MarketQueryFacade facade;

    public NewsController(MarketQueryFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    @Operation(summary = "List news articles",
               description = "Paginated, newest published first. Filters combine with AND.")
    public ResponseEntity<PagedResponse<NewsArticle>> getNews(
            @Parameter(description = "Page number (1-based)") @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size, clamped to [1, 100]") @RequestParam(required = false) Integer limit,
            @Parameter(description = "Only articles linked to this symbol's anomalies", example = "BTC-USD") @RequestParam(required = false) String symbol,
            @Parameter(description = "Only articles linked to this anomaly") @RequestParam(required = false) String anomalyId,
            @Parameter(description = "ISO-8601 lower bound on publish time (inclusive)") @RequestParam(required = false) String startDate,
            @Parameter(description = "ISO-8601 upper bound on publish time (inclusive)") @RequestParam(required = false) String endDate) {
        return ResponseEntity.ok(facade.news(page, limit, symbol, anomalyId, startDate, endDate));
    }

    @GetMapping("/clusters/{anomalyId}")
    @Operation(summary = "Get news clusters for an anomaly",
               description = "Ordered by cluster number; each cluster lists its articles. Empty when none exist.")
    public ResponseEntity<List<NewsCluster>> getClusters(
            @Parameter(description = "Anomaly ID") @PathVariable String anomalyId) {
        return ResponseEntity.ok(facade.newsClusters(anomalyId));
    }
}
