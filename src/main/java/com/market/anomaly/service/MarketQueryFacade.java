package com.market.anomaly.service;

import com.market.anomaly.config.QueryConfig;
import com.market.anomaly.exception.InvalidQueryException;
import com.market.anomaly.exception.NotFoundException;
import com.market.anomaly.model.Anomaly;
import com.market.anomaly.model.AnomalyFilter;
import com.market.anomaly.model.AnomalyStats;
import com.market.anomaly.model.AnomalyType;
import com.market.anomaly.model.AssetThresholds;
import com.market.anomaly.model.Granularity;
import com.market.anomaly.model.NewsArticle;
import com.market.anomaly.model.NewsCluster;
import com.market.anomaly.model.NewsFilter;
import com.market.anomaly.model.PagedResponse;
import com.market.anomaly.model.PriceHistory;
import com.market.anomaly.model.PriceSample;
import com.market.anomaly.model.SymbolInfo;
import com.market.anomaly.model.SymbolStats;
import com.market.anomaly.model.ThresholdConfig;
import com.market.anomaly.model.ValidationStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for the API layer. Turns raw request values into typed queries, rejecting
 * unparseable dates and unknown enum codes, then delegates to the query services.
 * Out-of-range paging values are not rejected here; the query service clamps them.
 */
@Service
public class MarketQueryFacade {

    private final ThresholdService thresholdService;
    private final PriceHistoryService priceHistoryService;
    private final AnomalyQueryService anomalyQueryService;
    private final SymbolService symbolService;
    private final NewsQueryService newsQueryService;
    private final QueryConfig queryConfig;

    public MarketQueryFacade(ThresholdService thresholdService,
                             PriceHistoryService priceHistoryService,
                             AnomalyQueryService anomalyQueryService,
                             SymbolService symbolService,
                             NewsQueryService newsQueryService,
                             QueryConfig queryConfig) {
        this.thresholdService = thresholdService;
        this.priceHistoryService = priceHistoryService;
        this.anomalyQueryService = anomalyQueryService;
        this.symbolService = symbolService;
        this.newsQueryService = newsQueryService;
        this.queryConfig = queryConfig;
    }

    // ── Thresholds ──

    public ThresholdConfig thresholdConfig() {
        return thresholdService.getConfig();
    }

    public AssetThresholds thresholdsFor(String symbol) {
        return thresholdService.getAssetThresholds(normalizeSymbol(symbol));
    }

    public List<AssetThresholds> allThresholds() {
        return thresholdService.getAllAssetThresholds();
    }

    public ThresholdConfig reloadThresholds() {
        return thresholdService.reload();
    }

    // ── Prices ──

    public PriceHistory priceHistory(String symbol, String startDate, String endDate, String aggregation) {
        Instant start = parseInstant("startDate", startDate);
        Instant end = parseInstant("endDate", endDate);
        return priceHistoryService.getPriceHistory(normalizeSymbol(symbol), start, end, parseAggregation(aggregation));
    }

    public PriceSample latestPrice(String symbol) {
        String normalized = normalizeSymbol(symbol);
        PriceSample latest = priceHistoryService.getLatestPrice(normalized);
        if (latest == null) {
            throw new NotFoundException("No price data found for symbol " + normalized);
        }
        return latest;
    }

    // ── Anomalies ──

    public PagedResponse<Anomaly> anomalies(Integer page, Integer limit, String symbol, String symbols,
                                            String anomalyType, String validationStatus,
                                            String startDate, String endDate) {
        AnomalyFilter filter = AnomalyFilter.builder()
                .symbol(symbol != null && !symbol.isBlank() ? symbol.trim() : null)
                .symbols(parseSymbols(symbols))
                .type(parseType(anomalyType))
                .validationStatus(parseValidationStatus(validationStatus))
                .startDate(parseInstant("startDate", startDate))
                .endDate(parseInstant("endDate", endDate))
                .build();
        return anomalyQueryService.findAll(filter,
                page != null ? page : 1,
                limit != null ? limit : queryConfig.getDefaultLimit());
    }

    public Anomaly anomaly(String id) {
        Anomaly anomaly = anomalyQueryService.findById(id);
        if (anomaly == null) {
            throw new NotFoundException("Anomaly with ID " + id + " not found");
        }
        return anomaly;
    }

    public List<Anomaly> latestAnomalies(String since, String symbols) {
        Instant sinceInstant = parseInstant("since", since);
        if (sinceInstant == null) {
            throw new InvalidQueryException("since", "since is required");
        }
        return anomalyQueryService.findLatest(sinceInstant, parseSymbols(symbols));
    }

    public AnomalyStats anomalyStats(String symbols) {
        return anomalyQueryService.getStats(parseSymbols(symbols));
    }

    // ── Symbols ──

    public List<SymbolInfo> symbols() {
        return symbolService.getAllSymbols();
    }

    public List<SymbolStats> allSymbolStats() {
        return symbolService.getAllSymbolStats();
    }

    public SymbolStats symbolStats(String symbol) {
        return symbolService.getSymbolStats(normalizeSymbol(symbol))
                .orElseThrow(() -> new NotFoundException("Symbol not found: " + symbol));
    }

    // ── News ──

    public PagedResponse<NewsArticle> news(Integer page, Integer limit, String symbol, String anomalyId,
                                           String startDate, String endDate) {
        NewsFilter filter = NewsFilter.builder()
                .symbol(symbol != null && !symbol.isBlank() ? symbol.trim().toUpperCase(Locale.ROOT) : null)
                .anomalyId(anomalyId != null && !anomalyId.isBlank() ? anomalyId.trim() : null)
                .startDate(parseInstant("startDate", startDate))
                .endDate(parseInstant("endDate", endDate))
                .build();
        return newsQueryService.findAll(filter,
                page != null ? page : 1,
                limit != null ? limit : queryConfig.getDefaultLimit());
    }

    public List<NewsCluster> newsClusters(String anomalyId) {
        if (anomalyId == null || anomalyId.isBlank()) {
            throw new InvalidQueryException("anomalyId", "anomalyId is required");
        }
        return newsQueryService.findClustersByAnomalyId(anomalyId.trim());
    }

    // ── Parsing ──

    /**
     * ISO-8601 instant, offset date-time, local date-time (taken as UTC) or bare date (UTC midnight).
     */
    static Instant parseInstant(String field, String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        try {
            if (value.indexOf('T') < 0) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, ZonedDateTime::from, LocalDateTime::from);
            return parsed instanceof ZonedDateTime zoned
                    ? zoned.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException(field, "Invalid date for " + field + ": '" + raw + "'");
        }
    }

    static Set<String> parseSymbols(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Set<String> symbols = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return symbols.isEmpty() ? null : symbols;
    }

    static AnomalyType parseType(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return AnomalyType.fromCode(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("anomalyType", "Unknown anomaly type: '" + raw + "'");
        }
    }

    static ValidationStatus parseValidationStatus(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return ValidationStatus.fromCode(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("validationStatus", "Unknown validation status: '" + raw + "'");
        }
    }

    /**
     * @return null for "auto" (or nothing), otherwise the explicit bucket width
     */
    static Granularity parseAggregation(String raw) {
        if (raw == null || raw.isBlank() || Granularity.AUTO.equalsIgnoreCase(raw.trim())) return null;
        try {
            return Granularity.fromCode(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("aggregation", "Unknown aggregation: '" + raw + "'");
        }
    }

    private static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidQueryException("symbol", "symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
