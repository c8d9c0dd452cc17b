package com.market.anomaly.service;

import com.market.anomaly.config.SymbolsConfig;
import com.market.anomaly.model.Anomaly;
import com.market.anomaly.model.AnomalyFilter;
import com.market.anomaly.model.AssetThresholds;
import com.market.anomaly.model.PriceSample;
import com.market.anomaly.model.SymbolInfo;
import com.market.anomaly.model.SymbolStats;
import com.market.anomaly.repository.AnomalyRepository;
import com.market.anomaly.repository.PriceRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Supported symbols with their resolved thresholds, and per-symbol activity stats.
 */
@Service
public class SymbolService {

    private final SymbolsConfig symbolsConfig;
    private final ThresholdService thresholdService;
    private final AnomalyRepository anomalyRepository;
    private final PriceRepository priceRepository;
    private final ExecutorService queryExecutor;

    public SymbolService(SymbolsConfig symbolsConfig,
                         ThresholdService thresholdService,
                         AnomalyRepository anomalyRepository,
                         PriceRepository priceRepository,
                         @Qualifier("queryExecutor") ExecutorService queryExecutor) {
        this.symbolsConfig = symbolsConfig;
        this.thresholdService = thresholdService;
        this.anomalyRepository = anomalyRepository;
        this.priceRepository = priceRepository;
        this.queryExecutor = queryExecutor;
    }

    public List<SymbolInfo> getAllSymbols() {
        return symbolsConfig.getSymbols().stream()
                .map(def -> {
                    AssetThresholds t = thresholdService.getAssetThresholds(def.getSymbol());
                    return SymbolInfo.builder()
                            .symbol(def.getSymbol())
                            .name(def.getName())
                            .volatilityTier(t.getVolatilityTier())
                            .tierMultiplier(t.getTierMultiplier())
                            .zScoreThreshold(t.getZScoreThreshold())
                            .volumeZThreshold(t.getVolumeZThreshold())
                            .hasOverride(t.isOverride())
                            .build();
                })
                .toList();
    }

    /**
     * @return empty when the symbol is not one this service serves
     */
    public Optional<SymbolStats> getSymbolStats(String symbol) {
        Optional<SymbolsConfig.SymbolDefinition> definition = symbolsConfig.find(symbol);
        if (definition.isEmpty()) {
            return Optional.empty();
        }
        String canonical = definition.get().getSymbol();

        CompletableFuture<List<Anomaly>> anomalies = CompletableFuture.supplyAsync(
                () -> anomalyRepository.findMatching(AnomalyFilter.builder().symbol(canonical).build()),
                queryExecutor);
        CompletableFuture<PriceSample> latestPrice = CompletableFuture.supplyAsync(
                () -> priceRepository.findLatest(canonical), queryExecutor);
        QueryFutures.awaitAll(anomalies, latestPrice);

        return Optional.of(buildStats(definition.get(),
                QueryFutures.result(anomalies), QueryFutures.result(latestPrice)));
    }

    /**
     * Stats for every supported symbol, in configured order. One anomaly scan covers all
     * symbols; latest prices are read concurrently, one task per symbol.
     */
    public List<SymbolStats> getAllSymbolStats() {
        List<SymbolsConfig.SymbolDefinition> definitions = symbolsConfig.getSymbols();
        if (definitions == null || definitions.isEmpty()) {
            return List.of();
        }
        Set<String> symbols = definitions.stream()
                .map(SymbolsConfig.SymbolDefinition::getSymbol)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        CompletableFuture<List<Anomaly>> anomalies = CompletableFuture.supplyAsync(
                () -> anomalyRepository.findMatching(AnomalyFilter.forSymbols(symbols)), queryExecutor);
        Map<String, CompletableFuture<PriceSample>> latestPrices = new LinkedHashMap<>();
        for (String symbol : symbols) {
            latestPrices.put(symbol, CompletableFuture.supplyAsync(
                    () -> priceRepository.findLatest(symbol), queryExecutor));
        }
        List<CompletableFuture<?>> all = new ArrayList<>(latestPrices.values());
        all.add(anomalies);
        QueryFutures.awaitAll(all.toArray(new CompletableFuture<?>[0]));

        Map<String, List<Anomaly>> bySymbol = QueryFutures.result(anomalies).stream()
                .collect(Collectors.groupingBy(Anomaly::getSymbol));

        List<SymbolStats> stats = new ArrayList<>();
        for (SymbolsConfig.SymbolDefinition definition : definitions) {
            String symbol = definition.getSymbol();
            stats.add(buildStats(definition,
                    bySymbol.getOrDefault(symbol, List.of()),
                    QueryFutures.result(latestPrices.get(symbol))));
        }
        return stats;
    }

    private SymbolStats buildStats(SymbolsConfig.SymbolDefinition definition, List<Anomaly> rows, PriceSample latest) {
        String symbol = definition.getSymbol();
        return SymbolStats.builder()
                .symbol(symbol)
                .name(definition.getName())
                .volatilityTier(thresholdService.getAssetThresholds(symbol).getVolatilityTier())
                .anomalyCount(rows.size())
                .narrativeCount(rows.stream().filter(a -> a.getNarrative() != null).count())
                .avgAnomalyConfidence(rows.isEmpty() ? null
                        : rows.stream().mapToDouble(Anomaly::getConfidence).average().orElse(0.0))
                .firstAnomalyTime(rows.stream().map(Anomaly::getDetectedAt)
                        .min(Comparator.naturalOrder()).orElse(null))
                .lastAnomalyTime(rows.stream().map(Anomaly::getDetectedAt)
                        .max(Comparator.naturalOrder()).orElse(null))
                .latestPrice(latest != null ? latest.getPrice() : null)
                .latestPriceTime(latest != null ? latest.getTimestamp() : null)
                .build();
    }
}
