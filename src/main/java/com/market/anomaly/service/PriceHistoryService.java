package com.market.anomaly.service;

import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.QueryConfig;
import com.market.anomaly.engine.GranularitySelector;
import com.market.anomaly.engine.TimeSeriesAggregator;
import com.market.anomaly.model.AggregatedPricePoint;
import com.market.anomaly.model.Granularity;
import com.market.anomaly.model.PriceHistory;
import com.market.anomaly.model.PriceSample;
import com.market.anomaly.repository.PriceRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class PriceHistoryService {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryService.class);

    private final PriceRepository priceRepository;
    private final GranularitySelector granularitySelector;
    private final TimeSeriesAggregator aggregator;
    private final QueryConfig queryConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PriceHistoryService(PriceRepository priceRepository,
                               GranularitySelector granularitySelector,
                               TimeSeriesAggregator aggregator,
                               QueryConfig queryConfig,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.priceRepository = priceRepository;
        this.granularitySelector = granularitySelector;
        this.aggregator = aggregator;
        this.queryConfig = queryConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Price history for {@code [start, end]}. A missing end means now, a missing start means
     * the default window before end. {@code granularity == null} selects by span.
     */
    @Observed(name = "prices.history", contextualName = "load-price-history")
    public PriceHistory getPriceHistory(String symbol, Instant start, Instant end, Granularity granularity) {
        Instant effectiveEnd = end != null ? end : clock.instant();
        Instant effectiveStart = start != null
                ? start
                : effectiveEnd.minus(Duration.ofHours(queryConfig.getDefaultPriceWindowHours()));

        Granularity effective = granularitySelector.resolve(granularity, effectiveStart, effectiveEnd);
        metricsConfig.recordGranularity(effective.code());

        if (effectiveStart.isAfter(effectiveEnd)) {
            return new PriceHistory(symbol, effective, List.of());
        }

        List<PriceSample> samples = priceRepository.findBySymbolBetween(symbol, effectiveStart, effectiveEnd);
        List<AggregatedPricePoint> points = aggregator.aggregate(samples, effective);

        log.info("Retrieved {} price points for {} ({} aggregation)", points.size(), symbol, effective.code());
        metricsConfig.recordQuery("price_history", points.size());
        return new PriceHistory(symbol, effective, points);
    }

    public PriceSample getLatestPrice(String symbol) {
        return priceRepository.findLatest(symbol);
    }
}
