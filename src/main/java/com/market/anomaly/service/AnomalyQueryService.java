package com.market.anomaly.service;

import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.QueryConfig;
import com.market.anomaly.model.Anomaly;
import com.market.anomaly.model.AnomalyFilter;
import com.market.anomaly.model.AnomalyNews;
import com.market.anomaly.model.AnomalyStats;
import com.market.anomaly.model.AnomalyType;
import com.market.anomaly.model.PagedResponse;
import com.market.anomaly.model.PaginationMeta;
import com.market.anomaly.model.ValidationStatus;
import com.market.anomaly.repository.AnomalyRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Filtering, paging and summary statistics over the anomaly set.
 *
 * <p>The count and the page are separate queries. Against an append-only store the total may
 * briefly run ahead of the page it accompanies; that is accepted. A store with deletes or
 * updates would break the "pages sum to total" guarantee and needs a snapshot read instead.
 */
@Service
public class AnomalyQueryService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

    private static final Duration WINDOW_24H = Duration.ofHours(24);
    private static final Duration WINDOW_7D = Duration.ofDays(7);

    private final AnomalyRepository anomalyRepository;
    private final NewsQueryService newsQueryService;
    private final QueryConfig queryConfig;
    private final MetricsConfig metricsConfig;
    private final ExecutorService queryExecutor;
    private final Clock clock;

    public AnomalyQueryService(AnomalyRepository anomalyRepository,
                               NewsQueryService newsQueryService,
                               QueryConfig queryConfig,
                               MetricsConfig metricsConfig,
                               @Qualifier("queryExecutor") ExecutorService queryExecutor,
                               Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.newsQueryService = newsQueryService;
        this.queryConfig = queryConfig;
        this.metricsConfig = metricsConfig;
        this.queryExecutor = queryExecutor;
        this.clock = clock;
    }

    /**
     * @param page  1-based; values below 1 are clamped to 1
     * @param limit clamped to [1, maxLimit]
     */
    @Observed(name = "anomalies.find_all", contextualName = "find-anomalies")
    public PagedResponse<Anomaly> findAll(AnomalyFilter filter, int page, int limit) {
        int safePage = Math.max(1, page);
        int safeLimit = Math.min(queryConfig.getMaxLimit(), Math.max(1, limit));
        long skip = (long) (safePage - 1) * safeLimit;

        CompletableFuture<Long> total = supply(() -> anomalyRepository.count(filter));
        CompletableFuture<List<Anomaly>> data = supply(() -> anomalyRepository.findPage(filter, skip, safeLimit));
        QueryFutures.awaitAll(total, data);

        PaginationMeta meta = PaginationMeta.of(safePage, safeLimit, QueryFutures.result(total));
        List<Anomaly> rows = QueryFutures.result(data);
        log.info("Retrieved {} anomalies (page {}/{})", rows.size(), safePage, meta.totalPages());
        metricsConfig.recordQuery("find_all", rows.size());
        return new PagedResponse<>(rows, meta);
    }

    /**
     * Single anomaly with its narrative, linked news articles and news clusters.
     *
     * @return null when no anomaly has this id
     */
    public Anomaly findById(String id) {
        Anomaly anomaly = anomalyRepository.findById(id);
        if (anomaly == null) {
            return null;
        }
        AnomalyNews news = newsQueryService.findForAnomaly(id);
        return anomaly.toBuilder()
                .newsArticles(news.articles())
                .newsClusters(news.clusters())
                .build();
    }

    /**
     * Polling feed: anomalies with {@code detectedAt > since}, newest first, capped.
     */
    @Observed(name = "anomalies.find_latest", contextualName = "poll-latest-anomalies")
    public List<Anomaly> findLatest(Instant since, Set<String> symbols) {
        List<Anomaly> latest = anomalyRepository.findDetectedAfter(since, symbols, queryConfig.getLatestCap());
        log.info("Retrieved {} anomalies since {}", latest.size(), since);
        metricsConfig.recordQuery("find_latest", latest.size());
        return latest;
    }

    /**
     * Seven aggregates run concurrently. The validation breakdown is derived from three of them
     * (with narrative, valid, invalid) so the four buckets always add up to the total.
     */
    @Observed(name = "anomalies.stats", contextualName = "anomaly-stats")
    public AnomalyStats getStats(Set<String> symbols) {
        AnomalyFilter filter = AnomalyFilter.forSymbols(symbols);
        Instant now = clock.instant();

        CompletableFuture<Long> total = supply(() -> anomalyRepository.count(filter));
        CompletableFuture<Map<AnomalyType, Long>> byType = supply(() -> anomalyRepository.countByType(filter));
        CompletableFuture<Long> withNarrative = supply(() -> anomalyRepository.countWithNarrative(filter));
        CompletableFuture<Long> valid = supply(() -> anomalyRepository.count(
                filter.toBuilder().validationStatus(ValidationStatus.VALID).build()));
        CompletableFuture<Long> invalid = supply(() -> anomalyRepository.count(
                filter.toBuilder().validationStatus(ValidationStatus.INVALID).build()));
        CompletableFuture<Long> recent24h = supply(() -> anomalyRepository.count(
                filter.toBuilder().startDate(now.minus(WINDOW_24H)).build()));
        CompletableFuture<Long> recent7d = supply(() -> anomalyRepository.count(
                filter.toBuilder().startDate(now.minus(WINDOW_7D)).build()));

        QueryFutures.awaitAll(total, byType, withNarrative, valid, invalid, recent24h, recent7d);

        long totalCount = QueryFutures.result(total);
        long narrativeCount = QueryFutures.result(withNarrative);
        long validCount = QueryFutures.result(valid);
        long invalidCount = QueryFutures.result(invalid);

        Map<ValidationStatus, Long> byValidation = new EnumMap<>(ValidationStatus.class);
        byValidation.put(ValidationStatus.NOT_GENERATED, totalCount - narrativeCount);
        byValidation.put(ValidationStatus.PENDING, narrativeCount - validCount - invalidCount);
        byValidation.put(ValidationStatus.VALID, validCount);
        byValidation.put(ValidationStatus.INVALID, invalidCount);

        metricsConfig.recordQuery("stats", 1);
        return AnomalyStats.builder()
                .totalAnomalies(totalCount)
                .byType(QueryFutures.result(byType))
                .byValidationStatus(byValidation)
                .recentCount24h(QueryFutures.result(recent24h))
                .recentCount7d(QueryFutures.result(recent7d))
                .build();
    }

    private <T> CompletableFuture<T> supply(Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, queryExecutor);
    }
}
