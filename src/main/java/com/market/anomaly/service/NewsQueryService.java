package com.market.anomaly.service;

import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.QueryConfig;
import com.market.anomaly.model.AnomalyNews;
import com.market.anomaly.model.NewsArticle;
import com.market.anomaly.model.NewsCluster;
import com.market.anomaly.model.NewsFilter;
import com.market.anomaly.model.PagedResponse;
import com.market.anomaly.model.PaginationMeta;
import com.market.anomaly.repository.AnomalyRepository;
import com.market.anomaly.repository.NewsRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * News linked to anomalies: a paged listing and per-anomaly article clusters.
 */
@Service
public class NewsQueryService {

    private static final Logger log = LoggerFactory.getLogger(NewsQueryService.class);

    private final NewsRepository newsRepository;
    private final AnomalyRepository anomalyRepository;
    private final QueryConfig queryConfig;
    private final MetricsConfig metricsConfig;
    private final ExecutorService queryExecutor;

    public NewsQueryService(NewsRepository newsRepository,
                            AnomalyRepository anomalyRepository,
                            QueryConfig queryConfig,
                            MetricsConfig metricsConfig,
                            @Qualifier("queryExecutor") ExecutorService queryExecutor) {
        this.newsRepository = newsRepository;
        this.anomalyRepository = anomalyRepository;
        this.queryConfig = queryConfig;
        this.metricsConfig = metricsConfig;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Paging is clamped the same way as the anomaly listing. A symbol narrows the listing to
     * articles linked to that symbol's anomalies.
     */
    @Observed(name = "news.find_all", contextualName = "find-news")
    public PagedResponse<NewsArticle> findAll(NewsFilter filter, int page, int limit) {
        int safePage = Math.max(1, page);
        int safeLimit = Math.min(queryConfig.getMaxLimit(), Math.max(1, limit));
        long skip = (long) (safePage - 1) * safeLimit;

        NewsFilter resolved = filter;
        if (filter.getSymbol() != null) {
            Set<String> anomalyIds = anomalyRepository.findIdsBySymbol(filter.getSymbol());
            if (anomalyIds.isEmpty()) {
                metricsConfig.recordQuery("news_find_all", 0);
                return new PagedResponse<>(List.of(), PaginationMeta.of(safePage, safeLimit, 0));
            }
            resolved = filter.toBuilder().anomalyIds(anomalyIds).build();
        }
        NewsFilter query = resolved;

        CompletableFuture<Long> total = CompletableFuture.supplyAsync(
                () -> newsRepository.count(query), queryExecutor);
        CompletableFuture<List<NewsArticle>> data = CompletableFuture.supplyAsync(
                () -> newsRepository.findPage(query, skip, safeLimit), queryExecutor);
        QueryFutures.awaitAll(total, data);

        PaginationMeta meta = PaginationMeta.of(safePage, safeLimit, QueryFutures.result(total));
        List<NewsArticle> rows = QueryFutures.result(data);
        log.info("Retrieved {} news articles (page {}/{})", rows.size(), safePage, meta.totalPages());
        metricsConfig.recordQuery("news_find_all", rows.size());
        return new PagedResponse<>(rows, meta);
    }

    public List<NewsCluster> findClustersByAnomalyId(String anomalyId) {
        return findForAnomaly(anomalyId).clusters();
    }

    /**
     * Articles and clusters for one anomaly, read concurrently. Each cluster carries the
     * articles whose cluster id equals its cluster number, newest first.
     */
    public AnomalyNews findForAnomaly(String anomalyId) {
        CompletableFuture<List<NewsCluster>> clusters = CompletableFuture.supplyAsync(
                () -> newsRepository.findClustersByAnomalyId(anomalyId), queryExecutor);
        CompletableFuture<List<NewsArticle>> articles = CompletableFuture.supplyAsync(
                () -> newsRepository.findByAnomalyId(anomalyId), queryExecutor);
        QueryFutures.awaitAll(clusters, articles);

        List<NewsArticle> articleRows = QueryFutures.result(articles);
        Map<Integer, List<NewsArticle>> byCluster = articleRows.stream()
                .filter(a -> a.getClusterId() != null)
                .collect(Collectors.groupingBy(NewsArticle::getClusterId));

        List<NewsCluster> grouped = new ArrayList<>();
        for (NewsCluster cluster : QueryFutures.result(clusters)) {
            grouped.add(cluster.toBuilder()
                    .articles(byCluster.getOrDefault(cluster.getClusterNumber(), List.of()))
                    .build());
        }
        metricsConfig.recordQuery("news_for_anomaly", articleRows.size());
        return new AnomalyNews(articleRows, grouped);
    }
}
