package com.market.anomaly.model;

import java.util.List;

/**
 * Articles linked to one anomaly (newest first) and the clusters they were grouped into.
 */
public record AnomalyNews(List<NewsArticle> articles, List<NewsCluster> clusters) {

    public static AnomalyNews empty() {
        return new AnomalyNews(List.of(), List.of());
    }
}
