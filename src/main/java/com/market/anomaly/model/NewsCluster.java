package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NewsCluster {
    private String id;
    private String anomalyId;
    private int clusterNumber;
    private String clusterLabel;
    private int articleCount;
    private NewsSentiment averageSentiment;
    private Instant createdAt;
    @Builder.Default
    private List<NewsArticle> articles = new ArrayList<>();
}
