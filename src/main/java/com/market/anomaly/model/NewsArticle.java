package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A news article the journalist stage linked to one anomaly. Read-only here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NewsArticle {
    private String id;
    private String anomalyId;
    private String title;
    private String url;
    private String source;
    private String summary;
    private Instant publishedAt;
    private NewsSentiment sentiment;
    private NewsTiming timing;
    private Double timeDiffMinutes;   // negative when published before detection
    private Integer clusterId;        // null when the article was not clustered
    private Instant createdAt;
}
