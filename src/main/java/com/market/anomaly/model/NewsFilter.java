package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Criteria for the news listing. Set fields combine with AND; date bounds are inclusive.
 * A symbol is resolved to the ids of that symbol's anomalies before the store is read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NewsFilter {
    private String symbol;
    private String anomalyId;
    private Set<String> anomalyIds;
    private Instant startDate;
    private Instant endDate;

    public static NewsFilter forAnomaly(String anomalyId) {
        return NewsFilter.builder().anomalyId(anomalyId).build();
    }

    public boolean matches(NewsArticle article) {
        if (anomalyId != null && !anomalyId.equals(article.getAnomalyId())) return false;
        if (anomalyIds != null && !anomalyIds.contains(article.getAnomalyId())) return false;
        if (startDate == null && endDate == null) return true;

        Instant publishedAt = article.getPublishedAt();
        if (publishedAt == null) return false;
        if (startDate != null && publishedAt.isBefore(startDate)) return false;
        return endDate == null || !publishedAt.isAfter(endDate);
    }
}
