package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A detected anomaly as written by the external detection pipeline. Read-only here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {
    private String id;
    private String symbol;
    private Instant detectedAt;
    private AnomalyType type;
    private Double zScore;
    private Double priceChangePct;
    private Double volumeChangePct;
    private double confidence;
    private int baselineWindowMinutes;
    private double priceBefore;
    private double priceAtDetection;
    private Double volumeBefore;
    private Double volumeAtDetection;
    private Map<String, Object> detectionMetadata;
    private Narrative narrative;
    // Only filled for single-anomaly reads
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<NewsArticle> newsArticles;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<NewsCluster> newsClusters;

    @JsonProperty("zScore")
    public Double getZScore() {
        return zScore;
    }

    @JsonProperty("zScore")
    public void setZScore(Double zScore) {
        this.zScore = zScore;
    }

    @JsonProperty(value = "validationStatus", access = JsonProperty.Access.READ_ONLY)
    public ValidationStatus getValidationStatus() {
        return ValidationStatus.fromNarrative(narrative);
    }
}
