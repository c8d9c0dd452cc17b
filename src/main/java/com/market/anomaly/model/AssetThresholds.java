package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective detection thresholds for one asset. Derived from {@link ThresholdConfig} on demand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssetThresholds {
    private String symbol;
    private double zScoreThreshold;
    private double volumeZThreshold;
    private VolatilityTier volatilityTier;
    private double tierMultiplier;
    @JsonProperty("isOverride")
    private boolean override;
    private String description;

    @JsonProperty("zScoreThreshold")
    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    @JsonProperty("volumeZThreshold")
    public double getVolumeZThreshold() {
        return volumeZThreshold;
    }
}
