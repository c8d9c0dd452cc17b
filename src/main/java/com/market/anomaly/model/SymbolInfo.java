package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolInfo {
    private String symbol;
    private String name;
    private VolatilityTier volatilityTier;
    private double tierMultiplier;
    private double zScoreThreshold;
    private double volumeZThreshold;
    private boolean hasOverride;

    @JsonProperty("zScoreThreshold")
    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    @JsonProperty("volumeZThreshold")
    public double getVolumeZThreshold() {
        return volumeZThreshold;
    }
}
