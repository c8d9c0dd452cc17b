package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detection threshold document (thresholds.yaml). Loaded once and shared; treat as read-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThresholdConfig {

    @JsonProperty("global_defaults")
    private GlobalDefaults globalDefaults;

    // Keyed by tier code: stable, moderate, volatile
    @JsonProperty("volatility_tiers")
    @Builder.Default
    private Map<String, TierSettings> volatilityTiers = new LinkedHashMap<>();

    @JsonProperty("asset_specific_thresholds")
    @Builder.Default
    private Map<String, AssetOverride> assetOverrides = new LinkedHashMap<>();

    @JsonProperty("timeframes")
    private TimeframeSettings timeframes;

    @JsonProperty("cumulative")
    private CumulativeSettings cumulative;

    public TierSettings tier(VolatilityTier tier) {
        return volatilityTiers != null ? volatilityTiers.get(tier.code()) : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            isGetterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    public static class GlobalDefaults {
        @JsonProperty("z_score_threshold")
        private Double zScoreThreshold;
        @JsonProperty("volume_z_threshold")
        private Double volumeZThreshold;
        @JsonProperty("bollinger_std_multiplier")
        private Double bollingerStdMultiplier;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TierSettings {
        private String description;
        private Double multiplier;
        @Builder.Default
        private List<String> assets = new ArrayList<>();

        public boolean lists(String symbol) {
            return assets != null && assets.contains(symbol);
        }
    }

    /**
     * Per-asset override. Any field left out falls back to the unscaled global default.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            isGetterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    public static class AssetOverride {
        @JsonProperty("z_score_threshold")
        private Double zScoreThreshold;
        @JsonProperty("volume_z_threshold")
        private Double volumeZThreshold;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeframeSettings {
        private boolean enabled;
        private List<Integer> windows;
        private String description;
        @JsonProperty("baseline_multiplier")
        private double baselineMultiplier;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CumulativeSettings {
        private boolean enabled;
        @JsonProperty("min_periods")
        private int minPeriods;
        private String description;
    }
}
