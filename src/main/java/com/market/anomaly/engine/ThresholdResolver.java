package com.market.anomaly.engine;

import com.market.anomaly.model.AssetThresholds;
import com.market.anomaly.model.ThresholdConfig;
import com.market.anomaly.model.VolatilityTier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves the effective detection thresholds of an asset from the threshold document.
 *
 * <p>Precedence: an asset override replaces the tier-scaled default field by field. A field the
 * override leaves out falls back to the <em>unscaled</em> global default, whereas an asset without
 * any override gets {@code globalDefault * tierMultiplier}. The detection pipeline reads the same
 * document with the same rules, so the asymmetry has to stay.
 *
 * <p>Total over a well-formed document: unknown symbols resolve to the moderate tier.
 */
@Component
public class ThresholdResolver {

    static final double DEFAULT_TIER_MULTIPLIER = 1.0;

    public AssetThresholds resolve(String symbol, ThresholdConfig config) {
        ThresholdConfig.GlobalDefaults defaults = config.getGlobalDefaults();
        VolatilityTier tier = tierFor(symbol, config);
        double multiplier = multiplierFor(tier, config);

        ThresholdConfig.AssetOverride override =
                config.getAssetOverrides() != null ? config.getAssetOverrides().get(symbol) : null;

        if (override != null) {
            return AssetThresholds.builder()
                    .symbol(symbol)
                    .zScoreThreshold(override.getZScoreThreshold() != null
                            ? override.getZScoreThreshold() : defaults.getZScoreThreshold())
                    .volumeZThreshold(override.getVolumeZThreshold() != null
                            ? override.getVolumeZThreshold() : defaults.getVolumeZThreshold())
                    .volatilityTier(tier)
                    .tierMultiplier(multiplier)
                    .override(true)
                    .description(override.getDescription())
                    .build();
        }

        return AssetThresholds.builder()
                .symbol(symbol)
                .zScoreThreshold(defaults.getZScoreThreshold() * multiplier)
                .volumeZThreshold(defaults.getVolumeZThreshold() * multiplier)
                .volatilityTier(tier)
                .tierMultiplier(multiplier)
                .override(false)
                .build();
    }

    /**
     * Every symbol named in a tier list or an override, once each, sorted by symbol.
     */
    public List<AssetThresholds> resolveAll(ThresholdConfig config) {
        Set<String> symbols = new TreeSet<>();
        if (config.getVolatilityTiers() != null) {
            config.getVolatilityTiers().values().forEach(tier -> {
                if (tier != null && tier.getAssets() != null) {
                    symbols.addAll(tier.getAssets());
                }
            });
        }
        if (config.getAssetOverrides() != null) {
            symbols.addAll(config.getAssetOverrides().keySet());
        }
        return symbols.stream()
                .map(symbol -> resolve(symbol, config))
                .toList();
    }

    /**
     * Stable is checked before volatile so an asset listed in both (a config mistake)
     * always lands in the same tier. Anything else is moderate.
     */
    public VolatilityTier tierFor(String symbol, ThresholdConfig config) {
        if (listedIn(VolatilityTier.STABLE, symbol, config)) return VolatilityTier.STABLE;
        if (listedIn(VolatilityTier.VOLATILE, symbol, config)) return VolatilityTier.VOLATILE;
        return VolatilityTier.MODERATE;
    }

    public double multiplierFor(VolatilityTier tier, ThresholdConfig config) {
        ThresholdConfig.TierSettings settings = config.tier(tier);
        return settings != null && settings.getMultiplier() != null
                ? settings.getMultiplier() : DEFAULT_TIER_MULTIPLIER;
    }

    private boolean listedIn(VolatilityTier tier, String symbol, ThresholdConfig config) {
        ThresholdConfig.TierSettings settings = config.tier(tier);
        return settings != null && settings.lists(symbol);
    }
}
