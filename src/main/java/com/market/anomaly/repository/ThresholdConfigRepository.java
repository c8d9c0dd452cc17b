package com.market.anomaly.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.ThresholdProperties;
import com.market.anomaly.exception.ConfigLoadException;
import com.market.anomaly.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide cache of the threshold document.
 *
 * <p>Loaded lazily on first use and held until {@link #clear()} or {@link #reload()}. The first
 * load runs under a lock, so concurrent first callers all see the same fully parsed instance.
 * Readers after that never block.
 */
@Repository
public class ThresholdConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(ThresholdConfigRepository.class);

    private final ResourceLoader resourceLoader;
    private final ThresholdProperties properties;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper yamlMapper;

    private final AtomicReference<ThresholdConfig> cachedConfig = new AtomicReference<>();
    private final ReentrantLock loadLock = new ReentrantLock();

    public ThresholdConfigRepository(ResourceLoader resourceLoader,
                                     ThresholdProperties properties,
                                     MetricsConfig metricsConfig) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ThresholdConfig get() {
        ThresholdConfig current = cachedConfig.get();
        if (current != null) {
            return current;
        }
        loadLock.lock();
        try {
            current = cachedConfig.get();
            if (current == null) {
                current = readDocument();
                cachedConfig.set(current);
            }
            return current;
        } finally {
            loadLock.unlock();
        }
    }

    /**
     * Re-read the document now. On failure the previously cached document stays in place.
     */
    public ThresholdConfig reload() {
        loadLock.lock();
        try {
            ThresholdConfig fresh = readDocument();
            cachedConfig.set(fresh);
            return fresh;
        } finally {
            loadLock.unlock();
        }
    }

    public void clear() {
        cachedConfig.set(null);
        log.info("Threshold configuration cache cleared");
    }

    public boolean isLoaded() {
        return cachedConfig.get() != null;
    }

    private ThresholdConfig readDocument() {
        String location = properties.getConfigPath();
        log.info("Loading thresholds from: {}", location);

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            metricsConfig.recordThresholdLoad("missing");
            throw new ConfigLoadException("Threshold configuration not found: " + location);
        }

        ThresholdConfig config;
        try (InputStream in = resource.getInputStream()) {
            config = yamlMapper.readValue(in, ThresholdConfig.class);
        } catch (IOException e) {
            metricsConfig.recordThresholdLoad("malformed");
            log.error("Failed to load threshold configuration from {}", location, e);
            throw new ConfigLoadException("Failed to load threshold configuration: " + location, e);
        }

        if (config == null || config.getGlobalDefaults() == null) {
            metricsConfig.recordThresholdLoad("malformed");
            throw new ConfigLoadException("Threshold configuration has no global_defaults section: " + location);
        }
        String problem = validate(config);
        if (problem != null) {
            metricsConfig.recordThresholdLoad("malformed");
            throw new ConfigLoadException("Invalid threshold configuration " + location + ": " + problem);
        }

        metricsConfig.recordThresholdLoad("loaded");
        log.info("Thresholds configuration loaded: {} tiers, {} asset overrides",
                config.getVolatilityTiers() != null ? config.getVolatilityTiers().size() : 0,
                config.getAssetOverrides() != null ? config.getAssetOverrides().size() : 0);
        return config;
    }

    /**
     * Returns a description of the first invalid value, or null when the document is usable.
     * Both global thresholds are required. Bollinger and tier multipliers must be positive when given.
     */
    static String validate(ThresholdConfig config) {
        ThresholdConfig.GlobalDefaults defaults = config.getGlobalDefaults();
        if (!isPositive(defaults.getZScoreThreshold())) {
            return "global_defaults.z_score_threshold must be a positive number";
        }
        if (!isPositive(defaults.getVolumeZThreshold())) {
            return "global_defaults.volume_z_threshold must be a positive number";
        }
        if (defaults.getBollingerStdMultiplier() != null && !isPositive(defaults.getBollingerStdMultiplier())) {
            return "global_defaults.bollinger_std_multiplier must be positive";
        }
        if (config.getVolatilityTiers() != null) {
            for (Map.Entry<String, ThresholdConfig.TierSettings> entry : config.getVolatilityTiers().entrySet()) {
                ThresholdConfig.TierSettings tier = entry.getValue();
                if (tier == null || !isPositive(tier.getMultiplier())) {
                    return "volatility_tiers." + entry.getKey() + ".multiplier must be a positive number";
                }
            }
        }
        return null;
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }
}
