package com.market.anomaly.service;

import com.market.anomaly.config.ThresholdProperties;
import com.market.anomaly.engine.ThresholdResolver;
import com.market.anomaly.model.AssetThresholds;
import com.market.anomaly.model.ThresholdConfig;
import com.market.anomaly.repository.ThresholdConfigRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ThresholdService {

    private static final Logger log = LoggerFactory.getLogger(ThresholdService.class);

    private final ThresholdConfigRepository configRepository;
    private final ThresholdResolver resolver;
    private final ThresholdProperties properties;

    public ThresholdService(ThresholdConfigRepository configRepository,
                            ThresholdResolver resolver,
                            ThresholdProperties properties) {
        this.configRepository = configRepository;
        this.resolver = resolver;
        this.properties = properties;
    }

    /**
     * A malformed document is fatal: with fail-fast on, the context does not start.
     */
    @PostConstruct
    public void init() {
        if (properties.isFailFast()) {
            configRepository.get();
        }
    }

    public ThresholdConfig getConfig() {
        return configRepository.get();
    }

    public AssetThresholds getAssetThresholds(String symbol) {
        return resolver.resolve(symbol, configRepository.get());
    }

    public List<AssetThresholds> getAllAssetThresholds() {
        return resolver.resolveAll(configRepository.get());
    }

    public ThresholdConfig reload() {
        ThresholdConfig config = configRepository.reload();
        log.info("Threshold configuration reloaded");
        return config;
    }
}
