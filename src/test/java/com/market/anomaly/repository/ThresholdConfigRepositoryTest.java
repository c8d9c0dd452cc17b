package com.market.anomaly.repository;

import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.ThresholdProperties;
import com.market.anomaly.exception.ConfigLoadException;
import com.market.anomaly.model.ThresholdConfig;
import com.market.anomaly.model.VolatilityTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ThresholdConfigRepositoryTest {

    @Mock private MetricsConfig metricsConfig;

    private ThresholdProperties properties;
    private ThresholdConfigRepository repository;

    @BeforeEach
    void setUp() {
        properties = new ThresholdProperties();
        properties.setConfigPath("classpath:thresholds-test.yaml");
        repository = new ThresholdConfigRepository(new DefaultResourceLoader(), properties, metricsConfig);
    }

    @Test
    void get_parsesSnakeCaseDocument() {
        ThresholdConfig config = repository.get();

        assertThat(config.getGlobalDefaults().getZScoreThreshold()).isEqualTo(3.0);
        assertThat(config.getGlobalDefaults().getVolumeZThreshold()).isEqualTo(2.5);
        assertThat(config.getGlobalDefaults().getBollingerStdMultiplier()).isEqualTo(2.0);
        assertThat(config.tier(VolatilityTier.VOLATILE).getMultiplier()).isEqualTo(0.7);
        assertThat(config.tier(VolatilityTier.STABLE).getAssets()).containsExactly("BTC-USD", "ETH-USD");
        assertThat(config.getAssetOverrides().get("BTC-USD").getZScoreThreshold()).isEqualTo(3.5);
        assertThat(config.getAssetOverrides().get("BTC-USD").getVolumeZThreshold()).isNull();
        assertThat(config.getTimeframes().getWindows()).containsExactly(5, 15, 30);
        assertThat(config.getCumulative().getMinPeriods()).isEqualTo(4);
        verify(metricsConfig).recordThresholdLoad("loaded");
    }

    @Test
    void get_cachesAfterFirstLoad() {
        ThresholdConfig first = repository.get();
        ThresholdConfig second = repository.get();

        assertThat(second).isSameAs(first);
        verify(metricsConfig, times(1)).recordThresholdLoad("loaded");
    }

    @Test
    void get_concurrentFirstCalls_observeSameInstance() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ThresholdConfig>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(repository::get);
            }
            List<Future<ThresholdConfig>> results = pool.invokeAll(calls);

            ThresholdConfig expected = results.get(0).get();
            for (Future<ThresholdConfig> result : results) {
                assertThat(result.get()).isSameAs(expected);
            }
            verify(metricsConfig, times(1)).recordThresholdLoad("loaded");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void clear_forcesReloadOnNextGet() {
        ThresholdConfig first = repository.get();
        repository.clear();

        assertThat(repository.isLoaded()).isFalse();
        assertThat(repository.get()).isNotSameAs(first);
    }

    @Test
    void get_missingFile_throwsConfigLoadException() {
        properties.setConfigPath("classpath:does-not-exist.yaml");

        assertThatThrownBy(() -> repository.get())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found");
        verify(metricsConfig).recordThresholdLoad("missing");
    }

    @Test
    void get_malformedYaml_throwsConfigLoadException() {
        properties.setConfigPath("classpath:thresholds-malformed.yaml");

        assertThatThrownBy(() -> repository.get()).isInstanceOf(ConfigLoadException.class);
        assertThat(repository.isLoaded()).isFalse();
    }

    @Test
    void get_missingGlobalDefaults_throwsConfigLoadException() {
        properties.setConfigPath("classpath:thresholds-no-defaults.yaml");

        assertThatThrownBy(() -> repository.get())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("global_defaults");
    }

    @Test
    void get_missingGlobalThreshold_throwsConfigLoadException() {
        properties.setConfigPath("classpath:thresholds-partial.yaml");

        assertThatThrownBy(() -> repository.get())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("z_score_threshold");
        assertThat(repository.isLoaded()).isFalse();
        verify(metricsConfig).recordThresholdLoad("malformed");
    }

    @Test
    void get_tierWithoutMultiplier_throwsConfigLoadException() {
        properties.setConfigPath("classpath:thresholds-tier-no-multiplier.yaml");

        assertThatThrownBy(() -> repository.get())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("volatility_tiers.volatile.multiplier");
    }

    @Test
    void validate_rejectsNonPositiveDefaults() {
        ThresholdConfig config = ThresholdConfig.builder()
                .globalDefaults(ThresholdConfig.GlobalDefaults.builder()
                        .zScoreThreshold(3.0)
                        .volumeZThreshold(0.0)
                        .build())
                .build();

        assertThat(ThresholdConfigRepository.validate(config)).contains("volume_z_threshold");
    }

    @Test
    void reload_failure_keepsPreviousDocument() {
        ThresholdConfig loaded = repository.get();
        properties.setConfigPath("classpath:thresholds-malformed.yaml");

        assertThatThrownBy(() -> repository.reload()).isInstanceOf(ConfigLoadException.class);
        assertThat(repository.get()).isSameAs(loaded);
    }
}
