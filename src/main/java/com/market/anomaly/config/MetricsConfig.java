package com.market.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordQuery(String operation, int resultSize) {
        Counter.builder("query.count")
                .tag("operation", operation)
                .register(registry)
                .increment();

        DistributionSummary.builder("query.result_size")
                .tag("operation", operation)
                .register(registry)
                .record(resultSize);
    }

    public void recordGranularity(String granularity) {
        Counter.builder("price.granularity.count")
                .tag("granularity", granularity)
                .register(registry)
                .increment();
    }

    public void recordThresholdLoad(String outcome) {
        Counter.builder("thresholds.load.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
