package com.market.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "thresholds")
public class ThresholdProperties {

    // Spring resource location: classpath:..., file:...
    private String configPath = "classpath:thresholds.yaml";

    // Load the document during startup so a broken file stops the process
    private boolean failFast = true;
}
