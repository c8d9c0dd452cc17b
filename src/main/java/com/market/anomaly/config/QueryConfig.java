package com.market.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "market.query")
public class QueryConfig {

    // Page size used when the caller does not pass one
    private int defaultLimit = 20;

    // Upper clamp for page size
    private int maxLimit = 100;

    // Cap on the polling endpoint so a stale "since" cannot return the whole history
    private int latestCap = 50;

    // Price history window when neither start nor end is given
    private int defaultPriceWindowHours = 24;

    // Workers for concurrent sub-queries (count + page, stats aggregates)
    private int poolSize = 8;
}
