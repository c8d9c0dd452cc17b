package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolStats {
    private String symbol;
    private String name;
    private VolatilityTier volatilityTier;
    private long anomalyCount;
    private long narrativeCount;
    private Double avgAnomalyConfidence;
    private Instant firstAnomalyTime;
    private Instant lastAnomalyTime;
    private Double latestPrice;
    private Instant latestPriceTime;
}
