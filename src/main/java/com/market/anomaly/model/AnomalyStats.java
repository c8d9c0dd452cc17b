package com.market.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyStats {
    private long totalAnomalies;
    private Map<AnomalyType, Long> byType;
    private Map<ValidationStatus, Long> byValidationStatus;
    private long recentCount24h;
    private long recentCount7d;
}
