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
public class Narrative {
    private String anomalyId;
    private String narrativeText;
    private Double confidenceScore;
    private boolean validated;
    private Boolean validationPassed;   // null until the validator has run
    private String validationReason;
    private Instant createdAt;
}
