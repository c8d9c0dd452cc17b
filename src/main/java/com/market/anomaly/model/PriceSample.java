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
public class PriceSample {
    private String symbol;
    private Instant timestamp;
    private double price;
    private Double volume;
    private Double high;
    private Double low;
}
