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
public class AggregatedPricePoint {
    private Instant bucketStart;
    private String symbol;
    private double price;
    private Double volume;

    public static AggregatedPricePoint fromSample(PriceSample sample) {
        return AggregatedPricePoint.builder()
                .bucketStart(sample.getTimestamp())
                .symbol(sample.getSymbol())
                .price(sample.getPrice())
                .volume(sample.getVolume())
                .build();
    }
}
