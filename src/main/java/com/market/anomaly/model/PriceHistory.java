package com.market.anomaly.model;

import java.util.List;

public record PriceHistory(String symbol, Granularity granularity, List<AggregatedPricePoint> data) {}
