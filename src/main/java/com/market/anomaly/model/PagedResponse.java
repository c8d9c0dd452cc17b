package com.market.anomaly.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, PaginationMeta meta) {}
