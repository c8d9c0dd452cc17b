package com.market.anomaly.model;

public record PaginationMeta(int page, int limit, long total, int totalPages, boolean hasNext, boolean hasPrev) {

    public static PaginationMeta of(int page, int limit, long total) {
        int totalPages = (int) ((total + limit - 1) / limit);
        return new PaginationMeta(page, limit, total, totalPages, page < totalPages, page > 1);
    }
}
