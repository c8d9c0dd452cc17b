package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucket widths for price history. {@link #ONE_MINUTE} means raw samples, no aggregation.
 */
public enum Granularity {
    ONE_MINUTE("1m"),
    FIVE_MINUTES("5m"),
    ONE_HOUR("1h"),
    ONE_DAY("1d");

    public static final String AUTO = "auto";

    private final String code;

    Granularity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Granularity fromCode(String code) {
        for (Granularity g : values()) {
            if (g.code.equalsIgnoreCase(code)) {
                return g;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + code);
    }
}
