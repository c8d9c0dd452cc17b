package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VolatilityTier {
    STABLE("stable"),
    MODERATE("moderate"),
    VOLATILE("volatile");

    private final String code;

    VolatilityTier(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
