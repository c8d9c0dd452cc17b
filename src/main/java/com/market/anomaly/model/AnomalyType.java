package com.market.anomaly.model;

import java.util.Locale;

public enum AnomalyType {
    PRICE_SPIKE,
    PRICE_DROP,
    VOLUME_SPIKE,
    COMBINED;

    /**
     * Parse a stored or requested type code. The detector writes lower-case codes,
     * the API accepts upper-case ones; both map to the same constant.
     *
     * @throws IllegalArgumentException for any value outside the four known types
     */
    public static AnomalyType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Anomaly type must not be empty");
        }
        return AnomalyType.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
