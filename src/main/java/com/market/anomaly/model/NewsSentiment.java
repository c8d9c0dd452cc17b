package com.market.anomaly.model;

/**
 * Coarse sentiment label for a news score in [-1, 1].
 */
public enum NewsSentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    static final double THRESHOLD = 0.1;

    /**
     * @return null when no score was recorded
     */
    public static NewsSentiment fromScore(Double score) {
        if (score == null) return null;
        if (score > THRESHOLD) return POSITIVE;
        if (score < -THRESHOLD) return NEGATIVE;
        return NEUTRAL;
    }
}
