package com.market.anomaly.engine;

import com.market.anomaly.model.Granularity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Picks the bucket width for a price-history window ("auto" aggregation).
 */
@Component
public class GranularitySelector {

    static final Duration RAW_MAX_SPAN = Duration.ofHours(24);
    static final Duration FIVE_MINUTE_MAX_SPAN = Duration.ofDays(7);
    static final Duration HOURLY_MAX_SPAN = Duration.ofDays(30);

    public Granularity select(Instant start, Instant end) {
        Duration span = Duration.between(start, end);
        if (span.compareTo(RAW_MAX_SPAN) <= 0) return Granularity.ONE_MINUTE;
        if (span.compareTo(FIVE_MINUTE_MAX_SPAN) <= 0) return Granularity.FIVE_MINUTES;
        if (span.compareTo(HOURLY_MAX_SPAN) <= 0) return Granularity.ONE_HOUR;
        return Granularity.ONE_DAY;
    }

    /**
     * An explicit granularity is used as given; {@code null} means auto.
     */
    public Granularity resolve(Granularity requested, Instant start, Instant end) {
        return requested != null ? requested : select(start, end);
    }
}
