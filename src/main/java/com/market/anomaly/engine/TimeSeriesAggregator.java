package com.market.anomaly.engine;

import com.market.anomaly.model.AggregatedPricePoint;
import com.market.anomaly.model.Granularity;
import com.market.anomaly.model.PriceSample;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups price samples into calendar-aligned UTC buckets and averages them.
 * Stateless; buckets without samples are not emitted.
 */
@Component
public class TimeSeriesAggregator {

    private static final Comparator<BucketKey> BUCKET_ORDER =
            Comparator.comparing(BucketKey::start)
                    .thenComparing(BucketKey::symbol, Comparator.nullsFirst(Comparator.naturalOrder()));

    public List<AggregatedPricePoint> aggregate(List<PriceSample> samples, Granularity granularity) {
        if (samples == null || samples.isEmpty()) {
            return List.of();
        }
        // 1m is the native sample rate: hand samples back untouched, in their own order
        if (granularity == Granularity.ONE_MINUTE) {
            return samples.stream().map(AggregatedPricePoint::fromSample).toList();
        }

        Map<BucketKey, Bucket> buckets = new TreeMap<>(BUCKET_ORDER);
        for (PriceSample sample : samples) {
            BucketKey key = new BucketKey(bucketStart(sample.getTimestamp(), granularity), sample.getSymbol());
            buckets.computeIfAbsent(key, k -> new Bucket()).add(sample);
        }

        List<AggregatedPricePoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((key, bucket) -> points.add(AggregatedPricePoint.builder()
                .bucketStart(key.start())
                .symbol(key.symbol())
                .price(bucket.meanPrice())
                .volume(bucket.meanVolume())
                .build()));
        return points;
    }

    /**
     * Start of the bucket holding {@code timestamp}. Five-minute buckets are aligned to the
     * enclosing hour (:00, :05, ... :55), not to the start of the query window.
     */
    public static Instant bucketStart(Instant timestamp, Granularity granularity) {
        switch (granularity) {
            case ONE_MINUTE:
                return timestamp.truncatedTo(ChronoUnit.MINUTES);
            case FIVE_MINUTES:
                Instant hour = timestamp.truncatedTo(ChronoUnit.HOURS);
                long minuteOfHour = Duration.between(hour, timestamp).toMinutes();
                return hour.plus(5 * (minuteOfHour / 5), ChronoUnit.MINUTES);
            case ONE_HOUR:
                return timestamp.truncatedTo(ChronoUnit.HOURS);
            case ONE_DAY:
                return timestamp.truncatedTo(ChronoUnit.DAYS);
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    private record BucketKey(Instant start, String symbol) {}

    private static final class Bucket {
        private double priceSum;
        private int priceCount;
        private double volumeSum;
        private int volumeCount;

        void add(PriceSample sample) {
            priceSum += sample.getPrice();
            priceCount++;
            if (sample.getVolume() != null) {
                volumeSum += sample.getVolume();
                volumeCount++;
            }
        }

        double meanPrice() {
            return priceSum / priceCount;
        }

        Double meanVolume() {
            return volumeCount > 0 ? volumeSum / volumeCount : null;
        }
    }
}
