package com.market.anomaly.engine;

import com.market.anomaly.model.AggregatedPricePoint;
import com.market.anomaly.model.Granularity;
import com.market.anomaly.model.PriceSample;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.market.anomaly.testutil.TestDataFactory.createPriceSample;
import static org.assertj.core.api.Assertions.assertThat;

class TimeSeriesAggregatorTest {

    private final TimeSeriesAggregator aggregator = new TimeSeriesAggregator();

    @Test
    void aggregate_emptyInput_returnsEmpty() {
        assertThat(aggregator.aggregate(List.of(), Granularity.ONE_HOUR)).isEmpty();
        assertThat(aggregator.aggregate(List.of(), Granularity.ONE_MINUTE)).isEmpty();
    }

    @Test
    void aggregate_oneMinute_returnsSamplesVerbatimInInputOrder() {
        List<PriceSample> samples = List.of(
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:02:30Z"), 101.0, 5.0),
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:00:10Z"), 100.0, null));

        List<AggregatedPricePoint> points = aggregator.aggregate(samples, Granularity.ONE_MINUTE);

        assertThat(points).hasSize(2);
        // raw timestamps, not truncated, not reordered
        assertThat(points.get(0).getBucketStart()).isEqualTo(Instant.parse("2024-01-15T10:02:30Z"));
        assertThat(points.get(0).getPrice()).isEqualTo(101.0);
        assertThat(points.get(1).getVolume()).isNull();
    }

    @Test
    void aggregate_fiveMinutes_alignsToHourAndAverages() {
        List<PriceSample> samples = List.of(
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:07:00Z"), 100.0, 10.0),
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:09:59Z"), 110.0, 30.0),
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:10:00Z"), 120.0, null));

        List<AggregatedPricePoint> points = aggregator.aggregate(samples, Granularity.FIVE_MINUTES);

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getBucketStart()).isEqualTo(Instant.parse("2024-01-15T10:05:00Z"));
        assertThat(points.get(0).getPrice()).isEqualTo(105.0);
        assertThat(points.get(0).getVolume()).isEqualTo(20.0);
        assertThat(points.get(1).getBucketStart()).isEqualTo(Instant.parse("2024-01-15T10:10:00Z"));
        assertThat(points.get(1).getVolume()).isNull();
    }

    @Test
    void aggregate_volumeMeanIgnoresMissingVolumes() {
        List<PriceSample> samples = List.of(
                createPriceSample("ETH-USD", Instant.parse("2024-01-15T10:01:00Z"), 10.0, 4.0),
                createPriceSample("ETH-USD", Instant.parse("2024-01-15T10:20:00Z"), 20.0, null),
                createPriceSample("ETH-USD", Instant.parse("2024-01-15T10:40:00Z"), 30.0, 8.0));

        List<AggregatedPricePoint> points = aggregator.aggregate(samples, Granularity.ONE_HOUR);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).getPrice()).isEqualTo(20.0);
        assertThat(points.get(0).getVolume()).isEqualTo(6.0);
    }

    @Test
    void aggregate_day_outputAscendingWithoutEmptyBuckets() {
        List<PriceSample> samples = List.of(
                createPriceSample("SOL-USD", Instant.parse("2024-01-20T23:59:59Z"), 3.0, 1.0),
                createPriceSample("SOL-USD", Instant.parse("2024-01-15T00:00:00Z"), 1.0, 1.0),
                createPriceSample("SOL-USD", Instant.parse("2024-01-15T12:00:00Z"), 2.0, 1.0));

        List<AggregatedPricePoint> points = aggregator.aggregate(samples, Granularity.ONE_DAY);

        assertThat(points).extracting(AggregatedPricePoint::getBucketStart)
                .containsExactly(Instant.parse("2024-01-15T00:00:00Z"), Instant.parse("2024-01-20T00:00:00Z"));
        assertThat(points.get(0).getPrice()).isEqualTo(1.5);
    }

    @Test
    void aggregate_bucketStartsAreTruncatedAndDistinct() {
        List<PriceSample> samples = List.of(
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T10:59:59Z"), 1.0, null),
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T11:00:00Z"), 1.0, null),
                createPriceSample("BTC-USD", Instant.parse("2024-01-15T11:30:00Z"), 1.0, null));

        List<AggregatedPricePoint> points = aggregator.aggregate(samples, Granularity.ONE_HOUR);

        assertThat(points).extracting(AggregatedPricePoint::getBucketStart)
                .doesNotHaveDuplicates()
                .allSatisfy(start -> assertThat(start.getEpochSecond() % 3600).isZero());
    }

    @Test
    void bucketStart_fiveMinuteBoundaries() {
        assertThat(TimeSeriesAggregator.bucketStart(Instant.parse("2024-01-15T10:59:59Z"), Granularity.FIVE_MINUTES))
                .isEqualTo(Instant.parse("2024-01-15T10:55:00Z"));
        assertThat(TimeSeriesAggregator.bucketStart(Instant.parse("2024-01-15T10:00:00Z"), Granularity.FIVE_MINUTES))
                .isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
    }
}
