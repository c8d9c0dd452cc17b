package com.market.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.market.anomaly.config.AerospikeConfig;
import com.market.anomaly.model.PriceSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Price samples, one record per (symbol, minute) written by the ingestion pipeline.
 * Bins: symbol, ts (epoch millis), price, volume, high, low.
 */
@Repository
public class PriceRepository {

    private static final Logger log = LoggerFactory.getLogger(PriceRepository.class);

    private final AerospikeClient client;
    private final String namespace;

    public PriceRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    /**
     * Samples for one symbol with {@code start <= timestamp <= end}, oldest first.
     */
    public List<PriceSample> findBySymbolBetween(String symbol, Instant start, Instant end) {
        long from = start.toEpochMilli();
        long to = end.toEpochMilli();

        List<PriceSample> results = new ArrayList<>();
        for (Record record : scanSymbol(symbol)) {
            long ts = record.getLong("ts");
            if (ts < from || ts > to) continue;
            results.add(mapRecord(record));
        }
        results.sort(Comparator.comparing(PriceSample::getTimestamp));
        log.debug("Loaded {} price samples for {} in [{}, {}]", results.size(), symbol, start, end);
        return results;
    }

    public PriceSample findLatest(String symbol) {
        Record latest = null;
        for (Record record : scanSymbol(symbol)) {
            if (latest == null || record.getLong("ts") > latest.getLong("ts")) {
                latest = record;
            }
        }
        return latest != null ? mapRecord(latest) : null;
    }

    private List<Record> scanSymbol(String symbol) {
        List<Record> records = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PRICES,
                (key, record) -> {
                    if (symbol.equals(record.getString("symbol"))) {
                        synchronized (records) {
                            records.add(record);
                        }
                    }
                });
        return records;
    }

    private PriceSample mapRecord(Record record) {
        return PriceSample.builder()
                .symbol(record.getString("symbol"))
                .timestamp(Instant.ofEpochMilli(record.getLong("ts")))
                .price(record.getDouble("price"))
                .volume(optionalDouble(record, "volume"))
                .high(optionalDouble(record, "high"))
                .low(optionalDouble(record, "low"))
                .build();
    }

    static Double optionalDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number n ? n.doubleValue() : null;
    }
}
