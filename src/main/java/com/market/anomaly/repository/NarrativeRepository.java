package com.market.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.market.anomaly.config.AerospikeConfig;
import com.market.anomaly.model.Narrative;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Narratives keyed by the id of the anomaly they explain (at most one each).
 */
@Repository
public class NarrativeRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final BatchPolicy batchPolicy;

    public NarrativeRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.batchPolicy = batchPolicy;
    }

    /**
     * Batch lookup; anomalies without a narrative are simply absent from the result.
     */
    public Map<String, Narrative> findByAnomalyIds(Collection<String> anomalyIds) {
        if (anomalyIds.isEmpty()) {
            return Map.of();
        }
        List<String> ids = List.copyOf(anomalyIds);
        Key[] keys = ids.stream()
                .map(id -> new Key(namespace, AerospikeConfig.SET_NARRATIVES, id))
                .toArray(Key[]::new);

        Record[] records = client.get(batchPolicy, keys);

        Map<String, Narrative> narratives = new HashMap<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                narratives.put(ids.get(i), mapRecord(ids.get(i), records[i]));
            }
        }
        return narratives;
    }

    private Narrative mapRecord(String anomalyId, Record record) {
        Object passed = record.getValue("validPassed");
        long createdAt = record.getLong("createdAt");
        return Narrative.builder()
                .anomalyId(anomalyId)
                .narrativeText(record.getString("text"))
                .confidenceScore(PriceRepository.optionalDouble(record, "confidence"))
                .validated(record.getBoolean("validated"))
                .validationPassed(passed == null ? null : record.getBoolean("validPassed"))
                .validationReason(record.getString("reason"))
                .createdAt(createdAt > 0 ? Instant.ofEpochMilli(createdAt) : null)
                .build();
    }
}
