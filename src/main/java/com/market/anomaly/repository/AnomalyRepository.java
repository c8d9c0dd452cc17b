package com.market.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.anomaly.config.AerospikeConfig;
import com.market.anomaly.exception.DataIntegrityException;
import com.market.anomaly.model.Anomaly;
import com.market.anomaly.model.AnomalyFilter;
import com.market.anomaly.model.AnomalyType;
import com.market.anomaly.model.Narrative;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read access to anomaly rows and their linked narratives.
 *
 * <p>Each public method is one independent store round trip (a scan plus, when narratives are
 * needed, one batch read). Callers that need several answers issue them concurrently.
 * Store failures ({@code AerospikeException}) propagate unchanged.
 */
@Repository
public class AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    /** Newest first; id breaks ties so paging over equal timestamps is stable. */
    public static final Comparator<Anomaly> NEWEST_FIRST =
            Comparator.comparing(Anomaly::getDetectedAt).reversed()
                    .thenComparing(Anomaly::getId);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final NarrativeRepository narrativeRepository;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultReadPolicy") Policy readPolicy,
                             NarrativeRepository narrativeRepository) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.narrativeRepository = narrativeRepository;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Narratives are read only when the filter needs them to decide a match.
     */
    public long count(AnomalyFilter filter) {
        return findMatching(filter, false).size();
    }

    /**
     * One page of the filtered set in {@link #NEWEST_FIRST} order, narratives attached.
     */
    public List<Anomaly> findPage(AnomalyFilter filter, long skip, int limit) {
        List<Anomaly> matches = findMatching(filter, false);
        if (skip < 0 || skip >= matches.size()) {
            return List.of();
        }
        matches.sort(NEWEST_FIRST);
        int from = (int) skip;
        List<Anomaly> page = new ArrayList<>(matches.subList(from, (int) Math.min(matches.size(), skip + limit)));
        return filter.requiresNarratives() ? page : attachNarratives(page);
    }

    /**
     * Every anomaly matching the filter, narratives attached, unordered.
     */
    public List<Anomaly> findMatching(AnomalyFilter filter) {
        return findMatching(filter, true);
    }

    /**
     * Anomalies detected strictly after {@code since}, newest first, at most {@code cap}.
     * The exclusive bound lets pollers pass the last timestamp they saw without getting it again.
     */
    public List<Anomaly> findDetectedAfter(Instant since, Set<String> symbols, int cap) {
        AnomalyFilter filter = AnomalyFilter.forSymbols(symbols);
        List<Anomaly> rows = scanRows(filter);
        rows.removeIf(a -> !a.getDetectedAt().isAfter(since));
        rows.sort(NEWEST_FIRST);
        List<Anomaly> latest = rows.size() > cap ? new ArrayList<>(rows.subList(0, cap)) : rows;
        return attachNarratives(latest);
    }

    public Map<AnomalyType, Long> countByType(AnomalyFilter filter) {
        Map<AnomalyType, Long> counts = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            counts.put(type, 0L);
        }
        for (Anomaly anomaly : findMatching(filter, false)) {
            counts.merge(anomaly.getType(), 1L, Long::sum);
        }
        return counts;
    }

    public long countWithNarrative(AnomalyFilter filter) {
        return findMatching(filter).stream()
                .filter(a -> a.getNarrative() != null)
                .count();
    }

    /**
     * Ids of every anomaly recorded for one symbol, in no particular order.
     */
    public Set<String> findIdsBySymbol(String symbol) {
        return scanRows(AnomalyFilter.builder().symbol(symbol).build()).stream()
                .map(Anomaly::getId)
                .collect(Collectors.toSet());
    }

    public Anomaly findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        Anomaly anomaly = mapRecord(record);
        Map<String, Narrative> narratives = narrativeRepository.findByAnomalyIds(List.of(anomaly.getId()));
        return anomaly.toBuilder().narrative(narratives.get(anomaly.getId())).build();
    }

    private List<Anomaly> findMatching(AnomalyFilter filter, boolean withNarratives) {
        List<Anomaly> rows = scanRows(filter);
        if (!withNarratives && !filter.requiresNarratives()) {
            return rows;
        }
        List<Anomaly> joined = attachNarratives(rows);
        if (filter.requiresNarratives()) {
            joined.removeIf(a -> !filter.matchesNarrative(a.getNarrative()));
        }
        return joined;
    }

    private List<Anomaly> scanRows(AnomalyFilter filter) {
        List<Record> records = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    synchronized (records) {
                        records.add(record);
                    }
                });

        // Mapped outside the scan callback so integrity errors surface on the caller's thread.
        // Rows for other symbols are skipped unmapped: a corrupt row only fails queries that include it.
        List<Anomaly> rows = new ArrayList<>();
        for (Record record : records) {
            if (!filter.matchesSymbol(record.getString("symbol"))) continue;
            Anomaly anomaly = mapRecord(record);
            if (filter.matchesRow(anomaly)) {
                rows.add(anomaly);
            }
        }
        log.debug("Anomaly scan: {} records, {} matched", records.size(), rows.size());
        return rows;
    }

    private List<Anomaly> attachNarratives(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return new ArrayList<>();
        }
        Collection<String> ids = anomalies.stream().map(Anomaly::getId).toList();
        Map<String, Narrative> narratives = narrativeRepository.findByAnomalyIds(ids);

        List<Anomaly> joined = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            joined.add(anomaly.toBuilder().narrative(narratives.get(anomaly.getId())).build());
        }
        return joined;
    }

    private Anomaly mapRecord(Record record) {
        String id = record.getString("id");
        return Anomaly.builder()
                .id(id)
                .symbol(record.getString("symbol"))
                .detectedAt(Instant.ofEpochMilli(record.getLong("detectedAt")))
                .type(parseType(id, record.getString("type")))
                .zScore(PriceRepository.optionalDouble(record, "zScore"))
                .priceChangePct(PriceRepository.optionalDouble(record, "priceChgPct"))
                .volumeChangePct(PriceRepository.optionalDouble(record, "volChgPct"))
                .confidence(record.getDouble("confidence"))
                .baselineWindowMinutes(record.getInt("baselineMin"))
                .priceBefore(record.getDouble("priceBefore"))
                .priceAtDetection(record.getDouble("priceAtDet"))
                .volumeBefore(PriceRepository.optionalDouble(record, "volBefore"))
                .volumeAtDetection(PriceRepository.optionalDouble(record, "volAtDet"))
                .detectionMetadata(parseMetadata(id, record.getString("detectMeta")))
                .build();
    }

    /**
     * Unknown type codes are a data-integrity problem upstream, not something to paper over.
     */
    private AnomalyType parseType(String id, String raw) {
        try {
            return AnomalyType.fromCode(raw);
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityException("Anomaly " + id + " has unknown type '" + raw + "'", e);
        }
    }

    private Map<String, Object> parseMetadata(String id, String json) {
        if (json == null || json.isEmpty()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new DataIntegrityException("Anomaly " + id + " has unreadable detection metadata", e);
        }
    }
}
