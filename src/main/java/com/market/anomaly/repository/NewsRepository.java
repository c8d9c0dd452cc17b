package com.market.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.market.anomaly.config.AerospikeConfig;
import com.market.anomaly.model.NewsArticle;
import com.market.anomaly.model.NewsCluster;
import com.market.anomaly.model.NewsFilter;
import com.market.anomaly.model.NewsSentiment;
import com.market.anomaly.model.NewsTiming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * News articles and article clusters written by the journalist stage, keyed to anomalies.
 *
 * <p>Article bins: id, anomalyId, source, title, url, summary, publishedAt, sentiment,
 * timingTag, timeDiffMin, clusterId (-1 when unclustered), createdAt.
 * Cluster bins: id, anomalyId, clusterNum, summary, sentiment, size, createdAt.
 */
@Repository
public class NewsRepository {

    private static final Logger log = LoggerFactory.getLogger(NewsRepository.class);

    static final String UNKNOWN_SOURCE = "unknown";
    static final long UNCLUSTERED = -1;

    /** Newest published first, undated last; id breaks ties. */
    public static final Comparator<NewsArticle> NEWEST_FIRST =
            Comparator.comparing(NewsArticle::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(NewsArticle::getId);

    private final AerospikeClient client;
    private final String namespace;

    public NewsRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    public long count(NewsFilter filter) {
        return findMatching(filter).size();
    }

    /**
     * One page of the filtered articles in {@link #NEWEST_FIRST} order.
     */
    public List<NewsArticle> findPage(NewsFilter filter, long skip, int limit) {
        List<NewsArticle> matches = findMatching(filter);
        if (skip < 0 || skip >= matches.size()) {
            return List.of();
        }
        matches.sort(NEWEST_FIRST);
        int from = (int) skip;
        return new ArrayList<>(matches.subList(from, (int) Math.min(matches.size(), skip + limit)));
    }

    public List<NewsArticle> findByAnomalyId(String anomalyId) {
        List<NewsArticle> articles = findMatching(NewsFilter.forAnomaly(anomalyId));
        articles.sort(NEWEST_FIRST);
        return articles;
    }

    /**
     * Clusters for one anomaly by ascending cluster number, without their articles.
     */
    public List<NewsCluster> findClustersByAnomalyId(String anomalyId) {
        List<NewsCluster> clusters = new ArrayList<>();
        for (Record record : scan(AerospikeConfig.SET_NEWS_CLUSTERS)) {
            if (anomalyId.equals(record.getString("anomalyId"))) {
                clusters.add(mapCluster(record));
            }
        }
        clusters.sort(Comparator.comparingInt(NewsCluster::getClusterNumber));
        return clusters;
    }

    private List<NewsArticle> findMatching(NewsFilter filter) {
        List<Record> records = scan(AerospikeConfig.SET_NEWS);
        List<NewsArticle> matches = new ArrayList<>();
        for (Record record : records) {
            NewsArticle article = mapArticle(record);
            if (filter.matches(article)) {
                matches.add(article);
            }
        }
        log.debug("News scan: {} records, {} matched", records.size(), matches.size());
        return matches;
    }

    private List<Record> scan(String set) {
        List<Record> records = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, set,
                (key, record) -> {
                    synchronized (records) {
                        records.add(record);
                    }
                });
        return records;
    }

    private NewsArticle mapArticle(Record record) {
        String source = record.getString("source");
        Object clusterId = record.getValue("clusterId");
        return NewsArticle.builder()
                .id(record.getString("id"))
                .anomalyId(record.getString("anomalyId"))
                .title(record.getString("title"))
                .url(record.getString("url"))
                .source(source != null && !source.isBlank() ? source : UNKNOWN_SOURCE)
                .summary(record.getString("summary"))
                .publishedAt(optionalInstant(record, "publishedAt"))
                .sentiment(NewsSentiment.fromScore(PriceRepository.optionalDouble(record, "sentiment")))
                .timing(NewsTiming.fromTag(record.getString("timingTag")))
                .timeDiffMinutes(PriceRepository.optionalDouble(record, "timeDiffMin"))
                .clusterId(clusterId instanceof Number n && n.longValue() != UNCLUSTERED ? n.intValue() : null)
                .createdAt(optionalInstant(record, "createdAt"))
                .build();
    }

    private NewsCluster mapCluster(Record record) {
        int clusterNumber = record.getInt("clusterNum");
        String summary = record.getString("summary");
        return NewsCluster.builder()
                .id(record.getString("id"))
                .anomalyId(record.getString("anomalyId"))
                .clusterNumber(clusterNumber)
                .clusterLabel(summary != null && !summary.isBlank() ? summary : "Cluster " + clusterNumber)
                .articleCount(record.getInt("size"))
                .averageSentiment(NewsSentiment.fromScore(PriceRepository.optionalDouble(record, "sentiment")))
                .createdAt(optionalInstant(record, "createdAt"))
                .build();
    }

    private static Instant optionalInstant(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }
}
