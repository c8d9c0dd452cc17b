package com.market.anomaly.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.config.QueryConfig;
import com.market.anomaly.model.*;
import com.market.anomaly.repository.AnomalyRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.market.anomaly.testutil.TestDataFactory.createAnomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-20T12:00:00Z");

    @Mock private AnomalyRepository anomalyRepository;
    @Mock private NewsQueryService newsQueryService;
    @Mock private MetricsConfig metricsConfig;

    private ExecutorService executor;
    private AnomalyQueryService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        service = new AnomalyQueryService(anomalyRepository, newsQueryService, new QueryConfig(), metricsConfig,
                executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void findAll_buildsMetaFromCountAndPage() {
        AnomalyFilter filter = AnomalyFilter.builder().symbol("BTC-USD").build();
        when(anomalyRepository.count(filter)).thenReturn(45L);
        when(anomalyRepository.findPage(filter, 10, 10))
                .thenReturn(List.of(createAnomaly("A1", "BTC-USD", NOW, AnomalyType.PRICE_SPIKE)));

        PagedResponse<Anomaly> result = service.findAll(filter, 2, 10);

        assertThat(result.data()).hasSize(1);
        assertThat(result.meta()).isEqualTo(new PaginationMeta(2, 10, 45, 5, true, true));
    }

    @Test
    void findAll_clampsPageAndLimit() {
        AnomalyFilter filter = AnomalyFilter.none();
        when(anomalyRepository.count(filter)).thenReturn(0L);
        when(anomalyRepository.findPage(eq(filter), anyLong(), anyInt())).thenReturn(List.of());

        PagedResponse<Anomaly> oversized = service.findAll(filter, 0, 500);
        PagedResponse<Anomaly> undersized = service.findAll(filter, -3, 0);

        assertThat(oversized.meta().page()).isEqualTo(1);
        assertThat(oversized.meta().limit()).isEqualTo(100);
        assertThat(undersized.meta().limit()).isEqualTo(1);
        verify(anomalyRepository).findPage(filter, 0, 100);
        verify(anomalyRepository).findPage(filter, 0, 1);
    }

    @Test
    void findAll_maxPage_computesSkipWithoutOverflow() {
        AnomalyFilter filter = AnomalyFilter.none();
        long expectedSkip = (long) (Integer.MAX_VALUE - 1) * 100;
        when(anomalyRepository.count(filter)).thenReturn(5L);
        when(anomalyRepository.findPage(filter, expectedSkip, 100)).thenReturn(List.of());

        PagedResponse<Anomaly> result = service.findAll(filter, Integer.MAX_VALUE, 100);

        assertThat(result.data()).isEmpty();
        assertThat(result.meta().page()).isEqualTo(Integer.MAX_VALUE);
        assertThat(result.meta().hasNext()).isFalse();
    }

    @Test
    void findAll_storeFailure_surfacesOriginalException() {
        AnomalyFilter filter = AnomalyFilter.none();
        AerospikeException failure = new AerospikeException(ResultCode.SERVER_NOT_AVAILABLE, "down");
        when(anomalyRepository.count(filter)).thenThrow(failure);
        lenient().when(anomalyRepository.findPage(eq(filter), anyLong(), anyInt())).thenReturn(List.of());

        assertThatThrownBy(() -> service.findAll(filter, 1, 20)).isSameAs(failure);
    }

    @Test
    void findById_attachesNewsArticlesAndClusters() {
        when(anomalyRepository.findById("A1")).thenReturn(createAnomaly("A1", "BTC-USD", NOW, AnomalyType.PRICE_SPIKE));
        NewsArticle article = NewsArticle.builder().id("N1").anomalyId("A1").clusterId(0).build();
        NewsCluster cluster = NewsCluster.builder().id("C1").anomalyId("A1").clusterNumber(0)
                .articles(List.of(article)).build();
        when(newsQueryService.findForAnomaly("A1")).thenReturn(new AnomalyNews(List.of(article), List.of(cluster)));

        Anomaly anomaly = service.findById("A1");

        assertThat(anomaly.getNewsArticles()).extracting(NewsArticle::getId).containsExactly("N1");
        assertThat(anomaly.getNewsClusters()).extracting(NewsCluster::getId).containsExactly("C1");
    }

    @Test
    void findById_missing_skipsNewsLookup() {
        when(anomalyRepository.findById("NOPE")).thenReturn(null);

        assertThat(service.findById("NOPE")).isNull();
        verifyNoInteractions(newsQueryService);
    }

    @Test
    void findLatest_usesConfiguredCap() {
        Instant since = NOW.minusSeconds(300);
        when(anomalyRepository.findDetectedAfter(since, Set.of("BTC-USD"), 50)).thenReturn(List.of());

        assertThat(service.findLatest(since, Set.of("BTC-USD"))).isEmpty();
        verify(metricsConfig).recordQuery("find_latest", 0);
    }

    @Test
    void getStats_validationBreakdownSumsToTotal() {
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        byType.put(AnomalyType.PRICE_SPIKE, 6L);
        byType.put(AnomalyType.PRICE_DROP, 2L);
        byType.put(AnomalyType.VOLUME_SPIKE, 2L);
        byType.put(AnomalyType.COMBINED, 0L);

        when(anomalyRepository.count(any(AnomalyFilter.class))).thenAnswer(inv -> {
            AnomalyFilter f = inv.getArgument(0);
            if (f.getValidationStatus() == ValidationStatus.VALID) return 3L;
            if (f.getValidationStatus() == ValidationStatus.INVALID) return 1L;
            if (f.getStartDate() != null && f.getStartDate().equals(NOW.minus(Duration.ofHours(24)))) return 4L;
            if (f.getStartDate() != null && f.getStartDate().equals(NOW.minus(Duration.ofDays(7)))) return 9L;
            return 10L;
        });
        when(anomalyRepository.countByType(any(AnomalyFilter.class))).thenReturn(byType);
        when(anomalyRepository.countWithNarrative(any(AnomalyFilter.class))).thenReturn(6L);

        AnomalyStats stats = service.getStats(null);

        assertThat(stats.getTotalAnomalies()).isEqualTo(10);
        assertThat(stats.getByType()).isEqualTo(byType);
        assertThat(stats.getByValidationStatus())
                .containsEntry(ValidationStatus.NOT_GENERATED, 4L)
                .containsEntry(ValidationStatus.PENDING, 2L)
                .containsEntry(ValidationStatus.VALID, 3L)
                .containsEntry(ValidationStatus.INVALID, 1L);
        assertThat(stats.getByValidationStatus().values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(stats.getTotalAnomalies());
        assertThat(stats.getRecentCount24h()).isEqualTo(4);
        assertThat(stats.getRecentCount7d()).isEqualTo(9);
    }

    @Test
    void getStats_scopesEveryAggregateToSymbols() {
        when(anomalyRepository.count(any(AnomalyFilter.class))).thenReturn(0L);
        when(anomalyRepository.countByType(any(AnomalyFilter.class))).thenReturn(Map.of());
        when(anomalyRepository.countWithNarrative(any(AnomalyFilter.class))).thenReturn(0L);

        service.getStats(Set.of("ETH-USD"));

        ArgumentCaptor<AnomalyFilter> filters = ArgumentCaptor.forClass(AnomalyFilter.class);
        verify(anomalyRepository, times(5)).count(filters.capture());
        assertThat(filters.getAllValues()).allSatisfy(f -> assertThat(f.getSymbols()).containsExactly("ETH-USD"));
    }

    @Test
    void getStats_anyFailedAggregate_failsWholeCall() {
        when(anomalyRepository.count(any(AnomalyFilter.class))).thenReturn(1L);
        when(anomalyRepository.countByType(any(AnomalyFilter.class)))
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));
        lenient().when(anomalyRepository.countWithNarrative(any(AnomalyFilter.class))).thenReturn(0L);

        assertThatThrownBy(() -> service.getStats(null)).isInstanceOf(AerospikeException.class);
    }
}
