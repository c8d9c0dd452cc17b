package com.market.anomaly.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static com.market.anomaly.testutil.TestDataFactory.createNewsArticle;
import static org.assertj.core.api.Assertions.assertThat;

class NewsModelTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void sentiment_fromScore_usesSymmetricBand() {
        assertThat(NewsSentiment.fromScore(0.35)).isEqualTo(NewsSentiment.POSITIVE);
        assertThat(NewsSentiment.fromScore(-0.2)).isEqualTo(NewsSentiment.NEGATIVE);
        assertThat(NewsSentiment.fromScore(0.1)).isEqualTo(NewsSentiment.NEUTRAL);
        assertThat(NewsSentiment.fromScore(-0.1)).isEqualTo(NewsSentiment.NEUTRAL);
        assertThat(NewsSentiment.fromScore(null)).isNull();
    }

    @Test
    void timing_fromTag_acceptsPipelineAndApiCodes() {
        assertThat(NewsTiming.fromTag("pre_event")).isEqualTo(NewsTiming.BEFORE);
        assertThat(NewsTiming.fromTag("POST_EVENT")).isEqualTo(NewsTiming.AFTER);
        assertThat(NewsTiming.fromTag("during")).isEqualTo(NewsTiming.DURING);
        assertThat(NewsTiming.fromTag("sometime")).isNull();
        assertThat(NewsTiming.fromTag(null)).isNull();
    }

    @Test
    void filter_dateBoundsAreInclusive() {
        NewsFilter filter = NewsFilter.builder().startDate(T0).endDate(T0.plusSeconds(60)).build();

        assertThat(filter.matches(createNewsArticle("N1", "A1", T0, null))).isTrue();
        assertThat(filter.matches(createNewsArticle("N2", "A1", T0.plusSeconds(60), null))).isTrue();
        assertThat(filter.matches(createNewsArticle("N3", "A1", T0.plusSeconds(61), null))).isFalse();
        assertThat(filter.matches(createNewsArticle("N4", "A1", null, null))).isFalse();
    }

    @Test
    void filter_anomalyIdAndIdSetCombine() {
        NewsFilter filter = NewsFilter.builder().anomalyId("A1").anomalyIds(Set.of("A1", "A2")).build();

        assertThat(filter.matches(createNewsArticle("N1", "A1", T0, null))).isTrue();
        assertThat(filter.matches(createNewsArticle("N2", "A2", T0, null))).isFalse();
        assertThat(NewsFilter.builder().build().matches(createNewsArticle("N3", "A9", null, null))).isTrue();
    }
}
