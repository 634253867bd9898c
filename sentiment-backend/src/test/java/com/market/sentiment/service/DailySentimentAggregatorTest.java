package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.repository.DailyBrandSentimentRepository;
import com.market.sentiment.repository.SentimentEventRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailySentimentAggregatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);
    private static final LocalDateTime LOADED_AT = LocalDateTime.of(2024, 1, 16, 4, 0);

    @Mock
    private SentimentEventRepository eventRepository;

    @Mock
    private DailyBrandSentimentRepository dailyRepository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private DailySentimentAggregator aggregator;

    private final SentimentAlgorithm algorithm = new SentimentAlgorithm(new SentimentProperties());

    private SentimentEvent event(String brand, LocalDateTime publishedAt, double score, String source, long engagement) {
        SentimentEvent event = new SentimentEvent();
        event.setEventId(brand + publishedAt + score);
        event.setBrand(brand);
        event.setPublishedAt(publishedAt);
        event.setSentimentScore(score);
        event.setSentimentCategory(algorithm.categorize(score));
        event.setSource(source);
        event.setEngagementCount(engagement);
        event.setQualityFlag(QualityFlag.VALID);
        return event;
    }

    // 10 条事件：5 条 ≥ 0.3，3 条 ≤ -0.3，2 条中性
    @Test
    void countsByCategoryAddUpToContentCount() {
        double[] scores = {0.3, 0.5, 0.9, 0.4, 0.8, -0.3, -0.7, -0.5, 0.0, 0.1};
        List<SentimentEvent> group = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            String source = i % 2 == 0 ? "social" : "news";
            group.add(event("PEPSI", DAY.atTime(8, i), scores[i], source, source.equals("social") ? 10 : 0));
        }

        DailyBrandSentiment row = aggregator.aggregate(DAY, "PEPSI", group, LOADED_AT);

        assertThat(row.getContentCount()).isEqualTo(10L);
        assertThat(row.getPositiveCount()).isEqualTo(5L);
        assertThat(row.getNegativeCount()).isEqualTo(3L);
        assertThat(row.getNeutralCount()).isEqualTo(2L);
        assertThat(row.getPositiveCount() + row.getNegativeCount() + row.getNeutralCount())
                .isEqualTo(row.getContentCount());
        assertThat(row.getSourceCount()).isEqualTo(2);
        assertThat(row.getAvgSentiment()).isCloseTo(0.15, within(1e-9));
        assertThat(row.getMinSentiment()).isEqualTo(-0.7);
        assertThat(row.getMaxSentiment()).isEqualTo(0.9);
        assertThat(row.getPositiveRatio()).isEqualTo(0.5);
        assertThat(row.getTotalEngagement()).isEqualTo(50L);
        assertThat(row.getAvgEngagement()).isEqualTo(5.0);
        assertThat(row.getAnomalyFlag()).isEqualTo(AnomalyFlag.NORMAL);
    }

    @Test
    void singleEventHasNoStddev() {
        DailyBrandSentiment row = aggregator.aggregate(DAY, "PEPSI",
                List.of(event("PEPSI", DAY.atTime(9, 0), 0.4, "news", 0)), LOADED_AT);

        assertThat(row.getStddevSentiment()).isNull();
        assertThat(row.getContentCount()).isEqualTo(1L);
    }

    @Test
    void recomputeStartsAtWindowStartDateAndGroupsByDayAndBrand() {
        LocalDateTime windowStart = LocalDateTime.of(2024, 1, 14, 18, 0);
        List<SentimentEvent> events = List.of(
                event("PEPSI", DAY.atTime(1, 0), 0.5, "social", 3),
                event("PEPSI", DAY.atTime(2, 0), -0.5, "social", 1),
                event("SPRITE", DAY.atTime(3, 0), 0.1, "news", 0),
                event("PEPSI", DAY.plusDays(1).atTime(3, 0), 0.2, "news", 0),
                event(null, DAY.atTime(4, 0), 0.2, "news", 0));
        when(eventRepository.findByQualityFlagAndPublishedAtGreaterThanEqual(QualityFlag.VALID,
                LocalDate.of(2024, 1, 14).atStartOfDay())).thenReturn(events);

        List<DailyBrandSentiment> rows = aggregator.recompute(windowStart, LOADED_AT);

        verify(dailyRepository).deleteBySentimentDateFrom(LocalDate.of(2024, 1, 14));
        assertThat(rows).extracting(DailyBrandSentiment::getSentimentDate, DailyBrandSentiment::getBrand)
                .containsExactly(
                        tuple(DAY, "PEPSI"),
                        tuple(DAY, "SPRITE"),
                        tuple(DAY.plusDays(1), "PEPSI"));
        assertThat(rows.get(0).getContentCount()).isEqualTo(2L);
        assertThat(rows.get(0).getStddevSentiment()).isEqualTo(0.707);
    }
}
