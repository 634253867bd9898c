package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.dto.NormalizationResult;
import com.market.sentiment.entity.SourceKind;
import com.market.sentiment.exception.ErrorKind;
import com.market.sentiment.exception.SchemaException;
import com.market.sentiment.feed.SentimentScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventNormalizerTest {

    private static final LocalDateTime RUN_TIME = LocalDateTime.of(2024, 2, 1, 4, 0);

    @Mock
    private SentimentScorer sentimentScorer;

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(sentimentScorer, new SentimentAlgorithm(new SentimentProperties()));
    }

    private Map<String, Object> socialRecord() {
        Map<String, Object> record = new HashMap<>();
        record.put("post_id", "reddit_00001");
        record.put("author", "user_1234");
        record.put("brand", "  coca-cola ");
        record.put("parent_company", "The Coca-Cola Company");
        record.put("brand_category", "Beverages");
        record.put("title", "New   flavor\n launch ");
        record.put("body", "Tried it today");
        record.put("upvotes", 250);
        record.put("created_at", "2024-01-15T10:30:00");
        record.put("sentiment_score", 0.5);
        record.put("subreddit", "r/soda");
        record.put("ingested_at", "2024-01-16T00:00:00");
        return record;
    }

    @Test
    void mapsSocialRecordToCanonicalEvent() {
        CanonicalEventDTO event = normalizer.normalize(SourceKind.SOCIAL, socialRecord(), RUN_TIME);

        assertThat(event.getSourceId()).isEqualTo("reddit_00001");
        assertThat(event.getSource()).isEqualTo(SourceKind.SOCIAL);
        assertThat(event.getBrand()).isEqualTo("COCA-COLA");
        assertThat(event.getParentCompany()).isEqualTo("THE COCA-COLA COMPANY");
        assertThat(event.getCategory()).isEqualTo("BEVERAGES");
        assertThat(event.getCreator()).isEqualTo("user_1234");
        assertThat(event.getHeadline()).isEqualTo("New flavor launch");
        assertThat(event.getChannel()).isEqualTo("r/soda");
        assertThat(event.getEngagementCount()).isEqualTo(250L);
        assertThat(event.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 30));
        assertThat(event.getIngestedAt()).isEqualTo(LocalDateTime.of(2024, 1, 16, 0, 0));
        assertThat(event.getSentimentScore()).isEqualTo(0.5);
        assertThat(event.getSentimentCategory()).isEqualTo("positive");
        verify(sentimentScorer, never()).score(anyString());
    }

    @Test
    void mapsNewsRecordWithDefaults() {
        Map<String, Object> record = new HashMap<>();
        record.put("article_id", "news_00007");
        record.put("publication", "Reuters");
        record.put("brand", "Pepsi");
        record.put("headline", "   ");
        record.put("url", "https://example.com/a");
        record.put("published_at", "2024-01-15 08:00:00");
        record.put("sentiment_score", "-0.45");

        CanonicalEventDTO event = normalizer.normalize(SourceKind.NEWS, record, RUN_TIME);

        assertThat(event.getCreator()).isEqualTo("Reuters");
        assertThat(event.getHeadline()).isNull();
        assertThat(event.getEngagementCount()).isZero();
        assertThat(event.getChannel()).isNull();
        assertThat(event.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 8, 0));
        assertThat(event.getIngestedAt()).isEqualTo(RUN_TIME);
        assertThat(event.getSentimentCategory()).isEqualTo("negative");
    }

    @Test
    void offsetTimestampIsConvertedToUtc() {
        Map<String, Object> record = socialRecord();
        record.put("created_at", "2024-01-15T12:30:00+02:00");

        CanonicalEventDTO event = normalizer.normalize(SourceKind.SOCIAL, record, RUN_TIME);

        assertThat(event.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 30));
    }

    @Test
    void dateOnlyAndObjectTimestampsAreAccepted() {
        Map<String, Object> record = socialRecord();
        record.put("created_at", "2024-01-15");
        assertThat(normalizer.normalize(SourceKind.SOCIAL, record, RUN_TIME).getPublishedAt())
                .isEqualTo(LocalDateTime.of(2024, 1, 15, 0, 0));

        record.put("created_at", java.sql.Timestamp.valueOf("2024-01-15 10:30:00"));
        assertThat(normalizer.normalize(SourceKind.SOCIAL, record, RUN_TIME).getPublishedAt())
                .isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 30));
    }

    @Test
    void negativeEngagementIsClampedToZero() {
        Map<String, Object> record = socialRecord();
        record.put("upvotes", -12);

        assertThat(normalizer.normalize(SourceKind.SOCIAL, record, RUN_TIME).getEngagementCount()).isZero();
    }

    @Test
    void missingScoreIsDelegatedToScorer() {
        Map<String, Object> record = socialRecord();
        record.remove("sentiment_score");
        when(sentimentScorer.score("New flavor launch Tried it today")).thenReturn(-0.6);

        CanonicalEventDTO event = normalizer.normalize(SourceKind.SOCIAL, record, RUN_TIME);

        assertThat(event.getSentimentScore()).isEqualTo(-0.6);
        assertThat(event.getSentimentCategory()).isEqualTo("negative");
    }

    @Test
    void missingIdentityFieldsRaiseSchemaException() {
        Map<String, Object> noId = socialRecord();
        noId.remove("post_id");
        assertThatThrownBy(() -> normalizer.normalize(SourceKind.SOCIAL, noId, RUN_TIME))
                .isInstanceOf(SchemaException.class)
                .satisfies(e -> assertThat(((SchemaException) e).getErrorKind()).isEqualTo(ErrorKind.SCHEMA_ERROR));

        Map<String, Object> noTime = socialRecord();
        noTime.remove("created_at");
        assertThatThrownBy(() -> normalizer.normalize(SourceKind.SOCIAL, noTime, RUN_TIME))
                .isInstanceOf(SchemaException.class);

        Map<String, Object> badTime = socialRecord();
        badTime.put("created_at", "yesterday");
        assertThatThrownBy(() -> normalizer.normalize(SourceKind.SOCIAL, badTime, RUN_TIME))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("yesterday");
    }

    // 批次内 Schema 错误只计数，不影响其他记录
    @Test
    void batchCountsSchemaErrorsAndKeepsGoodRecords() {
        Map<String, Object> noId = socialRecord();
        noId.remove("post_id");
        Map<String, Object> badTime = socialRecord();
        badTime.put("created_at", "not-a-date");
        Map<String, Object> unknownField = socialRecord();
        unknownField.put("flair", "discussion");

        NormalizationResult result = normalizer.normalizeBatch(SourceKind.SOCIAL,
                List.of(noId, badTime, unknownField), RUN_TIME);

        assertThat(result.getRawRecords()).isEqualTo(3);
        assertThat(result.getSchemaErrors()).isEqualTo(2);
        assertThat(result.getEvents()).hasSize(1);
        assertThat(result.getEvents().get(0).getSourceId()).isEqualTo("reddit_00001");
    }
}
