package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SourceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StagedEventPublisherTest {

    private static final LocalDateTime MERGED_AT = LocalDateTime.of(2024, 3, 31, 4, 0);

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private StagedEventPublisher publisher;

    private CanonicalEventDTO event(Double score) {
        CanonicalEventDTO dto = new CanonicalEventDTO();
        dto.setEventId("e1");
        dto.setSourceId("p1");
        dto.setSource(SourceKind.SOCIAL);
        dto.setBrand("PEPSI");
        dto.setHeadline("Pepsi");
        dto.setPublishedAt(MERGED_AT.minusHours(3));
        dto.setSentimentScore(score);
        dto.setQualityFlag(QualityFlag.INVALID_SENTIMENT);
        return dto;
    }

    @SuppressWarnings("unchecked")
    private PreparedStatement bind(CanonicalEventDTO event) throws Exception {
        List<CanonicalEventDTO> events = List.of(event);
        publisher.publish(events, MERGED_AT);

        ArgumentCaptor<ParameterizedPreparedStatementSetter<CanonicalEventDTO>> setter =
                ArgumentCaptor.forClass(ParameterizedPreparedStatementSetter.class);
        verify(jdbcTemplate).batchUpdate(anyString(), eq(events), eq(1000), setter.capture());

        PreparedStatement ps = mock(PreparedStatement.class);
        setter.getValue().setValues(ps, event);
        return ps;
    }

    @Test
    void nonFiniteScoreIsStoredAsNull() throws Exception {
        PreparedStatement ps = bind(event(Double.NaN));

        verify(ps).setNull(14, Types.DOUBLE);
        verify(ps, never()).setDouble(eq(14), anyDouble());
        verify(ps).setString(18, "INVALID_SENTIMENT");
    }

    @Test
    void infiniteScoreIsStoredAsNull() throws Exception {
        PreparedStatement ps = bind(event(Double.POSITIVE_INFINITY));

        verify(ps).setNull(14, Types.DOUBLE);
    }

    @Test
    void outOfRangeFiniteScoreIsKept() throws Exception {
        PreparedStatement ps = bind(event(1.5));

        verify(ps).setDouble(14, 1.5);
    }

    @Test
    void publishRunsStagedSwapInOrder() {
        publisher.publish(List.of(event(0.4)), MERGED_AT);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(5)).update(sql.capture());
        assertThat(sql.getAllValues()).satisfiesExactly(
                s -> assertThat(s).startsWith("DELETE FROM sentiment_events_staging"),
                s -> assertThat(s).startsWith("UPDATE sentiment_events_staging").contains("content_hash"),
                s -> assertThat(s).startsWith("DELETE FROM sentiment_events WHERE event_id IN"),
                s -> assertThat(s).startsWith("INSERT INTO sentiment_events (").contains("FROM sentiment_events_staging"),
                s -> assertThat(s).isEqualTo("DELETE FROM sentiment_events_staging"));
    }

    @Test
    void emptyBatchOnlyClearsStaging() {
        assertThat(publisher.publish(List.of(), MERGED_AT)).isZero();

        verify(jdbcTemplate).update("DELETE FROM sentiment_events_staging");
        verify(jdbcTemplate, never()).batchUpdate(anyString(), anyList(), anyInt(), any());
    }
}
