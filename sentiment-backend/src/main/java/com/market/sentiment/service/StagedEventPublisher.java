package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.entity.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 暂存表交换发布：清空暂存表 → 批量写入暂存表 → 沿用未变行的 merged_at → 删除正式表中同 event_id 的旧行 → 暂存表整体插入正式表 → 清空暂存表。
 * 必须在调用方的事务内执行，失败时整体回滚。
 */
@Component
public class StagedEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(StagedEventPublisher.class);

    static final String TARGET_TABLE = "sentiment_events";
    static final String STAGING_TABLE = "sentiment_events_staging";

    private static final String COLUMNS = "event_id, source_id, source, source_key, brand_key, brand, parent_company, "
            + "category, creator, headline, body_text, channel, engagement_count, sentiment_score, sentiment_category, "
            + "published_at, ingested_at, quality_flag, content_hash, merged_at";

    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;

    public StagedEventPublisher(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return 被替换（删除后重新插入）的正式表行数
     */
    public int publish(List<CanonicalEventDTO> events, LocalDateTime mergedAt) {
        jdbcTemplate.update("DELETE FROM " + STAGING_TABLE);
        if (events.isEmpty()) {
            return 0;
        }

        String insertSQL = "INSERT INTO " + STAGING_TABLE + " (" + COLUMNS + ") "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Timestamp mergedTs = Timestamp.valueOf(mergedAt);
        jdbcTemplate.batchUpdate(insertSQL, events, BATCH_SIZE,
                (ps, e) -> {
                    SourceKind source = e.getSource();
                    ps.setString(1, e.getEventId());
                    ps.setString(2, e.getSourceId());
                    ps.setString(3, source.code());
                    ps.setInt(4, source.getSourceKey());
                    ps.setString(5, e.getBrandKey());
                    ps.setString(6, e.getBrand());
                    ps.setString(7, e.getParentCompany());
                    ps.setString(8, e.getCategory());
                    ps.setString(9, e.getCreator());
                    ps.setString(10, e.getHeadline());
                    ps.setString(11, e.getBodyText());
                    ps.setString(12, e.getChannel());
                    ps.setLong(13, e.getEngagementCount());
                    Double score = e.getSentimentScore();
                    // NaN / Infinity 不能写入 MySQL，存为 NULL，质量标记仍为 INVALID_SENTIMENT
                    if (score == null || !Double.isFinite(score)) {
                        ps.setNull(14, Types.DOUBLE);
                    } else {
                        ps.setDouble(14, score);
                    }
                    ps.setString(15, e.getSentimentCategory());
                    ps.setTimestamp(16, Timestamp.valueOf(e.getPublishedAt()));
                    ps.setTimestamp(17, e.getIngestedAt() == null ? null : Timestamp.valueOf(e.getIngestedAt()));
                    ps.setString(18, e.getQualityFlag().name());
                    ps.setString(19, e.getContentHash());
                    ps.setTimestamp(20, mergedTs);
                });
        log.info("暂存表写入 {} 条事件", events.size());

        // 内容未变的重复投递保留原 merged_at，重跑同一窗口时正式表内容不变
        jdbcTemplate.update("UPDATE " + STAGING_TABLE + " s SET merged_at = "
                + "(SELECT t.merged_at FROM " + TARGET_TABLE + " t WHERE t.event_id = s.event_id) "
                + "WHERE EXISTS (SELECT 1 FROM " + TARGET_TABLE + " t "
                + "WHERE t.event_id = s.event_id AND t.content_hash = s.content_hash)");

        int replaced = jdbcTemplate.update("DELETE FROM " + TARGET_TABLE
                + " WHERE event_id IN (SELECT event_id FROM " + STAGING_TABLE + ")");
        int inserted = jdbcTemplate.update("INSERT INTO " + TARGET_TABLE + " (" + COLUMNS + ") "
                + "SELECT " + COLUMNS + " FROM " + STAGING_TABLE);
        jdbcTemplate.update("DELETE FROM " + STAGING_TABLE);

        log.info("正式表发布完成：写入 {} 条，其中替换 {} 条", inserted, replaced);
        return replaced;
    }
}
