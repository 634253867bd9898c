package com.market.sentiment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.MappedSuperclass;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 统一事件的列定义。正式表 sentiment_events 与暂存表 sentiment_events_staging 共用同一套列，
 * 合并时先写暂存表再整体发布到正式表。
 */
@Data
@MappedSuperclass
public abstract class AbstractSentimentEvent {

    /**
     * event_id: md5(source_id | published_at | source)，三个字段缺一不可
     */
    @Id
    @Column(name = "event_id", length = 32)
    private String eventId;

    @Column(name = "source_id", nullable = false, length = 128)
    private String sourceId;

    /** source: social / news */
    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "source_key")
    private Integer sourceKey;

    @Column(name = "brand_key", length = 32)
    private String brandKey;

    @Column(name = "brand", length = 128)
    private String brand;

    @Column(name = "parent_company", length = 128)
    private String parentCompany;

    @Column(name = "category", length = 128)
    private String category;

    /** creator: 作者（社交）或出版方（新闻） */
    @Column(name = "creator", length = 128)
    private String creator;

    @Column(name = "headline", length = 1000)
    private String headline;

    @Lob
    @Column(name = "body_text")
    private String bodyText;

    /** channel: 社交来源的子版块，新闻为空 */
    @Column(name = "channel", length = 128)
    private String channel;

    @Column(name = "engagement_count", nullable = false)
    private Long engagementCount;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(name = "sentiment_category", length = 16)
    private String sentimentCategory;

    /** published_at: 事件时间，排序与水位线的唯一依据 */
    @Column(name = "published_at", nullable = false)
    private LocalDateTime publishedAt;

    /** ingested_at: 观测时间，只用于批内去重 */
    @Column(name = "ingested_at")
    private LocalDateTime ingestedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_flag", nullable = false, length = 24)
    private QualityFlag qualityFlag;

    @Column(name = "content_hash", length = 32)
    private String contentHash;

    @Column(name = "merged_at")
    private LocalDateTime mergedAt;
}
