package com.market.sentiment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * TrendingTopic Entity: (brand, topic) 维度的滚动窗口话题热度，每次运行全量重算。
 */
@Data
@NoArgsConstructor
@Entity
@IdClass(TrendingTopicId.class)
@Table(name = "trending_topics")
public class TrendingTopic {

    @Id
    @Column(name = "brand", length = 128)
    private String brand;

    @Id
    @Column(name = "topic", length = 64)
    private String topic;

    @Column(name = "parent_company", length = 128)
    private String parentCompany;

    @Column(name = "mention_count", nullable = false)
    private Long mentionCount;

    @Column(name = "social_mentions")
    private Long socialMentions;

    @Column(name = "news_mentions")
    private Long newsMentions;

    @Column(name = "mentions_last_7d")
    private Long mentionsLast7d;

    @Column(name = "mentions_last_14d")
    private Long mentionsLast14d;

    @Column(name = "trending_score")
    private Double trendingScore;

    @Column(name = "topic_rank_for_brand")
    private Integer topicRankForBrand;

    @Column(name = "topic_total_mentions")
    private Long topicTotalMentions;

    @Column(name = "avg_sentiment")
    private Double avgSentiment;

    @Column(name = "positive_mentions")
    private Long positiveMentions;

    @Column(name = "negative_mentions")
    private Long negativeMentions;

    @Column(name = "positive_pct")
    private Double positivePct;

    @Column(name = "avg_engagement")
    private Double avgEngagement;

    @Column(name = "max_engagement")
    private Long maxEngagement;

    @Column(name = "latest_mention")
    private LocalDateTime latestMention;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend_status", length = 16)
    private TrendStatus trendStatus;

    /** POSITIVE_BUZZ / NEGATIVE_BUZZ / NEUTRAL_DISCUSSION */
    @Column(name = "sentiment_tone", length = 24)
    private String sentimentTone;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
