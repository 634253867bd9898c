package com.market.sentiment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * BrandCompetitiveAnalysis Entity: 品牌竞争力对标表，每个品牌一行，全量重算。
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "brand_competitive_analysis")
public class BrandCompetitiveAnalysis {

    @Id
    @Column(name = "brand", length = 128)
    private String brand;

    @Column(name = "parent_company", length = 128)
    private String parentCompany;

    @Column(name = "category", length = 128)
    private String category;

    // --- 声量 ---
    @Column(name = "total_mentions", nullable = false)
    private Long totalMentions;

    @Column(name = "social_mentions")
    private Long socialMentions;

    @Column(name = "news_mentions")
    private Long newsMentions;

    @Column(name = "mentions_last_7d")
    private Long mentionsLast7d;

    @Column(name = "mentions_last_30d")
    private Long mentionsLast30d;

    @Column(name = "share_of_voice_pct")
    private Double shareOfVoicePct;

    @Column(name = "share_within_parent")
    private Double shareWithinParent;

    // --- 情感 ---
    @Column(name = "avg_sentiment")
    private Double avgSentiment;

    @Column(name = "sentiment_volatility")
    private Double sentimentVolatility;

    @Column(name = "net_sentiment_score")
    private Double netSentimentScore;

    @Column(name = "positive_mentions")
    private Long positiveMentions;

    @Column(name = "negative_mentions")
    private Long negativeMentions;

    @Column(name = "neutral_mentions")
    private Long neutralMentions;

    // --- 互动（仅社交来源） ---
    @Column(name = "avg_social_engagement")
    private Double avgSocialEngagement;

    @Column(name = "max_social_engagement")
    private Long maxSocialEngagement;

    @Column(name = "engagement_rate")
    private Double engagementRate;

    // --- 竞争定位 ---
    @Column(name = "sentiment_rank_in_category")
    private Integer sentimentRankInCategory;

    @Column(name = "volume_rank_in_category")
    private Integer volumeRankInCategory;

    @Column(name = "sentiment_percentile")
    private Double sentimentPercentile;

    @Column(name = "volume_percentile")
    private Double volumePercentile;

    @Column(name = "engagement_percentile")
    private Double engagementPercentile;

    /** MARKET_LEADER / NICHE_FAVORITE / AT_RISK / LOW_VISIBILITY / MIDDLE_PACK */
    @Column(name = "competitive_position", length = 24)
    private String competitivePosition;

    /** OUTPERFORMING / UNDERPERFORMING / AT_PAR */
    @Column(name = "sentiment_vs_category", length = 24)
    private String sentimentVsCategory;

    @Column(name = "momentum_pct")
    private Double momentumPct;

    // --- 基准 ---
    @Column(name = "category_avg_sentiment")
    private Double categoryAvgSentiment;

    @Column(name = "category_avg_mentions")
    private Double categoryAvgMentions;

    @Column(name = "category_avg_sov")
    private Double categoryAvgSov;

    @Column(name = "parent_avg_sentiment")
    private Double parentAvgSentiment;

    @Column(name = "parent_total_mentions")
    private Long parentTotalMentions;

    @Column(name = "most_recent_mention")
    private LocalDateTime mostRecentMention;

    @Column(name = "first_mention")
    private LocalDateTime firstMention;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
