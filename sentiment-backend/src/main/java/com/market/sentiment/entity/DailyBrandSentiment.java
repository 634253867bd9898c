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

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DailyBrandSentiment Entity: 品牌日度情感聚合，主键 (sentiment_date, brand)。
 * 只统计 VALID 事件；重算时整行替换，不在旧值上累加。
 */
@Data
@NoArgsConstructor
@Entity
@IdClass(DailyBrandSentimentId.class)
@Table(name = "daily_brand_sentiment")
public class DailyBrandSentiment {

    @Id
    @Column(name = "sentiment_date")
    private LocalDate sentimentDate;

    @Id
    @Column(name = "brand", length = 128)
    private String brand;

    // --- 量 ---
    @Column(name = "content_count", nullable = false)
    private Long contentCount;

    @Column(name = "source_count", nullable = false)
    private Integer sourceCount;

    // --- 情感分布 ---
    @Column(name = "avg_sentiment")
    private Double avgSentiment;

    @Column(name = "min_sentiment")
    private Double minSentiment;

    @Column(name = "max_sentiment")
    private Double maxSentiment;

    /** 样本标准差，单条事件时为空 */
    @Column(name = "stddev_sentiment")
    private Double stddevSentiment;

    @Column(name = "positive_count", nullable = false)
    private Long positiveCount;

    @Column(name = "negative_count", nullable = false)
    private Long negativeCount;

    @Column(name = "neutral_count", nullable = false)
    private Long neutralCount;

    @Column(name = "positive_ratio")
    private Double positiveRatio;

    // --- 互动 ---
    @Column(name = "total_engagement")
    private Long totalEngagement;

    @Column(name = "avg_engagement")
    private Double avgEngagement;

    // --- 异常检测（基于该品牌全部历史日度数据） ---
    @Column(name = "z_score_sentiment")
    private Double zScoreSentiment;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_flag", length = 16)
    private AnomalyFlag anomalyFlag;

    @Column(name = "loaded_at")
    private LocalDateTime loadedAt;
}
