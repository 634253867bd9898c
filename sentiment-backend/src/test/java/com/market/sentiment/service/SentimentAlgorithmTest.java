package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.TrendStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SentimentAlgorithmTest {

    private SentimentAlgorithm sentimentAlgorithm;

    @BeforeEach
    void setUp() {
        sentimentAlgorithm = new SentimentAlgorithm(new SentimentProperties());
    }

    // 分类边界：阈值本身归入正/负类
    @Test
    void testCategorize_Thresholds() {
        assertEquals("positive", sentimentAlgorithm.categorize(0.3));
        assertEquals("positive", sentimentAlgorithm.categorize(1.0));
        assertEquals("negative", sentimentAlgorithm.categorize(-0.3));
        assertEquals("neutral", sentimentAlgorithm.categorize(0.29));
        assertEquals("neutral", sentimentAlgorithm.categorize(-0.29));
        assertNull(sentimentAlgorithm.categorize(null));
    }

    @Test
    void testCategorize_CustomThresholds() {
        SentimentProperties properties = new SentimentProperties();
        properties.setSentimentThresholdPositive(0.5);
        properties.setSentimentThresholdNegative(-0.5);
        SentimentAlgorithm strict = new SentimentAlgorithm(properties);

        assertEquals("neutral", strict.categorize(0.4));
        assertEquals("positive", strict.categorize(0.5));
    }

    @Test
    void testStddev() {
        assertNull(SentimentAlgorithm.sampleStddev(List.of(0.5)));
        assertEquals(0.0, SentimentAlgorithm.populationStddev(List.of(0.2, 0.2, 0.2)), 1e-12);
        // 样本标准差 [1, 3] = sqrt(2)
        assertEquals(Math.sqrt(2), SentimentAlgorithm.sampleStddev(List.of(1.0, 3.0)), 1e-12);
        assertEquals(1.0, SentimentAlgorithm.populationStddev(List.of(1.0, 3.0)), 1e-12);
    }

    @Test
    void testZScore_ZeroStddev() {
        assertEquals(0.0, sentimentAlgorithm.zScore(0.4, 0.4, 0.0));
        assertEquals(0.0, sentimentAlgorithm.zScore(0.4, 0.1, 1e-13));
        assertEquals(AnomalyFlag.NORMAL, sentimentAlgorithm.anomalyFlag(0.0));
    }

    @Test
    void testAnomalyFlag_StrictlyGreaterThanThreshold() {
        assertEquals(AnomalyFlag.NORMAL, sentimentAlgorithm.anomalyFlag(2.0));
        assertEquals(AnomalyFlag.ANOMALY, sentimentAlgorithm.anomalyFlag(2.001));
        assertEquals(AnomalyFlag.ANOMALY, sentimentAlgorithm.anomalyFlag(-2.5));
    }

    // 近 14 天无提及：分数为 0，不出现除零
    @Test
    void testTrendingScore_NoRecentMentions() {
        assertEquals(0.0, sentimentAlgorithm.trendingScore(0, 0, 25, 300));
    }

    @Test
    void testTrendingScore() {
        // (4 * 2 / 8) * log10(10) * (1 + 0) = 1
        assertEquals(1.0, sentimentAlgorithm.trendingScore(4, 8, 9, 0));
        // (10 * 2 / 10) * log10(100) * (1 + 100 / 100) = 8
        assertEquals(8.0, sentimentAlgorithm.trendingScore(10, 10, 99, 100));
        // 2 * log10(4) * 2 = 2.408...
        assertEquals(2.41, sentimentAlgorithm.trendingScore(3, 3, 3, 100));
    }

    @Test
    void testTrendStatus() {
        assertEquals(TrendStatus.HOT, sentimentAlgorithm.trendStatus(12, 6, 10, 20));
        // m7 未超过 m14 的一半
        assertEquals(TrendStatus.TRENDING, sentimentAlgorithm.trendStatus(12, 5, 10, 20));
        assertEquals(TrendStatus.TRENDING, sentimentAlgorithm.trendStatus(5.5, 1, 10, 3));
        assertEquals(TrendStatus.STABLE, sentimentAlgorithm.trendStatus(3, 1, 2, 11));
        assertEquals(TrendStatus.EMERGING, sentimentAlgorithm.trendStatus(3, 1, 2, 10));
    }

    @Test
    void testSentimentTone() {
        assertEquals("POSITIVE_BUZZ", sentimentAlgorithm.sentimentTone(0.31));
        assertEquals("NEGATIVE_BUZZ", sentimentAlgorithm.sentimentTone(-0.31));
        assertEquals("NEUTRAL_DISCUSSION", sentimentAlgorithm.sentimentTone(0.3));
        assertEquals("NEUTRAL_DISCUSSION", sentimentAlgorithm.sentimentTone(null));
    }

    @Test
    void testPercentRankAndMomentum() {
        assertEquals(0.0, SentimentAlgorithm.percentRank(1, 1));
        assertEquals(0.5, SentimentAlgorithm.percentRank(3, 5));
        assertEquals(1.0, SentimentAlgorithm.percentRank(5, 5));

        assertEquals(100.0, sentimentAlgorithm.momentumPct(5, 10));
        assertEquals(-100.0, sentimentAlgorithm.momentumPct(0, 10));
        assertNull(sentimentAlgorithm.momentumPct(3, 0));
    }

    @Test
    void testCompetitivePosition() {
        assertEquals("MARKET_LEADER", sentimentAlgorithm.competitivePosition(0.8, 0.9));
        assertEquals("NICHE_FAVORITE", sentimentAlgorithm.competitivePosition(0.75, 0.1));
        assertEquals("AT_RISK", sentimentAlgorithm.competitivePosition(0.1, 0.8));
        assertEquals("LOW_VISIBILITY", sentimentAlgorithm.competitivePosition(0.0, 0.0));
        assertEquals("MIDDLE_PACK", sentimentAlgorithm.competitivePosition(0.5, 0.5));
    }

    @Test
    void testSentimentVsCategory() {
        assertEquals("OUTPERFORMING", sentimentAlgorithm.sentimentVsCategory(0.5, 0.3));
        assertEquals("UNDERPERFORMING", sentimentAlgorithm.sentimentVsCategory(0.1, 0.3));
        assertEquals("AT_PAR", sentimentAlgorithm.sentimentVsCategory(0.35, 0.3));
    }
}
