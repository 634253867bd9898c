package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.TrendStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 核心统计算法组件：情感分类、离散度、异常 z 分数、趋势分数、竞争定位。
 * 纯函数，不访问数据库，阈值全部来自 {@link SentimentProperties}。
 *
 * 【异常检测】z = (avg - mean) / stddev，mean/stddev 为品牌全部日度 avg_sentiment 的总体均值与总体标准差
 * 【趋势分数】score = (m7 × 2 / m14) × log10(total + 1) × (1 + avgEngagement / 100)
 */
@Component
public class SentimentAlgorithm {

    public static final String POSITIVE = "positive";
    public static final String NEGATIVE = "negative";
    public static final String NEUTRAL = "neutral";

    // 标准差小于该值视为 0，z 分数直接取 0
    private static final double STDDEV_EPSILON = 1e-12;

    // --- 趋势状态阈值 ---
    private static final double HOT_SCORE = 10.0;
    private static final double TRENDING_SCORE = 5.0;
    private static final long STABLE_MENTIONS = 10;

    // 话题基调阈值
    private static final double TONE_THRESHOLD = 0.3;

    // --- 竞争定位：百分位四分位 ---
    private static final double UPPER_QUARTILE = 0.75;
    private static final double LOWER_QUARTILE = 0.25;
    private static final double CATEGORY_BAND = 0.1;

    private static final RoundingMode MODE = RoundingMode.HALF_UP;

    private final SentimentProperties properties;

    public SentimentAlgorithm(SentimentProperties properties) {
        this.properties = properties;
    }

    /**
     * 1. 情感分类：score ≥ 正向阈值 → positive，score ≤ 负向阈值 → negative，其余 neutral。
     * 分数缺失时返回 null（此类事件由质量门标记为 INVALID_SENTIMENT）。
     */
    public String categorize(Double score) {
        if (score == null) {
            return null;
        }
        if (score >= properties.getSentimentThresholdPositive()) {
            return POSITIVE;
        } else if (score <= properties.getSentimentThresholdNegative()) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }

    public static Double round(Double value, int places) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, MODE).doubleValue();
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * 总体标准差（除以 n），用于异常检测。
     */
    public static double populationStddev(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * 样本标准差（除以 n-1），少于两个观测值时为 null。
     */
    public static Double sampleStddev(List<Double> values) {
        if (values.size() < 2) {
            return null;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    /**
     * 2. 异常 z 分数，保留 3 位小数。标准差为 0（或近似为 0）时 z = 0。
     */
    public double zScore(double value, double mean, double stddev) {
        if (stddev < STDDEV_EPSILON) {
            return 0.0;
        }
        return round((value - mean) / stddev, 3);
    }

    public AnomalyFlag anomalyFlag(double zScore) {
        return Math.abs(zScore) > properties.getAnomalyZThreshold() ? AnomalyFlag.ANOMALY : AnomalyFlag.NORMAL;
    }

    /**
     * 3. 趋势分数，保留 2 位小数。近 14 天无提及时为 0。
     *
     * @param mentions7d    近 7 天提及数
     * @param mentions14d   近 14 天提及数
     * @param totalMentions 回溯窗口内提及总数
     * @param avgEngagement 平均互动量（已取整）
     */
    public double trendingScore(long mentions7d, long mentions14d, long totalMentions, double avgEngagement) {
        if (mentions14d == 0) {
            return 0.0;
        }
        double velocity = mentions7d * 2.0 / mentions14d;
        double volume = Math.log10(totalMentions + 1.0);
        double engagementBoost = 1.0 + avgEngagement / 100.0;
        return round(velocity * volume * engagementBoost, 2);
    }

    /**
     * 4. 趋势状态映射：
     * HOT: score > 10 且 m7 > m14 / 2
     * TRENDING: score > 5
     * STABLE: total > 10
     * EMERGING: 其余
     */
    public TrendStatus trendStatus(double score, long mentions7d, long mentions14d, long totalMentions) {
        if (score > HOT_SCORE && mentions7d > mentions14d / 2.0) {
            return TrendStatus.HOT;
        } else if (score > TRENDING_SCORE) {
            return TrendStatus.TRENDING;
        } else if (totalMentions > STABLE_MENTIONS) {
            return TrendStatus.STABLE;
        }
        return TrendStatus.EMERGING;
    }

    public String sentimentTone(Double avgSentiment) {
        if (avgSentiment != null && avgSentiment > TONE_THRESHOLD) {
            return "POSITIVE_BUZZ";
        } else if (avgSentiment != null && avgSentiment < -TONE_THRESHOLD) {
            return "NEGATIVE_BUZZ";
        }
        return "NEUTRAL_DISCUSSION";
    }

    /**
     * 5. 百分位排名：(rank - 1) / (n - 1)，rank 为并列取最小名次的升序排名；只有一个品牌时为 0。
     */
    public static double percentRank(int rank, int n) {
        if (n <= 1) {
            return 0.0;
        }
        return (rank - 1) / (double) (n - 1);
    }

    /**
     * 6. 动量：(m7 × 4 - m30) × 100 / m30，近 30 天无提及时为 null。
     */
    public Double momentumPct(long mentions7d, long mentions30d) {
        if (mentions30d == 0) {
            return null;
        }
        return round((mentions7d * 4.0 - mentions30d) * 100.0 / mentions30d, 2);
    }

    public String competitivePosition(double sentimentPercentile, double volumePercentile) {
        if (sentimentPercentile >= UPPER_QUARTILE && volumePercentile >= UPPER_QUARTILE) {
            return "MARKET_LEADER";
        } else if (sentimentPercentile >= UPPER_QUARTILE && volumePercentile < LOWER_QUARTILE) {
            return "NICHE_FAVORITE";
        } else if (sentimentPercentile < LOWER_QUARTILE && volumePercentile >= UPPER_QUARTILE) {
            return "AT_RISK";
        } else if (sentimentPercentile < LOWER_QUARTILE && volumePercentile < LOWER_QUARTILE) {
            return "LOW_VISIBILITY";
        }
        return "MIDDLE_PACK";
    }

    public String sentimentVsCategory(Double avgSentiment, Double categoryAvgSentiment) {
        if (avgSentiment == null || categoryAvgSentiment == null) {
            return "AT_PAR";
        }
        if (avgSentiment > categoryAvgSentiment + CATEGORY_BAND) {
            return "OUTPERFORMING";
        } else if (avgSentiment < categoryAvgSentiment - CATEGORY_BAND) {
            return "UNDERPERFORMING";
        }
        return "AT_PAR";
    }
}
