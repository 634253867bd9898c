package com.market.sentiment.service;

import com.market.sentiment.entity.BrandCompetitiveAnalysis;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.PipelineRun;
import com.market.sentiment.entity.TrendingTopic;

import java.util.List;

/**
 * 派生表只读查询的服务接口
 */
public interface SentimentQueryService {

    /**
     * 品牌日度情感，按日期升序。品牌名不区分大小写。
     */
    List<DailyBrandSentiment> getBrandDailySentiment(String brand);

    /**
     * 全部 ANOMALY 日度行，按日期降序。
     */
    List<DailyBrandSentiment> getAnomalies();

    List<BrandCompetitiveAnalysis> getCompetitiveAnalysis();

    /**
     * 趋势分数最高的 limit 个 (品牌, 话题)。
     */
    List<TrendingTopic> getTrendingTopics(int limit);

    List<PipelineRun> getRecentRuns();
}
