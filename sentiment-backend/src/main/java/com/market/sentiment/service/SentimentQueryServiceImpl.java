package com.market.sentiment.service;

import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.BrandCompetitiveAnalysis;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.PipelineRun;
import com.market.sentiment.entity.TrendingTopic;
import com.market.sentiment.repository.BrandCompetitiveAnalysisRepository;
import com.market.sentiment.repository.DailyBrandSentimentRepository;
import com.market.sentiment.repository.PipelineRunRepository;
import com.market.sentiment.repository.TrendingTopicRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Service
@Transactional(readOnly = true)
public class SentimentQueryServiceImpl implements SentimentQueryService {

    private static final int MAX_TREND_LIMIT = 500;

    private final DailyBrandSentimentRepository dailyRepository;
    private final TrendingTopicRepository trendingTopicRepository;
    private final BrandCompetitiveAnalysisRepository competitiveRepository;
    private final PipelineRunRepository runRepository;

    public SentimentQueryServiceImpl(DailyBrandSentimentRepository dailyRepository,
                                     TrendingTopicRepository trendingTopicRepository,
                                     BrandCompetitiveAnalysisRepository competitiveRepository,
                                     PipelineRunRepository runRepository) {
        this.dailyRepository = dailyRepository;
        this.trendingTopicRepository = trendingTopicRepository;
        this.competitiveRepository = competitiveRepository;
        this.runRepository = runRepository;
    }

    @Override
    public List<DailyBrandSentiment> getBrandDailySentiment(String brand) {
        if (brand == null || brand.isBlank()) {
            throw new IllegalArgumentException("品牌名不能为空");
        }
        // 品牌在规范化阶段统一为大写
        return dailyRepository.findByBrandOrderBySentimentDateAsc(brand.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public List<DailyBrandSentiment> getAnomalies() {
        return dailyRepository.findByAnomalyFlagOrderBySentimentDateDesc(AnomalyFlag.ANOMALY);
    }

    @Override
    public List<BrandCompetitiveAnalysis> getCompetitiveAnalysis() {
        return competitiveRepository.findAllByOrderByShareOfVoicePctDesc();
    }

    @Override
    public List<TrendingTopic> getTrendingTopics(int limit) {
        if (limit <= 0 || limit > MAX_TREND_LIMIT) {
            throw new IllegalArgumentException("limit 必须在 1 到 " + MAX_TREND_LIMIT + " 之间");
        }
        return trendingTopicRepository.findAllByOrderByTrendingScoreDesc(PageRequest.of(0, limit));
    }

    @Override
    public List<PipelineRun> getRecentRuns() {
        return runRepository.findTop20ByOrderByStartedAtDesc();
    }
}
