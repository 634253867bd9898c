package com.market.sentiment.service;

import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.repository.DailyBrandSentimentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 情感异常检测：对本次重算涉及的品牌，基于其全部历史日度 avg_sentiment 重新计算 z 分数与异常标记。
 * 每次都是全量历史重算，不维护滚动统计量。
 */
@Service
public class SentimentAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(SentimentAnomalyDetector.class);

    private final DailyBrandSentimentRepository dailyRepository;
    private final SentimentAlgorithm sentimentAlgorithm;

    public SentimentAnomalyDetector(DailyBrandSentimentRepository dailyRepository,
                                    SentimentAlgorithm sentimentAlgorithm) {
        this.dailyRepository = dailyRepository;
        this.sentimentAlgorithm = sentimentAlgorithm;
    }

    /**
     * @return 标记为 ANOMALY 的日度行数
     */
    @Transactional
    public int detect(Collection<String> brands) {
        if (brands.isEmpty()) {
            log.info("没有需要重新检测的品牌，跳过异常检测。");
            return 0;
        }

        Map<String, List<DailyBrandSentiment>> history = dailyRepository.findByBrandInOrderBySentimentDateAsc(brands)
                .stream()
                .collect(Collectors.groupingBy(DailyBrandSentiment::getBrand));

        List<DailyBrandSentiment> updated = new ArrayList<>();
        int anomalies = 0;
        for (List<DailyBrandSentiment> rows : history.values()) {
            anomalies += score(rows);
            updated.addAll(rows);
        }

        dailyRepository.saveAll(updated);
        log.info("异常检测完成：{} 个品牌，{} 个日度行，其中 ANOMALY {} 行", history.size(), updated.size(), anomalies);
        return anomalies;
    }

    /**
     * 在内存中为单个品牌的全部历史行写入 z 分数与标记。
     *
     * @return 该品牌的 ANOMALY 行数
     */
    int score(List<DailyBrandSentiment> rows) {
        List<Double> values = rows.stream()
                .map(DailyBrandSentiment::getAvgSentiment)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        double mean = SentimentAlgorithm.mean(values);
        double stddev = SentimentAlgorithm.populationStddev(values);

        int anomalies = 0;
        for (DailyBrandSentiment row : rows) {
            double z = row.getAvgSentiment() == null ? 0.0 : sentimentAlgorithm.zScore(row.getAvgSentiment(), mean, stddev);
            AnomalyFlag flag = sentimentAlgorithm.anomalyFlag(z);
            row.setZScoreSentiment(z);
            row.setAnomalyFlag(flag);
            if (flag == AnomalyFlag.ANOMALY) {
                anomalies++;
            }
        }
        return anomalies;
    }
}
