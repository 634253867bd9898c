package com.market.sentiment.service;

import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.repository.DailyBrandSentimentRepository;
import com.market.sentiment.repository.SentimentEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 品牌日度情感聚合：从重算起始日期起删除并重建 daily_brand_sentiment，只统计 VALID 事件。
 * 起始日期之前的行保持不变。
 */
@Service
public class DailySentimentAggregator {

    private static final Logger log = LoggerFactory.getLogger(DailySentimentAggregator.class);

    private final SentimentEventRepository eventRepository;
    private final DailyBrandSentimentRepository dailyRepository;
    private final JdbcTemplate jdbcTemplate;

    public DailySentimentAggregator(SentimentEventRepository eventRepository,
                                    DailyBrandSentimentRepository dailyRepository,
                                    JdbcTemplate jdbcTemplate) {
        this.eventRepository = eventRepository;
        this.dailyRepository = dailyRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @param windowStart 本次合并的候选窗口起点，重算从其所在日期的 00:00 开始
     * @return 重建的日度行
     */
    @Transactional
    public List<DailyBrandSentiment> recompute(LocalDateTime windowStart, LocalDateTime loadedAt) {
        LocalDate fromDate = windowStart.toLocalDate();
        int deleted = dailyRepository.deleteBySentimentDateFrom(fromDate);

        List<SentimentEvent> events = eventRepository
                .findByQualityFlagAndPublishedAtGreaterThanEqual(QualityFlag.VALID, fromDate.atStartOfDay());
        long withoutBrand = events.stream().filter(e -> e.getBrand() == null).count();
        if (withoutBrand > 0) {
            log.warn("{} 条 VALID 事件缺少品牌，不参与日度聚合", withoutBrand);
        }

        // (日期, 品牌) 分组，TreeMap 保证写入顺序稳定
        Map<LocalDate, Map<String, List<SentimentEvent>>> grouped = events.stream()
                .filter(e -> e.getBrand() != null)
                .collect(Collectors.groupingBy(e -> e.getPublishedAt().toLocalDate(), TreeMap::new,
                        Collectors.groupingBy(SentimentEvent::getBrand, TreeMap::new, Collectors.toList())));

        List<DailyBrandSentiment> rows = new ArrayList<>();
        grouped.forEach((date, byBrand) -> byBrand.forEach((brand, group) ->
                rows.add(aggregate(date, brand, group, loadedAt))));

        insertRows(rows);
        log.info("日度聚合重算完成：起始日期 {}，删除 {} 行，写入 {} 行", fromDate, deleted, rows.size());
        return rows;
    }

    /**
     * 单个 (日期, 品牌) 的统计量。正/负/中性计数之和恒等于 content_count。
     */
    DailyBrandSentiment aggregate(LocalDate date, String brand, List<SentimentEvent> group, LocalDateTime loadedAt) {
        List<Double> scores = group.stream()
                .map(SentimentEvent::getSentimentScore)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        long positive = group.stream().filter(e -> SentimentAlgorithm.POSITIVE.equals(e.getSentimentCategory())).count();
        long negative = group.stream().filter(e -> SentimentAlgorithm.NEGATIVE.equals(e.getSentimentCategory())).count();
        long total = group.size();
        long totalEngagement = group.stream()
                .mapToLong(e -> e.getEngagementCount() == null ? 0L : e.getEngagementCount())
                .sum();

        DailyBrandSentiment row = new DailyBrandSentiment();
        row.setSentimentDate(date);
        row.setBrand(brand);
        row.setContentCount(total);
        row.setSourceCount((int) group.stream().map(SentimentEvent::getSource).distinct().count());
        row.setAvgSentiment(SentimentAlgorithm.round(SentimentAlgorithm.mean(scores), 3));
        row.setMinSentiment(SentimentAlgorithm.round(scores.stream().min(Double::compare).orElse(null), 3));
        row.setMaxSentiment(SentimentAlgorithm.round(scores.stream().max(Double::compare).orElse(null), 3));
        row.setStddevSentiment(SentimentAlgorithm.round(SentimentAlgorithm.sampleStddev(scores), 3));
        row.setPositiveCount(positive);
        row.setNegativeCount(negative);
        row.setNeutralCount(total - positive - negative);
        row.setPositiveRatio(total == 0 ? null : SentimentAlgorithm.round((double) positive / total, 3));
        row.setTotalEngagement(totalEngagement);
        row.setAvgEngagement(total == 0 ? null : SentimentAlgorithm.round((double) totalEngagement / total, 2));
        // z 分数由异常检测阶段基于全部历史回填
        row.setZScoreSentiment(0.0);
        row.setAnomalyFlag(AnomalyFlag.NORMAL);
        row.setLoadedAt(loadedAt);
        return row;
    }

    private void insertRows(List<DailyBrandSentiment> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String insertSQL = """
            INSERT INTO daily_brand_sentiment (
                sentiment_date, brand, content_count, source_count, avg_sentiment, min_sentiment,
                max_sentiment, stddev_sentiment, positive_count, negative_count, neutral_count,
                positive_ratio, total_engagement, avg_engagement, z_score_sentiment, anomaly_flag, loaded_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.batchUpdate(insertSQL, rows, rows.size(),
                (ps, r) -> {
                    ps.setDate(1, Date.valueOf(r.getSentimentDate()));
                    ps.setString(2, r.getBrand());
                    ps.setLong(3, r.getContentCount());
                    ps.setInt(4, r.getSourceCount());
                    ps.setObject(5, r.getAvgSentiment(), Types.DOUBLE);
                    ps.setObject(6, r.getMinSentiment(), Types.DOUBLE);
                    ps.setObject(7, r.getMaxSentiment(), Types.DOUBLE);
                    ps.setObject(8, r.getStddevSentiment(), Types.DOUBLE);
                    ps.setLong(9, r.getPositiveCount());
                    ps.setLong(10, r.getNegativeCount());
                    ps.setLong(11, r.getNeutralCount());
                    ps.setObject(12, r.getPositiveRatio(), Types.DOUBLE);
                    ps.setLong(13, r.getTotalEngagement());
                    ps.setObject(14, r.getAvgEngagement(), Types.DOUBLE);
                    ps.setObject(15, r.getZScoreSentiment(), Types.DOUBLE);
                    ps.setString(16, r.getAnomalyFlag().name());
                    ps.setTimestamp(17, Timestamp.valueOf(r.getLoadedAt()));
                });
    }
}
