package com.market.sentiment.service;

import com.market.sentiment.entity.BrandCompetitiveAnalysis;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.entity.SourceKind;
import com.market.sentiment.repository.BrandCompetitiveAnalysisRepository;
import com.market.sentiment.repository.SentimentEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 品牌竞争分析：基于全部 VALID 事件全量重算 brand_competitive_analysis。
 * 包括声量份额、百分位排名、品类内排名、净情感分、动量与竞争定位。
 */
@Service
public class BrandCompetitiveAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BrandCompetitiveAnalyzer.class);

    private final SentimentEventRepository eventRepository;
    private final BrandCompetitiveAnalysisRepository analysisRepository;
    private final SentimentAlgorithm sentimentAlgorithm;

    public BrandCompetitiveAnalyzer(SentimentEventRepository eventRepository,
                                    BrandCompetitiveAnalysisRepository analysisRepository,
                                    SentimentAlgorithm sentimentAlgorithm) {
        this.eventRepository = eventRepository;
        this.analysisRepository = analysisRepository;
        this.sentimentAlgorithm = sentimentAlgorithm;
    }

    @Transactional
    public List<BrandCompetitiveAnalysis> recompute(LocalDateTime now) {
        List<SentimentEvent> events = eventRepository.findByQualityFlag(QualityFlag.VALID);
        List<BrandCompetitiveAnalysis> rows = analyze(events, now.toLocalDate(), now);
        analysisRepository.deleteAllInBatch();
        analysisRepository.saveAll(rows);
        log.info("竞争分析重算完成：{} 个品牌", rows.size());
        return rows;
    }

    /**
     * 纯计算，便于单独测试。
     */
    List<BrandCompetitiveAnalysis> analyze(List<SentimentEvent> events, LocalDate today, LocalDateTime createdAt) {
        Map<String, List<SentimentEvent>> byBrand = events.stream()
                .filter(e -> e.getBrand() != null)
                .collect(Collectors.groupingBy(SentimentEvent::getBrand, TreeMap::new, Collectors.toList()));

        LocalDateTime last7 = today.minusDays(7).atStartOfDay();
        LocalDateTime last30 = today.minusDays(30).atStartOfDay();
        List<BrandCompetitiveAnalysis> rows = new ArrayList<>();
        byBrand.forEach((brand, group) -> rows.add(brandMetrics(brand, group, last7, last30, createdAt)));
        if (rows.isEmpty()) {
            return rows;
        }

        // 声量份额
        long allMentions = rows.stream().mapToLong(BrandCompetitiveAnalysis::getTotalMentions).sum();
        Map<String, List<BrandCompetitiveAnalysis>> byParent = rows.stream()
                .collect(Collectors.groupingBy(r -> Objects.toString(r.getParentCompany(), "")));
        Map<String, List<BrandCompetitiveAnalysis>> byCategory = rows.stream()
                .collect(Collectors.groupingBy(r -> Objects.toString(r.getCategory(), "")));
        for (BrandCompetitiveAnalysis row : rows) {
            row.setShareOfVoicePct(SentimentAlgorithm.round(row.getTotalMentions() * 100.0 / allMentions, 2));
        }
        for (List<BrandCompetitiveAnalysis> parentRows : byParent.values()) {
            long parentTotal = parentRows.stream().mapToLong(BrandCompetitiveAnalysis::getTotalMentions).sum();
            Double parentAvg = averageOf(parentRows, BrandCompetitiveAnalysis::getAvgSentiment);
            for (BrandCompetitiveAnalysis row : parentRows) {
                row.setShareWithinParent(SentimentAlgorithm.round(row.getTotalMentions() * 100.0 / parentTotal, 2));
                row.setParentTotalMentions(parentTotal);
                row.setParentAvgSentiment(SentimentAlgorithm.round(parentAvg, 3));
            }
        }

        // 全局百分位
        int n = rows.size();
        for (BrandCompetitiveAnalysis row : rows) {
            row.setSentimentPercentile(SentimentAlgorithm.percentRank(
                    ascendingRank(rows, row, BrandCompetitiveAnalysis::getAvgSentiment), n));
            row.setVolumePercentile(SentimentAlgorithm.percentRank(
                    ascendingRank(rows, row, r -> (double) r.getTotalMentions()), n));
            row.setEngagementPercentile(SentimentAlgorithm.percentRank(
                    ascendingRank(rows, row, BrandCompetitiveAnalysis::getAvgSocialEngagement), n));
        }

        // 品类内排名与基准
        for (List<BrandCompetitiveAnalysis> categoryRows : byCategory.values()) {
            Double categoryAvgSentiment = averageOf(categoryRows, BrandCompetitiveAnalysis::getAvgSentiment);
            Double categoryAvgMentions = averageOf(categoryRows, r -> (double) r.getTotalMentions());
            Double categoryAvgSov = averageOf(categoryRows, BrandCompetitiveAnalysis::getShareOfVoicePct);
            for (BrandCompetitiveAnalysis row : categoryRows) {
                row.setSentimentRankInCategory(descendingDenseRank(categoryRows, row, BrandCompetitiveAnalysis::getAvgSentiment));
                row.setVolumeRankInCategory(descendingDenseRank(categoryRows, row, r -> (double) r.getTotalMentions()));
                row.setCategoryAvgSentiment(SentimentAlgorithm.round(categoryAvgSentiment, 3));
                row.setCategoryAvgMentions(SentimentAlgorithm.round(categoryAvgMentions, 0));
                row.setCategoryAvgSov(SentimentAlgorithm.round(categoryAvgSov, 2));
                row.setSentimentVsCategory(sentimentAlgorithm.sentimentVsCategory(row.getAvgSentiment(), categoryAvgSentiment));
            }
        }

        for (BrandCompetitiveAnalysis row : rows) {
            row.setCompetitivePosition(sentimentAlgorithm.competitivePosition(
                    row.getSentimentPercentile(), row.getVolumePercentile()));
        }
        rows.sort(Comparator.comparing(BrandCompetitiveAnalysis::getShareOfVoicePct).reversed()
                .thenComparing(BrandCompetitiveAnalysis::getBrand));
        return rows;
    }

    private BrandCompetitiveAnalysis brandMetrics(String brand, List<SentimentEvent> group,
                                                  LocalDateTime last7, LocalDateTime last30, LocalDateTime createdAt) {
        long total = group.size();
        long positive = countCategory(group, SentimentAlgorithm.POSITIVE);
        long negative = countCategory(group, SentimentAlgorithm.NEGATIVE);
        long neutral = countCategory(group, SentimentAlgorithm.NEUTRAL);
        List<Double> scores = group.stream().map(SentimentEvent::getSentimentScore)
                .filter(Objects::nonNull).collect(Collectors.toList());
        List<Long> socialEngagement = group.stream()
                .filter(e -> SourceKind.SOCIAL.code().equals(e.getSource()))
                .map(e -> e.getEngagementCount() == null ? 0L : e.getEngagementCount())
                .collect(Collectors.toList());
        long socialMentions = socialEngagement.size();
        long m7 = group.stream().filter(e -> !e.getPublishedAt().isBefore(last7)).count();
        long m30 = group.stream().filter(e -> !e.getPublishedAt().isBefore(last30)).count();

        BrandCompetitiveAnalysis row = new BrandCompetitiveAnalysis();
        row.setBrand(brand);
        row.setParentCompany(maxOf(group, SentimentEvent::getParentCompany));
        row.setCategory(maxOf(group, SentimentEvent::getCategory));
        row.setTotalMentions(total);
        row.setSocialMentions(socialMentions);
        row.setNewsMentions(group.stream().filter(e -> SourceKind.NEWS.code().equals(e.getSource())).count());
        row.setMentionsLast7d(m7);
        row.setMentionsLast30d(m30);
        row.setAvgSentiment(scores.isEmpty() ? null : SentimentAlgorithm.round(SentimentAlgorithm.mean(scores), 3));
        row.setSentimentVolatility(SentimentAlgorithm.round(SentimentAlgorithm.sampleStddev(scores), 3));
        row.setPositiveMentions(positive);
        row.setNegativeMentions(negative);
        row.setNeutralMentions(neutral);
        row.setNetSentimentScore(SentimentAlgorithm.round(positive * 100.0 / total - negative * 100.0 / total, 2));

        Double avgSocial = socialEngagement.isEmpty() ? null
                : SentimentAlgorithm.round(socialEngagement.stream().mapToLong(Long::longValue).average().orElse(0.0), 0);
        row.setAvgSocialEngagement(avgSocial);
        row.setMaxSocialEngagement(socialEngagement.stream().max(Long::compare).orElse(null));
        row.setEngagementRate(avgSocial == null || socialMentions == 0 ? null
                : SentimentAlgorithm.round(avgSocial / socialMentions, 2));
        row.setMomentumPct(sentimentAlgorithm.momentumPct(m7, m30));
        row.setMostRecentMention(group.stream().map(SentimentEvent::getPublishedAt).max(LocalDateTime::compareTo).orElse(null));
        row.setFirstMention(group.stream().map(SentimentEvent::getPublishedAt).min(LocalDateTime::compareTo).orElse(null));
        row.setCreatedAt(createdAt);
        return row;
    }

    /**
     * 升序排名（并列取最小名次），空值排在最后。
     */
    static int ascendingRank(List<BrandCompetitiveAnalysis> rows, BrandCompetitiveAnalysis target,
                             Function<BrandCompetitiveAnalysis, Double> metric) {
        Double value = metric.apply(target);
        long nonNull = rows.stream().map(metric).filter(Objects::nonNull).count();
        if (value == null) {
            return (int) nonNull + 1;
        }
        long smaller = rows.stream().map(metric).filter(v -> v != null && v < value).count();
        return (int) smaller + 1;
    }

    /**
     * 降序稠密排名，空值排在最后。
     */
    static int descendingDenseRank(List<BrandCompetitiveAnalysis> rows, BrandCompetitiveAnalysis target,
                                   Function<BrandCompetitiveAnalysis, Double> metric) {
        TreeSet<Double> distinct = rows.stream().map(metric).filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> new TreeSet<Double>(Comparator.<Double>reverseOrder())));
        Double value = metric.apply(target);
        if (value == null) {
            return distinct.size() + 1;
        }
        return distinct.headSet(value).size() + 1;
    }

    private static Double averageOf(List<BrandCompetitiveAnalysis> rows, Function<BrandCompetitiveAnalysis, Double> metric) {
        List<Double> values = rows.stream().map(metric).filter(Objects::nonNull).collect(Collectors.toList());
        return values.isEmpty() ? null : SentimentAlgorithm.mean(values);
    }

    private static long countCategory(List<SentimentEvent> group, String category) {
        return group.stream().filter(e -> category.equals(e.getSentimentCategory())).count();
    }

    private static String maxOf(List<SentimentEvent> group, Function<SentimentEvent, String> field) {
        return group.stream().map(field).filter(Objects::nonNull).max(String::compareTo).orElse(null);
    }
}
