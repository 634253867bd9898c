package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.entity.SourceKind;
import com.market.sentiment.entity.TrendStatus;
import com.market.sentiment.entity.TrendingTopic;
import com.market.sentiment.repository.SentimentEventRepository;
import com.market.sentiment.repository.TrendingTopicRepository;
import com.market.sentiment.topic.TopicRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 趋势话题评分：回溯窗口内的 VALID 事件按话题规则展开，按 (品牌, 话题) 聚合并计算趋势分数。
 * 每次运行全量重算 trending_topics。
 */
@Service
public class TrendingTopicScorer {

    private static final Logger log = LoggerFactory.getLogger(TrendingTopicScorer.class);

    private final SentimentEventRepository eventRepository;
    private final TrendingTopicRepository trendingTopicRepository;
    private final List<TopicRule> topicRules;
    private final SentimentAlgorithm sentimentAlgorithm;
    private final SentimentProperties properties;

    public TrendingTopicScorer(SentimentEventRepository eventRepository,
                               TrendingTopicRepository trendingTopicRepository,
                               List<TopicRule> topicRules,
                               SentimentAlgorithm sentimentAlgorithm,
                               SentimentProperties properties) {
        this.eventRepository = eventRepository;
        this.trendingTopicRepository = trendingTopicRepository;
        this.topicRules = topicRules;
        this.sentimentAlgorithm = sentimentAlgorithm;
        this.properties = properties;
    }

    /**
     * @param now 处理时间，7 / 14 天窗口与回溯窗口都从当天 00:00 起算
     * @return 写入的话题行
     */
    @Transactional
    public List<TrendingTopic> recompute(LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        LocalDateTime lookbackStart = today.minusDays(properties.getTrendLookbackDays()).atStartOfDay();
        List<SentimentEvent> events = eventRepository
                .findByQualityFlagAndPublishedAtGreaterThanEqual(QualityFlag.VALID, lookbackStart);

        List<TrendingTopic> rows = score(events, today, now);
        trendingTopicRepository.deleteAllInBatch();
        trendingTopicRepository.saveAll(rows);
        log.info("趋势话题重算完成：回溯起点 {}，事件 {} 条，话题行 {} 条", lookbackStart, events.size(), rows.size());
        return rows;
    }

    /**
     * 纯计算：话题展开 → 聚合 → 评分 → 排名 → 过滤低提及行。
     */
    List<TrendingTopic> score(List<SentimentEvent> events, LocalDate today, LocalDateTime createdAt) {
        LocalDateTime last7 = today.minusDays(7).atStartOfDay();
        LocalDateTime last14 = today.minusDays(14).atStartOfDay();

        // (brand, topic) → 提及事件
        Map<List<String>, List<SentimentEvent>> mentions = new LinkedHashMap<>();
        for (SentimentEvent event : events) {
            if (event.getBrand() == null) {
                continue;
            }
            String text = fullText(event);
            for (TopicRule rule : topicRules) {
                if (rule.matches(text)) {
                    mentions.computeIfAbsent(List.of(event.getBrand(), rule.getTopic()), k -> new ArrayList<>()).add(event);
                }
            }
        }

        List<TrendingTopic> rows = new ArrayList<>();
        for (Map.Entry<List<String>, List<SentimentEvent>> entry : mentions.entrySet()) {
            rows.add(aggregate(entry.getKey().get(0), entry.getKey().get(1), entry.getValue(), last7, last14, createdAt));
        }

        // 排名与话题总量在过滤之前计算
        Map<String, Long> topicTotals = rows.stream()
                .collect(Collectors.groupingBy(TrendingTopic::getTopic, Collectors.summingLong(TrendingTopic::getMentionCount)));
        Map<String, List<TrendingTopic>> byBrand = rows.stream()
                .collect(Collectors.groupingBy(TrendingTopic::getBrand));
        for (List<TrendingTopic> brandRows : byBrand.values()) {
            List<Long> distinctCounts = new ArrayList<>(brandRows.stream()
                    .map(TrendingTopic::getMentionCount)
                    .collect(Collectors.toCollection(() -> new TreeSet<Long>(Comparator.<Long>reverseOrder()))));
            for (TrendingTopic row : brandRows) {
                row.setTopicRankForBrand(distinctCounts.indexOf(row.getMentionCount()) + 1);
            }
        }

        int minMentions = properties.getMinMentionsForTrend();
        return rows.stream()
                .peek(row -> row.setTopicTotalMentions(topicTotals.get(row.getTopic())))
                .filter(row -> row.getMentionCount() >= minMentions)
                .sorted(Comparator.comparing(TrendingTopic::getTrendingScore).reversed()
                        .thenComparing(TrendingTopic::getBrand)
                        .thenComparing(TrendingTopic::getTopic))
                .collect(Collectors.toList());
    }

    private TrendingTopic aggregate(String brand, String topic, List<SentimentEvent> group,
                                    LocalDateTime last7, LocalDateTime last14, LocalDateTime createdAt) {
        long total = group.size();
        long m7 = group.stream().filter(e -> !e.getPublishedAt().isBefore(last7)).count();
        long m14 = group.stream().filter(e -> !e.getPublishedAt().isBefore(last14)).count();
        long positive = group.stream().filter(e -> SentimentAlgorithm.POSITIVE.equals(e.getSentimentCategory())).count();
        long negative = group.stream().filter(e -> SentimentAlgorithm.NEGATIVE.equals(e.getSentimentCategory())).count();
        List<Double> scores = group.stream().map(SentimentEvent::getSentimentScore)
                .filter(Objects::nonNull).collect(Collectors.toList());
        List<Long> engagement = group.stream()
                .map(e -> e.getEngagementCount() == null ? 0L : e.getEngagementCount())
                .collect(Collectors.toList());
        double avgEngagement = Math.round(engagement.stream().mapToLong(Long::longValue).average().orElse(0.0));

        TrendingTopic row = new TrendingTopic();
        row.setBrand(brand);
        row.setTopic(topic);
        row.setParentCompany(group.stream().map(SentimentEvent::getParentCompany)
                .filter(Objects::nonNull).max(String::compareTo).orElse(null));
        row.setMentionCount(total);
        row.setSocialMentions(group.stream().filter(e -> SourceKind.SOCIAL.code().equals(e.getSource())).count());
        row.setNewsMentions(group.stream().filter(e -> SourceKind.NEWS.code().equals(e.getSource())).count());
        row.setMentionsLast7d(m7);
        row.setMentionsLast14d(m14);
        row.setAvgSentiment(scores.isEmpty() ? null : SentimentAlgorithm.round(SentimentAlgorithm.mean(scores), 3));
        row.setPositiveMentions(positive);
        row.setNegativeMentions(negative);
        row.setPositivePct(SentimentAlgorithm.round(positive * 100.0 / total, 1));
        row.setAvgEngagement(avgEngagement);
        row.setMaxEngagement(engagement.stream().max(Long::compare).orElse(0L));
        row.setLatestMention(group.stream().map(SentimentEvent::getPublishedAt).max(LocalDateTime::compareTo).orElse(null));

        double score = sentimentAlgorithm.trendingScore(m7, m14, total, avgEngagement);
        TrendStatus status = sentimentAlgorithm.trendStatus(score, m7, m14, total);
        row.setTrendingScore(score);
        row.setTrendStatus(status);
        row.setSentimentTone(sentimentAlgorithm.sentimentTone(row.getAvgSentiment()));
        row.setCreatedAt(createdAt);
        return row;
    }

    private static String fullText(SentimentEvent event) {
        String headline = event.getHeadline() == null ? "" : event.getHeadline();
        String body = event.getBodyText() == null ? "" : event.getBodyText();
        return (headline + " " + body).toLowerCase(Locale.ROOT);
    }
}
