package com.market.sentiment.simulation;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 新闻文章模拟源：article_id / publication / headline / url / published_at ...
 */
@Component
@ConditionalOnProperty(prefix = "sentiment.simulation", name = "enabled", havingValue = "true")
public class SyntheticNewsFeed extends SyntheticContentFeed {

    private static final Logger log = LoggerFactory.getLogger(SyntheticNewsFeed.class);

    private static final List<String> PUBLICATIONS = List.of("Forbes", "Reuters", "Bloomberg", "WSJ", "TechCrunch");

    public SyntheticNewsFeed(SentimentProperties properties, Clock clock) {
        super(properties, clock);
    }

    @Override
    public SourceKind sourceKind() {
        return SourceKind.NEWS;
    }

    @Override
    public List<Map<String, Object>> pull() {
        LocalDateTime ingestedAt = LocalDateTime.now(clock);
        List<Map<String, Object>> records = new ArrayList<>(settings.getNewsRecords());
        for (int i = 0; i < settings.getNewsRecords(); i++) {
            String[] brand = pick(BRANDS);
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("article_id", String.format("news_%05d", i));
            record.put("publication", pick(PUBLICATIONS));
            record.put("brand", brand[0]);
            record.put("parent_company", brand[1]);
            record.put("brand_category", brand[2]);
            record.put("headline", "News: " + brand[0] + " " + pick(PHRASES));
            record.put("body", "Article content about the CPG market #" + i);
            record.put("url", "https://example.com/article-" + i);
            record.put("published_at", randomPastTime().toString());
            record.put("sentiment_score", randomScore());
            record.put("ingested_at", ingestedAt.toString());
            records.add(record);
        }
        log.info("模拟新闻源生成 {} 篇文章", records.size());
        return records;
    }
}
