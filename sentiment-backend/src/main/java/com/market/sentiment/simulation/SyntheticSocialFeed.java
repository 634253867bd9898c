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
 * 社交帖子模拟源：post_id / author / title / body / upvotes / created_at ...
 */
@Component
@ConditionalOnProperty(prefix = "sentiment.simulation", name = "enabled", havingValue = "true")
public class SyntheticSocialFeed extends SyntheticContentFeed {

    private static final Logger log = LoggerFactory.getLogger(SyntheticSocialFeed.class);

    public SyntheticSocialFeed(SentimentProperties properties, Clock clock) {
        super(properties, clock);
    }

    @Override
    public SourceKind sourceKind() {
        return SourceKind.SOCIAL;
    }

    @Override
    public List<Map<String, Object>> pull() {
        LocalDateTime ingestedAt = LocalDateTime.now(clock);
        List<Map<String, Object>> records = new ArrayList<>(settings.getSocialRecords());
        for (int i = 0; i < settings.getSocialRecords(); i++) {
            String[] brand = pick(BRANDS);
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("post_id", String.format("reddit_%05d", i));
            record.put("author", "user_" + (1000 + random.nextInt(9000)));
            record.put("brand", brand[0]);
            record.put("parent_company", brand[1]);
            record.put("brand_category", brand[2]);
            record.put("title", brand[0] + ": " + pick(PHRASES));
            record.put("body", "Discussion about " + brand[0] + " #" + i);
            record.put("upvotes", 1 + random.nextInt(5000));
            record.put("comments_count", random.nextInt(500));
            record.put("created_at", randomPastTime().toString());
            record.put("sentiment_score", randomScore());
            record.put("subreddit", "r/" + brand[2].replace(" ", "").toLowerCase());
            record.put("ingested_at", ingestedAt.toString());
            records.add(record);
        }
        log.info("模拟社交源生成 {} 条帖子", records.size());
        return records;
    }
}
