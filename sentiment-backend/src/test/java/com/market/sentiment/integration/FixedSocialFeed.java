package com.market.sentiment.integration;

import com.market.sentiment.entity.SourceKind;
import com.market.sentiment.feed.ContentFeed;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 集成测试用的社交数据源：返回测试预先放入的记录，每次 pull 返回同一批数据。
 */
class FixedSocialFeed implements ContentFeed {

    private final List<Map<String, Object>> records = new ArrayList<>();

    void replace(List<Map<String, Object>> next) {
        records.clear();
        records.addAll(next);
    }

    @Override
    public SourceKind sourceKind() {
        return SourceKind.SOCIAL;
    }

    @Override
    public List<Map<String, Object>> pull() {
        return records.stream().map(HashMap::new).collect(Collectors.toList());
    }

    static Map<String, Object> post(String id, LocalDateTime createdAt, LocalDateTime ingestedAt,
                                    String title, Object score, int upvotes) {
        Map<String, Object> record = new HashMap<>();
        if (id != null) {
            record.put("post_id", id);
        }
        record.put("author", "user_" + upvotes);
        record.put("brand", "pepsi");
        record.put("parent_company", "PepsiCo Inc.");
        record.put("brand_category", "Beverages");
        record.put("title", title);
        record.put("body", "discussion thread");
        record.put("upvotes", upvotes);
        record.put("comments_count", 3);
        record.put("created_at", createdAt.toString());
        record.put("sentiment_score", score);
        record.put("subreddit", "r/soda");
        record.put("ingested_at", ingestedAt.toString());
        return record;
    }
}
