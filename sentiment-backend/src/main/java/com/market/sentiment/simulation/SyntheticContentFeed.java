package com.market.sentiment.simulation;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.feed.ContentFeed;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;

/**
 * 模拟数据源基类：在没有接入真实平台接口时生成合成记录，字段命名与真实来源一致。
 */
public abstract class SyntheticContentFeed implements ContentFeed {

    /** 品牌、母公司、品类 */
    protected static final List<String[]> BRANDS = List.of(
            new String[]{"Coca-Cola", "The Coca-Cola Company", "Beverages"},
            new String[]{"Sprite", "The Coca-Cola Company", "Beverages"},
            new String[]{"Pepsi", "PepsiCo Inc.", "Beverages"},
            new String[]{"Lay's", "PepsiCo Inc.", "Snacks"},
            new String[]{"Dove", "Unilever PLC", "Personal Care"},
            new String[]{"Tide", "The Procter & Gamble Company", "Household"},
            new String[]{"KitKat", "Nestlé S.A.", "Confectionery"});

    protected static final List<String> PHRASES = List.of(
            "launch a new flavor", "price went up again", "quality problem with the latest batch",
            "sustainable packaging with less plastic", "too much sugar for a healthy diet",
            "the super bowl commercial campaign", "better than the competition", "delicious taste",
            "nothing special today");

    protected final SentimentProperties.Simulation settings;
    protected final Clock clock;
    protected final Random random = new Random();

    protected SyntheticContentFeed(SentimentProperties properties, Clock clock) {
        this.settings = properties.getSimulation();
        this.clock = clock;
    }

    protected LocalDateTime randomPastTime() {
        return LocalDateTime.now(clock)
                .minusDays(1 + random.nextInt(Math.max(1, settings.getDaysBack())))
                .minusMinutes(random.nextInt(24 * 60))
                .withNano(0);
    }

    protected double randomScore() {
        return Math.round((random.nextDouble() * 2 - 1) * 1000) / 1000.0;
    }

    protected <T> T pick(List<T> items) {
        return items.get(random.nextInt(items.size()));
    }
}
