package com.market.sentiment.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 情感流水线配置，绑定 application.yml 中 sentiment.* 前缀。
 * 所有阈值均为配置项，算法中不硬编码。
 */
@Data
@ConfigurationProperties(prefix = "sentiment")
public class SentimentProperties {

    /** 水位线回溯的安全重叠窗口，用于接住迟到/重复投递的事件 */
    private Duration overlapWindow = Duration.ofDays(1);

    private double sentimentThresholdPositive = 0.3;
    private double sentimentThresholdNegative = -0.3;

    /** |z| 超过该值判定为 ANOMALY */
    private double anomalyZThreshold = 2.0;

    private int trendLookbackDays = 30;
    private int minMentionsForTrend = 3;

    /** 批内去重时保留哪一个版本 */
    private DedupOrder dedupOrder = DedupOrder.LATEST_INGESTED;

    // dim_brands.company_type 判定为 PUBLIC 的母公司列表
    private List<String> publicCompanies = new ArrayList<>(List.of(
            "The Coca-Cola Company", "PepsiCo Inc.", "Unilever PLC",
            "The Procter & Gamble Company", "Nestlé S.A."));

    private Schedule schedule = new Schedule();
    private Simulation simulation = new Simulation();

    public enum DedupOrder {
        LATEST_INGESTED,
        EARLIEST_INGESTED
    }

    @Data
    public static class Schedule {
        /** Spring cron 表达式，"-" 表示关闭定时触发 */
        private String cron = "-";
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private int socialRecords = 500;
        private int newsRecords = 300;
        private int daysBack = 90;
    }
}
