package com.market.sentiment.config;

import com.market.sentiment.topic.KeywordTopicRule;
import com.market.sentiment.topic.TopicRule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * 默认话题目录。新增话题只需再声明一个 TopicRule Bean。
 */
@Configuration
public class TopicRuleConfig {

    @Bean
    @Order(1)
    public TopicRule productLaunchTopic() {
        return new KeywordTopicRule("Product Launch", "new", "launch", "debut");
    }

    @Bean
    @Order(2)
    public TopicRule pricingTopic() {
        return new KeywordTopicRule("Pricing", "price", "expensive", "cheap", "value");
    }

    @Bean
    @Order(3)
    public TopicRule qualityIssuesTopic() {
        return new KeywordTopicRule("Quality Issues", "recall", "defect", "quality", "problem");
    }

    @Bean
    @Order(4)
    public TopicRule sustainabilityTopic() {
        return new KeywordTopicRule("Sustainability", "sustain", "green", "eco", "environment", "plastic");
    }

    @Bean
    @Order(5)
    public TopicRule healthNutritionTopic() {
        return new KeywordTopicRule("Health & Nutrition", "health", "sugar", "calor", "diet", "nutrition");
    }

    @Bean
    @Order(6)
    public TopicRule marketingTopic() {
        return new KeywordTopicRule("Marketing & Advertising", "ad", "commercial", "campaign", "super bowl");
    }

    @Bean
    @Order(7)
    public TopicRule brandComparisonTopic() {
        return new KeywordTopicRule("Brand Comparison", "vs", "versus", "better than", "compared to");
    }

    @Bean
    @Order(8)
    public TopicRule tasteFlavorTopic() {
        return new KeywordTopicRule("Taste & Flavor", "taste", "flavor", "delicious", "yum");
    }
}
