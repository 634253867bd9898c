package com.market.sentiment.config;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.service.EventVersionComparator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Comparator;

/**
 * 流水线通用 Bean：处理时钟与去重排序规则。
 */
@Configuration
public class PipelineConfig {

    /**
     * 处理时间统一从该时钟获取（FUTURE_DATE 判定、趋势窗口、运行记录），测试中可替换为固定时钟。
     */
    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Comparator<CanonicalEventDTO> eventVersionComparator(SentimentProperties properties) {
        return EventVersionComparator.forOrder(properties.getDedupOrder());
    }
}
