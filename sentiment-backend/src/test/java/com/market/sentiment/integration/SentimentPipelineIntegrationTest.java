package com.market.sentiment.integration;

import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.PipelineRun;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.repository.BrandCompetitiveAnalysisRepository;
import com.market.sentiment.repository.BrandDimensionRepository;
import com.market.sentiment.repository.DailyBrandSentimentRepository;
import com.market.sentiment.repository.PipelineRunRepository;
import com.market.sentiment.repository.SentimentEventRepository;
import com.market.sentiment.repository.TrendingTopicRepository;
import com.market.sentiment.service.SentimentPipelineService;
import com.market.sentiment.util.PipelineRunStatusManager;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.market.sentiment.integration.FixedSocialFeed.post;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 【集成测试】情感流水线端到端测试
 *
 * 测试范围：
 * - 规范化、质量门、增量合并、派生表重算的完整运行
 * - 同一批数据重复运行的幂等性
 * - 查询接口与运行期间的 423 拦截
 *
 * 测试环境：H2 内存库（MySQL 模式），模拟数据源关闭，由测试内的数据源提供固定记录。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("情感流水线集成测试")
class SentimentPipelineIntegrationTest {

    @TestConfiguration
    static class FixedFeedConfig {
        @Bean
        FixedSocialFeed fixedSocialFeed() {
            return new FixedSocialFeed();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SentimentPipelineService pipelineService;

    @Autowired
    private PipelineRunStatusManager statusManager;

    @Autowired
    private FixedSocialFeed feed;

    @Autowired
    private Clock clock;

    @Autowired
    private SentimentEventRepository eventRepository;

    @Autowired
    private DailyBrandSentimentRepository dailyRepository;

    @Autowired
    private TrendingTopicRepository trendingRepository;

    @Autowired
    private BrandCompetitiveAnalysisRepository competitiveRepository;

    @Autowired
    private BrandDimensionRepository brandDimensionRepository;

    @Autowired
    private PipelineRunRepository runRepository;

    @BeforeEach
    void setUp() {
        log.info("【集成测试】清理历史数据");
        trendingRepository.deleteAllInBatch();
        competitiveRepository.deleteAllInBatch();
        dailyRepository.deleteAllInBatch();
        brandDimensionRepository.deleteAllInBatch();
        eventRepository.deleteAllInBatch();
        runRepository.deleteAllInBatch();

        feed.replace(sampleRecords(LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)));
    }

    private static List<Map<String, Object>> sampleRecords(LocalDateTime now) {
        LocalDateTime ingested = now.minusMinutes(30);
        List<Map<String, Object>> records = new ArrayList<>();
        records.add(post("p1", now.minusHours(2), ingested, "Pepsi new launch looks great", 0.6, 120));
        records.add(post("p2", now.minusHours(3), ingested, "Pepsi price is too high", -0.4, 40));
        records.add(post("p3", now.minusHours(4), ingested, "Pepsi taste is fine", 0.05, 10));
        // 同一帖子的第二次投递，内容已更新
        records.add(post("p1", now.minusHours(2), ingested.plusMinutes(10), "Pepsi new launch looks amazing", 0.7, 150));
        records.add(post("p4", now.minusHours(5), ingested, "Pepsi score out of range", 1.5, 5));
        // 缺少 post_id
        records.add(post(null, now.minusHours(6), ingested, "Pepsi orphan post", 0.2, 1));
        return records;
    }

    // 事件行的完整内容，包括 merged_at
    private static List<String> eventSignature(List<SentimentEvent> rows) {
        return rows.stream()
                .map(e -> e.getEventId() + "|" + e.getContentHash() + "|" + e.getSentimentScore() + "|"
                        + e.getQualityFlag() + "|" + e.getIngestedAt() + "|" + e.getMergedAt())
                .sorted()
                .collect(Collectors.toList());
    }

    // loaded_at 是每次重算的处理时间，不参与比较
    private static List<String> dailySignature(List<DailyBrandSentiment> rows) {
        return rows.stream()
                .map(r -> r.getSentimentDate() + "|" + r.getBrand() + "|" + r.getContentCount() + "|"
                        + r.getAvgSentiment() + "|" + r.getPositiveCount() + "|" + r.getNegativeCount())
                .sorted()
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("T1: 完整运行与重复运行幂等")
    void repeatedRunIsIdempotent() {
        PipelineRun first = pipelineService.runPipeline();
        log.info("第一次运行: {}", first);

        assertThat(first.getStatus()).isEqualTo("SUCCEEDED");
        assertThat(first.getRawRecords()).isEqualTo(6);
        assertThat(first.getSchemaErrors()).isEqualTo(1);
        assertThat(first.getInvalidSentimentCount()).isEqualTo(1);
        assertThat(first.getDuplicatesDropped()).isEqualTo(1);
        assertThat(first.getInserted()).isEqualTo(4);
        assertThat(eventRepository.count()).isEqualTo(4);
        assertThat(eventRepository.countDuplicateIdentityTriples()).isZero();

        List<String> eventsAfterFirst = eventSignature(eventRepository.findAll());
        List<String> dailyAfterFirst = dailySignature(dailyRepository.findByBrandOrderBySentimentDateAsc("PEPSI"));
        assertThat(dailyAfterFirst).isNotEmpty();
        assertThat(brandDimensionRepository.findByBrand("PEPSI")).isPresent();

        // 较晚投递的版本胜出
        assertThat(eventRepository.findAll())
                .filteredOn(e -> "p1".equals(e.getSourceId()))
                .singleElement()
                .satisfies(e -> assertThat(e.getSentimentScore()).isEqualTo(0.7));

        PipelineRun second = pipelineService.runPipeline();
        log.info("第二次运行: {}", second);

        assertThat(second.getStatus()).isEqualTo("SUCCEEDED");
        assertThat(second.getInserted()).isZero();
        assertThat(second.getReplaced()).isEqualTo(4);
        assertThat(eventRepository.count()).isEqualTo(4);
        assertThat(eventRepository.countDuplicateIdentityTriples()).isZero();
        assertThat(eventSignature(eventRepository.findAll())).isEqualTo(eventsAfterFirst);
        assertThat(dailySignature(dailyRepository.findByBrandOrderBySentimentDateAsc("PEPSI")))
                .isEqualTo(dailyAfterFirst);

        log.info("✓ 重复运行结果一致");
    }

    @Test
    @DisplayName("T2: 查询接口")
    void queryEndpoints() throws Exception {
        pipelineService.runPipeline();

        mockMvc.perform(get("/api/v1/brands/pepsi/daily"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data[0].brand").value("PEPSI"));

        mockMvc.perform(get("/api/v1/brands/unknown-brand/daily"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/topics/trending").param("limit", "0"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/brands/competitive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].brand").value("PEPSI"));

        mockMvc.perform(get("/api/v1/pipeline/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("SUCCEEDED"));
    }

    @Test
    @DisplayName("T3: 运行期间查询返回 423")
    void queriesAreLockedDuringRun() throws Exception {
        assertThat(statusManager.tryBeginRun()).isTrue();
        try {
            mockMvc.perform(get("/api/v1/anomalies"))
                    .andExpect(status().isLocked());
            mockMvc.perform(get("/api/v1/topics/trending"))
                    .andExpect(status().isLocked());
        } finally {
            statusManager.endRun();
        }

        mockMvc.perform(get("/api/v1/anomalies"))
                .andExpect(status().isOk());
    }
}
