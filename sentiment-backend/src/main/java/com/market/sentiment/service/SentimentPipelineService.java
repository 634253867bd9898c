package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.dto.MergePlan;
import com.market.sentiment.dto.NormalizationResult;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.PipelineRun;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.exception.PipelineBusyException;
import com.market.sentiment.exception.StoreUnavailableException;
import com.market.sentiment.feed.ContentFeed;
import com.market.sentiment.repository.PipelineRunRepository;
import com.market.sentiment.util.PipelineRunStatusManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 【SentimentPipelineService】
 * 职责：一次批处理运行的协调者。
 * 拉取 → 规范化 → 身份解析 → 质量门 → 增量合并（事务）→ 品牌维表 → 日度聚合 → 异常检测 → 趋势话题 → 竞争分析。
 *
 * 只有存储不可用会中止运行；Schema 错误、质量标记、合并冲突都按记录计数写入运行记录。
 */
@Service
public class SentimentPipelineService {

    private static final Logger log = LoggerFactory.getLogger(SentimentPipelineService.class);

    static final String RUNNING = "RUNNING";
    static final String SUCCEEDED = "SUCCEEDED";
    static final String FAILED = "FAILED";

    private static final String TOTAL = "总耗时";

    private final List<ContentFeed> contentFeeds;
    private final EventNormalizer eventNormalizer;
    private final EventIdentityResolver identityResolver;
    private final QualityGate qualityGate;
    private final IncrementalMergeEngine mergeEngine;
    private final BrandDimensionSyncService brandDimensionSyncService;
    private final DailySentimentAggregator dailyAggregator;
    private final SentimentAnomalyDetector anomalyDetector;
    private final TrendingTopicScorer trendingTopicScorer;
    private final BrandCompetitiveAnalyzer competitiveAnalyzer;
    private final PipelineRunRepository runRepository;
    private final PipelineRunStatusManager statusManager;
    private final Clock clock;

    public SentimentPipelineService(
        List<ContentFeed> contentFeeds,
        EventNormalizer eventNormalizer,
        EventIdentityResolver identityResolver,
        QualityGate qualityGate,
        IncrementalMergeEngine mergeEngine,
        BrandDimensionSyncService brandDimensionSyncService,
        DailySentimentAggregator dailyAggregator,
        SentimentAnomalyDetector anomalyDetector,
        TrendingTopicScorer trendingTopicScorer,
        BrandCompetitiveAnalyzer competitiveAnalyzer,
        PipelineRunRepository runRepository,
        PipelineRunStatusManager statusManager,
        Clock clock)
    {
        this.contentFeeds = contentFeeds;
        this.eventNormalizer = eventNormalizer;
        this.identityResolver = identityResolver;
        this.qualityGate = qualityGate;
        this.mergeEngine = mergeEngine;
        this.brandDimensionSyncService = brandDimensionSyncService;
        this.dailyAggregator = dailyAggregator;
        this.anomalyDetector = anomalyDetector;
        this.trendingTopicScorer = trendingTopicScorer;
        this.competitiveAnalyzer = competitiveAnalyzer;
        this.runRepository = runRepository;
        this.statusManager = statusManager;
        this.clock = clock;
    }

    /**
     * 执行一次完整运行。已有运行持有写锁时抛出 {@link PipelineBusyException}。
     */
    public PipelineRun runPipeline() {
        if (!statusManager.tryBeginRun()) {
            throw new PipelineBusyException("已有一次流水线运行正在进行，本次触发被拒绝");
        }
        try {
            return execute();
        } finally {
            statusManager.endRun();
        }
    }

    private PipelineRun execute() {
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("【流水线运行】开始执行，处理时间: {}", now);

        long totalStartTime = System.currentTimeMillis();
        Map<String, Long> timingStats = new LinkedHashMap<>();

        PipelineRun run = new PipelineRun();
        run.setStartedAt(now);
        run.setStatus(RUNNING);

        try {
            run = runRepository.save(run);

            // 1. 拉取与规范化
            log.info("--- 1. 开始执行【拉取与规范化】---");
            long stageStart = System.currentTimeMillis();
            NormalizationResult normalized = pullAndNormalize(now);
            run.setRawRecords(normalized.getRawRecords());
            run.setSchemaErrors(normalized.getSchemaErrors());
            timingStats.put("1. 拉取与规范化", System.currentTimeMillis() - stageStart);

            // 2. 身份解析与质量门
            log.info("--- 2. 开始执行【身份解析与质量门】---");
            stageStart = System.currentTimeMillis();
            List<CanonicalEventDTO> events = normalized.getEvents().stream()
                    .map(identityResolver::resolve)
                    .map(qualityGate::apply)
                    .collect(Collectors.toList());
            recordQualityCounts(run, events);
            timingStats.put("2. 身份解析与质量门", System.currentTimeMillis() - stageStart);

            // 3. 增量合并
            log.info("--- 3. 开始执行【增量合并】---");
            stageStart = System.currentTimeMillis();
            MergePlan plan = mergeEngine.merge(events, now);
            recordMergeCounts(run, plan);
            // 合并已提交，先落盘窗口起点，后续阶段失败时下一次运行据此补算
            run = runRepository.save(run);
            timingStats.put("3. 增量合并", System.currentTimeMillis() - stageStart);

            // 4. 品牌维表
            log.info("--- 4. 开始执行【品牌维表同步】---");
            stageStart = System.currentTimeMillis();
            brandDimensionSyncService.syncBrands(now);
            timingStats.put("4. 品牌维表同步", System.currentTimeMillis() - stageStart);

            // 5. 日度聚合
            log.info("--- 5. 开始执行【日度聚合】---");
            stageStart = System.currentTimeMillis();
            List<DailyBrandSentiment> dailyRows = dailyAggregator.recompute(aggregationStart(run, plan), now);
            run.setDailyRows(dailyRows.size());
            timingStats.put("5. 日度聚合", System.currentTimeMillis() - stageStart);

            // 6. 异常检测
            log.info("--- 6. 开始执行【异常检测】---");
            stageStart = System.currentTimeMillis();
            Set<String> touchedBrands = dailyRows.stream()
                    .map(DailyBrandSentiment::getBrand)
                    .collect(Collectors.toCollection(TreeSet::new));
            anomalyDetector.detect(touchedBrands);
            timingStats.put("6. 异常检测", System.currentTimeMillis() - stageStart);

            // 7. 趋势话题
            log.info("--- 7. 开始执行【趋势话题】---");
            stageStart = System.currentTimeMillis();
            run.setTrendRows(trendingTopicScorer.recompute(now).size());
            timingStats.put("7. 趋势话题", System.currentTimeMillis() - stageStart);

            // 8. 竞争分析
            log.info("--- 8. 开始执行【竞争分析】---");
            stageStart = System.currentTimeMillis();
            competitiveAnalyzer.recompute(now);
            timingStats.put("8. 竞争分析", System.currentTimeMillis() - stageStart);

            run.setStatus(SUCCEEDED);
            run.setFinishedAt(LocalDateTime.now(clock));
            run = runRepository.save(run);
        } catch (StoreUnavailableException e) {
            markFailed(run, e);
            throw e;
        } catch (DataAccessException e) {
            StoreUnavailableException wrapped = new StoreUnavailableException("存储访问失败: " + e.getMessage(), e);
            markFailed(run, wrapped);
            throw wrapped;
        }

        timingStats.put(TOTAL, System.currentTimeMillis() - totalStartTime);
        printRunReport(run, timingStats);
        return run;
    }

    /**
     * 日度重算起点：本次窗口起点与此前未成功结束的运行窗口起点中较早的一个。
     */
    private LocalDateTime aggregationStart(PipelineRun run, MergePlan plan) {
        Long lastSucceeded = runRepository.findLastRunIdByStatus(SUCCEEDED);
        LocalDateTime pending = runRepository.findEarliestUnfinishedWindowStart(
                lastSucceeded == null ? 0L : lastSucceeded, run.getRunId(), SUCCEEDED);
        if (pending != null && pending.isBefore(plan.getWindowStart())) {
            log.warn("上次成功运行之后存在未完成的运行，日度重算起点提前到 {}", pending);
            return pending;
        }
        return plan.getWindowStart();
    }

    private NormalizationResult pullAndNormalize(LocalDateTime now) {
        NormalizationResult all = new NormalizationResult();
        if (contentFeeds.isEmpty()) {
            log.warn("未注册任何内容来源，本次运行只重算派生表。");
        }
        for (ContentFeed feed : contentFeeds) {
            long pullStart = System.currentTimeMillis();
            List<Map<String, Object>> records = feed.pull();
            log.info("  [{}] 拉取耗时: {} ms, 数量: {}", feed.sourceKind().code(),
                    System.currentTimeMillis() - pullStart, records.size());
            all.merge(eventNormalizer.normalizeBatch(feed.sourceKind(), records, now));
        }
        return all;
    }

    private void recordQualityCounts(PipelineRun run, List<CanonicalEventDTO> events) {
        Map<QualityFlag, Integer> counts = new EnumMap<>(QualityFlag.class);
        for (CanonicalEventDTO event : events) {
            counts.merge(event.getQualityFlag(), 1, Integer::sum);
        }
        run.setValidCount(counts.getOrDefault(QualityFlag.VALID, 0));
        run.setInvalidSentimentCount(counts.getOrDefault(QualityFlag.INVALID_SENTIMENT, 0));
        run.setNullHeadlineCount(counts.getOrDefault(QualityFlag.NULL_HEADLINE, 0));
        run.setFutureDateCount(counts.getOrDefault(QualityFlag.FUTURE_DATE, 0));
    }

    private void recordMergeCounts(PipelineRun run, MergePlan plan) {
        run.setHighWatermark(plan.getHighWatermark());
        run.setWindowStart(plan.getWindowStart());
        run.setCandidates(plan.getCandidates());
        run.setOutsideWindow(plan.getOutsideWindow());
        run.setDuplicatesDropped(plan.getDuplicatesDropped());
        run.setMergeConflicts(plan.getMergeConflicts());
        run.setInserted(plan.getInsertCount());
        run.setReplaced(plan.getReplaceCount());
    }

    private void markFailed(PipelineRun run, StoreUnavailableException cause) {
        log.error("流水线运行失败，合并已回滚: {}", cause.getMessage(), cause);
        run.setStatus(FAILED);
        run.setFinishedAt(LocalDateTime.now(clock));
        run.setErrorMessage(truncate(cause.getMessage()));
        try {
            runRepository.save(run);
        } catch (DataAccessException e) {
            log.error("无法记录失败的运行状态: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }

    /**
     * 打印运行报告：各阶段耗时与按质量标记、错误类别的计数。
     */
    private void printRunReport(PipelineRun run, Map<String, Long> timingStats) {
        long totalMs = timingStats.getOrDefault(TOTAL, 0L);

        log.info("========================================");
        log.info("       流水线运行报告 (run #{})", run.getRunId());
        log.info("========================================");
        for (Map.Entry<String, Long> entry : timingStats.entrySet()) {
            if (TOTAL.equals(entry.getKey())) {
                continue;
            }
            long timeMs = entry.getValue();
            double percentage = totalMs > 0 ? (timeMs * 100.0 / totalMs) : 0;
            log.info("  {} : {} ms ({} 秒) - {}%",
                entry.getKey(),
                timeMs,
                String.format("%.2f", timeMs / 1000.0),
                String.format("%.2f", percentage));
        }
        log.info("----------------------------------------");
        log.info("  原始记录: {}, SCHEMA_ERROR: {}", run.getRawRecords(), run.getSchemaErrors());
        log.info("  VALID: {}, INVALID_SENTIMENT: {}, NULL_HEADLINE: {}, FUTURE_DATE: {}",
            run.getValidCount(), run.getInvalidSentimentCount(), run.getNullHeadlineCount(), run.getFutureDateCount());
        log.info("  候选: {}, 窗口外: {}, 批内重复: {}, MERGE_CONFLICT: {}",
            run.getCandidates(), run.getOutsideWindow(), run.getDuplicatesDropped(), run.getMergeConflicts());
        log.info("  新增: {}, 替换: {}, 日度行: {}, 话题行: {}",
            run.getInserted(), run.getReplaced(), run.getDailyRows(), run.getTrendRows());
        log.info("----------------------------------------");
        log.info("  总耗时: {} ms ({} 秒 / {} 分钟)",
            totalMs,
            String.format("%.2f", totalMs / 1000.0),
            String.format("%.2f", totalMs / 60000.0));
        log.info("========================================");
    }
}
