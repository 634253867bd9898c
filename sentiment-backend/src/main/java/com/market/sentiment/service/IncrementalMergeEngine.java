package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.dto.MergePlan;
import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.exception.StoreUnavailableException;
import com.market.sentiment.repository.SentimentEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 增量合并引擎：sentiment_events 的唯一写入方。
 * 水位线 → 候选窗口 → 批内去重 → 冲突检查 → 暂存表交换发布，整体在一个事务内完成。
 */
@Service
public class IncrementalMergeEngine {

    private static final Logger log = LoggerFactory.getLogger(IncrementalMergeEngine.class);

    private final SentimentEventRepository eventRepository;
    private final MergePlanner mergePlanner;
    private final StagedEventPublisher publisher;
    private final SentimentProperties properties;

    public IncrementalMergeEngine(SentimentEventRepository eventRepository,
                                  MergePlanner mergePlanner,
                                  StagedEventPublisher publisher,
                                  SentimentProperties properties) {
        this.eventRepository = eventRepository;
        this.mergePlanner = mergePlanner;
        this.publisher = publisher;
        this.properties = properties;
    }

    /**
     * 当前水位线：已持久化 VALID 事件的最大 published_at，表为空时为 1970-01-01T00:00。
     */
    @Transactional(readOnly = true)
    public LocalDateTime currentWatermark() {
        try {
            LocalDateTime watermark = eventRepository.findMaxPublishedAtByQualityFlag(QualityFlag.VALID);
            return watermark == null ? MergePlanner.EMPTY_WATERMARK : watermark;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("读取水位线失败: " + e.getMessage(), e);
        }
    }

    @Transactional
    public MergePlan merge(List<CanonicalEventDTO> events, LocalDateTime mergedAt) {
        try {
            LocalDateTime watermark = currentWatermark();
            MergePlan plan = mergePlanner.selectAndDeduplicate(events, watermark, properties.getOverlapWindow());
            log.info("水位线 {}，候选窗口起点 {}：候选 {} 条，窗口外 {} 条，批内重复 {} 条",
                    plan.getHighWatermark(), plan.getWindowStart(), plan.getCandidates(),
                    plan.getOutsideWindow(), plan.getDuplicatesDropped());

            List<String> candidateIds = plan.getToPublish().stream()
                    .map(CanonicalEventDTO::getEventId)
                    .collect(Collectors.toList());
            Map<String, SentimentEvent> existing = eventRepository.findAllById(candidateIds).stream()
                    .collect(Collectors.toMap(SentimentEvent::getEventId, Function.identity()));
            mergePlanner.resolveConflicts(plan, existing);

            int replaced = publisher.publish(plan.getToPublish(), mergedAt);
            if (replaced != plan.getReplaceCount()) {
                log.warn("替换行数与计划不一致：计划 {}，实际 {}", plan.getReplaceCount(), replaced);
            }
            log.info("合并完成：新增 {} 条，替换 {} 条，冲突 {} 条",
                    plan.getInsertCount(), plan.getReplaceCount(), plan.getMergeConflicts());
            return plan;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("合并写入失败，事务回滚: " + e.getMessage(), e);
        }
    }
}
