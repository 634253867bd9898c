package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.dto.MergePlan;
import com.market.sentiment.entity.SentimentEvent;
import com.market.sentiment.exception.MergeConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 合并计划：候选窗口筛选、批内去重、与已持久化行的身份冲突检查。
 * 只做内存计算，不访问数据库。
 */
@Component
public class MergePlanner {

    private static final Logger log = LoggerFactory.getLogger(MergePlanner.class);

    /** 正式表为空时的水位线 */
    public static final LocalDateTime EMPTY_WATERMARK = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final Comparator<CanonicalEventDTO> versionComparator;

    public MergePlanner(Comparator<CanonicalEventDTO> eventVersionComparator) {
        this.versionComparator = eventVersionComparator;
    }

    public static LocalDateTime windowStart(LocalDateTime watermark, Duration overlap) {
        LocalDateTime effective = watermark == null ? EMPTY_WATERMARK : watermark;
        return effective.minus(overlap);
    }

    /**
     * 1. 候选筛选：published_at ≥ watermark - overlap 的事件进入候选，其余计入 outsideWindow。
     * 2. 批内去重：按 event_id 分组，每组按版本排序取第一条。
     */
    public MergePlan selectAndDeduplicate(List<CanonicalEventDTO> events, LocalDateTime watermark, Duration overlap) {
        MergePlan plan = new MergePlan();
        plan.setHighWatermark(watermark == null ? EMPTY_WATERMARK : watermark);
        plan.setWindowStart(windowStart(watermark, overlap));

        Map<String, List<CanonicalEventDTO>> groups = new LinkedHashMap<>();
        for (CanonicalEventDTO event : events) {
            if (event.getPublishedAt().isBefore(plan.getWindowStart())) {
                plan.setOutsideWindow(plan.getOutsideWindow() + 1);
                continue;
            }
            plan.setCandidates(plan.getCandidates() + 1);
            groups.computeIfAbsent(event.getEventId(), k -> new ArrayList<>()).add(event);
        }

        for (List<CanonicalEventDTO> versions : groups.values()) {
            versions.sort(versionComparator);
            CanonicalEventDTO winner = versions.get(0);
            for (int i = 1; i < versions.size(); i++) {
                CanonicalEventDTO loser = versions.get(i);
                if (!sameIdentity(winner, loser)) {
                    // md5 碰撞：两个不同的身份三元组得到同一 event_id
                    reportConflict(plan, new MergeConflictException(loser.getEventId(),
                            "批内 event_id 相同但身份三元组不同: " + describe(winner) + " / " + describe(loser)));
                } else {
                    plan.setDuplicatesDropped(plan.getDuplicatesDropped() + 1);
                }
            }
            plan.getToPublish().add(winner);
        }
        return plan;
    }

    /**
     * 3. 冲突检查：event_id 已存在但身份三元组不同的候选被排除；身份一致的记为替换。
     *
     * @param existing 正式表中与候选 event_id 相同的行
     */
    public MergePlan resolveConflicts(MergePlan plan, Map<String, SentimentEvent> existing) {
        Iterator<CanonicalEventDTO> it = plan.getToPublish().iterator();
        while (it.hasNext()) {
            CanonicalEventDTO candidate = it.next();
            SentimentEvent persisted = existing.get(candidate.getEventId());
            if (persisted == null) {
                continue;
            }
            if (Objects.equals(persisted.getSourceId(), candidate.getSourceId())
                    && Objects.equals(persisted.getPublishedAt(), candidate.getPublishedAt())
                    && Objects.equals(persisted.getSource(), candidate.getSource().code())) {
                plan.getReplacedIds().add(candidate.getEventId());
            } else {
                it.remove();
                reportConflict(plan, new MergeConflictException(candidate.getEventId(),
                        "event_id 已被其他身份占用: 已有 (" + persisted.getSourceId() + ", " + persisted.getPublishedAt()
                                + ", " + persisted.getSource() + ")，候选 " + describe(candidate)));
            }
        }
        return plan;
    }

    private void reportConflict(MergePlan plan, MergeConflictException conflict) {
        plan.setMergeConflicts(plan.getMergeConflicts() + 1);
        log.warn("合并冲突 [{}]: {}", conflict.getEventId(), conflict.getMessage());
    }

    private static boolean sameIdentity(CanonicalEventDTO a, CanonicalEventDTO b) {
        return Objects.equals(a.getSourceId(), b.getSourceId())
                && Objects.equals(a.getPublishedAt(), b.getPublishedAt())
                && a.getSource() == b.getSource();
    }

    private static String describe(CanonicalEventDTO event) {
        return "(" + event.getSourceId() + ", " + event.getPublishedAt() + ", "
                + (event.getSource() == null ? null : event.getSource().code()) + ")";
    }
}
