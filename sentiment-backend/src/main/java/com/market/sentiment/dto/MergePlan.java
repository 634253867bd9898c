package com.market.sentiment.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 合并计划：在写库之前算好的发布内容。
 * toPublish 中 event_id 唯一；replacedIds 是其中已存在于正式表的部分。
 */
@Data
public class MergePlan {
    private LocalDateTime highWatermark;
    private LocalDateTime windowStart;

    private final List<CanonicalEventDTO> toPublish = new ArrayList<>();
    private final Set<String> replacedIds = new HashSet<>();

    private int candidates;
    private int outsideWindow;
    private int duplicatesDropped;
    private int mergeConflicts;

    public int getInsertCount() {
        return toPublish.size() - replacedIds.size();
    }

    public int getReplaceCount() {
        return replacedIds.size();
    }
}
