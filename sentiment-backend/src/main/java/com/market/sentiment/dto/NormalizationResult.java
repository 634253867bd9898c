package com.market.sentiment.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个来源批次的规范化结果：成功转换的事件与被拒绝的记录数。
 */
@Data
public class NormalizationResult {
    private final List<CanonicalEventDTO> events = new ArrayList<>();
    private int rawRecords;
    private int schemaErrors;

    public void merge(NormalizationResult other) {
        events.addAll(other.getEvents());
        rawRecords += other.getRawRecords();
        schemaErrors += other.getSchemaErrors();
    }
}
