package com.market.sentiment.dto;

import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SourceKind;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 统一事件数据传输对象：规范化之后、落库之前在各阶段之间传递。
 * eventId / brandKey / contentHash 由身份解析阶段填充，qualityFlag 由质量门填充。
 */
@Data
public class CanonicalEventDTO {
    private String sourceId;
    private SourceKind source;

    private String brand;
    private String parentCompany;
    private String category;

    private String creator;
    private String headline;
    private String bodyText;
    private String channel;

    private LocalDateTime publishedAt;
    private LocalDateTime ingestedAt;

    private long engagementCount;
    private Double sentimentScore;
    private String sentimentCategory;

    // 身份
    private String eventId;
    private String brandKey;
    private String contentHash;

    private QualityFlag qualityFlag;
}
