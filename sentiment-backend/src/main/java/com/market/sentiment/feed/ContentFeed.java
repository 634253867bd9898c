package com.market.sentiment.feed;

import com.market.sentiment.entity.SourceKind;

import java.util.List;
import java.util.Map;

/**
 * 外部内容来源（社交平台、新闻接口等）。流水线每次运行拉取一批原始记录，
 * 记录字段沿用来源自身的命名，由 EventNormalizer 按 {@link #sourceKind()} 对应的结构映射。
 * 同一条内容可能被重复投递，也不保证到达顺序。
 */
public interface ContentFeed {

    SourceKind sourceKind();

    List<Map<String, Object>> pull();
}
