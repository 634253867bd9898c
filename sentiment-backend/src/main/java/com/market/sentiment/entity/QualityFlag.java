package com.market.sentiment.entity;

/**
 * 事件质量标记。按声明顺序即判定优先级，命中第一个即停止。
 */
public enum QualityFlag {
    VALID,
    INVALID_SENTIMENT,
    NULL_HEADLINE,
    FUTURE_DATE
}
