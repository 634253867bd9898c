package com.market.sentiment.exception;

/**
 * 运行报告中的错误分类。只有 STORE_UNAVAILABLE 会中止整次运行，其余按记录计数。
 */
public enum ErrorKind {
    SCHEMA_ERROR,
    VALIDATION_ERROR,
    MERGE_CONFLICT,
    STORE_UNAVAILABLE
}
