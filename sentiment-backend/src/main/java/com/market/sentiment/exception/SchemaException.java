package com.market.sentiment.exception;

/**
 * 原始记录无法映射为统一事件（缺少 source_id / published_at，或时间无法解析）。
 * 该记录被丢弃并计数，不影响同批其他记录。
 */
public class SchemaException extends SentimentPipelineException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.SCHEMA_ERROR;
    }
}
