package com.market.sentiment.exception;

/**
 * 候选事件的 event_id 与已持久化的行相同，但 (source_id, published_at, source) 不一致。
 * 该事件被排除并记录日志。
 */
public class MergeConflictException extends SentimentPipelineException {

    private final String eventId;

    public MergeConflictException(String eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.MERGE_CONFLICT;
    }
}
