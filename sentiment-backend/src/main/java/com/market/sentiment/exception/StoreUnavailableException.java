package com.market.sentiment.exception;

/**
 * 持久层不可用。中止整次运行，合并事务回滚，不留下部分写入。
 */
public class StoreUnavailableException extends SentimentPipelineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.STORE_UNAVAILABLE;
    }
}
