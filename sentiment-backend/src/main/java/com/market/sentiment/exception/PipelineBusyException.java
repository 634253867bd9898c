package com.market.sentiment.exception;

/**
 * 已有一次运行持有写锁，本次触发被拒绝。
 */
public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message) {
        super(message);
    }
}
