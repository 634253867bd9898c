package com.market.sentiment.exception;

public abstract class SentimentPipelineException extends RuntimeException {

    protected SentimentPipelineException(String message) {
        super(message);
    }

    protected SentimentPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();
}
