package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.entity.QualityFlag;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 质量门：为每个事件打上质量标记，不丢弃任何事件。
 * 按优先级取第一个命中的标记：INVALID_SENTIMENT → NULL_HEADLINE → FUTURE_DATE → VALID。
 */
@Component
public class QualityGate {

    private final Clock clock;

    public QualityGate(Clock clock) {
        this.clock = clock;
    }

    public QualityFlag evaluate(CanonicalEventDTO event) {
        Double score = event.getSentimentScore();
        if (score == null || score.isNaN() || score < -1.0 || score > 1.0) {
            return QualityFlag.INVALID_SENTIMENT;
        }
        if (event.getHeadline() == null) {
            return QualityFlag.NULL_HEADLINE;
        }
        if (event.getPublishedAt() != null && event.getPublishedAt().isAfter(LocalDateTime.now(clock))) {
            return QualityFlag.FUTURE_DATE;
        }
        return QualityFlag.VALID;
    }

    public CanonicalEventDTO apply(CanonicalEventDTO event) {
        event.setQualityFlag(evaluate(event));
        return event;
    }
}
