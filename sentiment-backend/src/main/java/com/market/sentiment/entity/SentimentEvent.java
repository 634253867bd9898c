package com.market.sentiment.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * SentimentEvent Entity: 去重后的统一事件表，每个 event_id 一行。
 * 只有合并引擎写入该表。
 */
@Entity
@Table(name = "sentiment_events", indexes = {
        @Index(name = "idx_events_published_at", columnList = "published_at"),
        @Index(name = "idx_events_brand", columnList = "brand")
})
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SentimentEvent extends AbstractSentimentEvent {
}
