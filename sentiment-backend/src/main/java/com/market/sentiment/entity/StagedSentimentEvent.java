package com.market.sentiment.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 合并暂存表：本次运行的候选事件先写入这里，再在同一事务内替换正式表中的同 ID 行。
 * 事务提交后该表为空。
 */
@Entity
@Table(name = "sentiment_events_staging")
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StagedSentimentEvent extends AbstractSentimentEvent {
}
