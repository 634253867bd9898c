package com.market.sentiment.topic;

/**
 * 话题规则接口。每个实现负责识别一个话题，一条内容可以命中多个话题。
 */
public interface TopicRule {
    /**
     * 话题名称（trending_topics.topic）
     */
    String getTopic();

    /**
     * @param text 已转小写的 headline + ' ' + body
     */
    boolean matches(String text);
}
