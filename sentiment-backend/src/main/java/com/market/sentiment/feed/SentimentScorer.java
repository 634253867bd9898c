package com.market.sentiment.feed;

/**
 * 情感打分器：文本 → 名义上位于 [-1, 1] 的分数。
 * 超出范围的值不会导致失败，而是由质量门标记为 INVALID_SENTIMENT。
 */
public interface SentimentScorer {

    double score(String text);
}
