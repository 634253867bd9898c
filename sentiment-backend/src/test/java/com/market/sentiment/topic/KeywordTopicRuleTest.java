package com.market.sentiment.topic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordTopicRuleTest {

    private final KeywordTopicRule marketing =
            new KeywordTopicRule("Marketing & Advertising", "ad", "commercial", "campaign", "super bowl");

    private final KeywordTopicRule productLaunch =
            new KeywordTopicRule("Product Launch", "new", "launch", "debut");

    @Test
    void matchesKeywordIgnoringCase() {
        assertTrue(marketing.matches("their new ad is everywhere"));
        assertTrue(marketing.matches("advertising spend is up"));
        assertTrue(marketing.matches("The SUPER BOWL spot"));
        assertTrue(productLaunch.matches("LAUNCHED today"));
    }

    // 子串即命中，单词中间出现的关键词也算
    @Test
    void matchesKeywordInsideWord() {
        assertTrue(marketing.matches("a bad batch"));
        assertTrue(marketing.matches("made in a hurry"));
        assertTrue(productLaunch.matches("contract renewed"));
    }

    @Test
    void textWithoutKeywordDoesNotMatch() {
        assertFalse(marketing.matches("tastes like summer"));
        assertFalse(productLaunch.matches("same old can"));
        assertFalse(marketing.matches(null));
    }
}
