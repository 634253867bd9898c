package com.market.sentiment.topic;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 关键词话题规则：文本中包含任一关键词即命中，不区分大小写。
 * 按子串匹配，"ad" 同样命中 "made"、"new" 命中 "renewed"，与数据仓库中 LIKE '%kw%' 的口径一致。
 */
public class KeywordTopicRule implements TopicRule {

    private final String topic;
    private final Pattern pattern;

    public KeywordTopicRule(String topic, String... keywords) {
        this.topic = topic;
        this.pattern = Pattern.compile(Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|")), Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String getTopic() {
        return topic;
    }

    @Override
    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
