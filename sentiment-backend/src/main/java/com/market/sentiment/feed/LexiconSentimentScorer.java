package com.market.sentiment.feed;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * 基于词典的简易打分器，仅在原始记录缺少 sentiment_score 时使用。
 * 归一化方式与 VADER compound 相同：x / sqrt(x² + 15)。
 */
@Component
public class LexiconSentimentScorer implements SentimentScorer {

    private static final double ALPHA = 15.0;

    private static final Set<String> POSITIVE = Set.of(
            "good", "great", "love", "excellent", "delicious", "best", "amazing", "happy",
            "tasty", "fresh", "win", "strong", "growth", "improved", "favorite");

    private static final Set<String> NEGATIVE = Set.of(
            "bad", "terrible", "hate", "awful", "worst", "recall", "defect", "problem",
            "expensive", "lawsuit", "decline", "weak", "disappointing", "boycott", "sick");

    @Override
    public double score(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        int sum = 0;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (POSITIVE.contains(token)) {
                sum++;
            } else if (NEGATIVE.contains(token)) {
                sum--;
            }
        }
        if (sum == 0) {
            return 0.0;
        }
        return sum / Math.sqrt((double) sum * sum + ALPHA);
    }
}
