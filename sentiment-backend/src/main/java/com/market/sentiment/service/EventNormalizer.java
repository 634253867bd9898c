package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import com.market.sentiment.dto.NormalizationResult;
import com.market.sentiment.entity.SourceKind;
import com.market.sentiment.exception.SchemaException;
import com.market.sentiment.feed.SentimentScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 事件规范化：把各来源结构不同的原始记录映射为统一事件。
 * 每种来源声明自己的字段别名；未知字段丢弃并告警（同一批次同一字段只告警一次）。
 * 缺少 source_id / published_at 或时间无法解析的记录抛出 {@link SchemaException}。
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    // 规范字段名
    static final String SOURCE_ID = "source_id";
    static final String CREATOR = "creator";
    static final String BRAND = "brand";
    static final String PARENT_COMPANY = "parent_company";
    static final String CATEGORY = "category";
    static final String HEADLINE = "headline";
    static final String BODY_TEXT = "body_text";
    static final String ENGAGEMENT = "engagement_count";
    static final String PUBLISHED_AT = "published_at";
    static final String SENTIMENT_SCORE = "sentiment_score";
    static final String CHANNEL = "channel";
    static final String INGESTED_AT = "ingested_at";
    // 已知但不使用的字段
    static final String IGNORED = "";

    private static final Map<SourceKind, Map<String, String>> SCHEMAS = new EnumMap<>(SourceKind.class);

    static {
        SCHEMAS.put(SourceKind.SOCIAL, Map.ofEntries(
                Map.entry("post_id", SOURCE_ID),
                Map.entry("author", CREATOR),
                Map.entry("brand", BRAND),
                Map.entry("parent_company", PARENT_COMPANY),
                Map.entry("brand_category", CATEGORY),
                Map.entry("title", HEADLINE),
                Map.entry("body", BODY_TEXT),
                Map.entry("upvotes", ENGAGEMENT),
                Map.entry("created_at", PUBLISHED_AT),
                Map.entry("sentiment_score", SENTIMENT_SCORE),
                Map.entry("subreddit", CHANNEL),
                Map.entry("ingested_at", INGESTED_AT),
                Map.entry("comments_count", IGNORED)));
        SCHEMAS.put(SourceKind.NEWS, Map.ofEntries(
                Map.entry("article_id", SOURCE_ID),
                Map.entry("publication", CREATOR),
                Map.entry("brand", BRAND),
                Map.entry("parent_company", PARENT_COMPANY),
                Map.entry("brand_category", CATEGORY),
                Map.entry("headline", HEADLINE),
                Map.entry("body", BODY_TEXT),
                Map.entry("published_at", PUBLISHED_AT),
                Map.entry("sentiment_score", SENTIMENT_SCORE),
                Map.entry("ingested_at", INGESTED_AT),
                Map.entry("url", IGNORED)));
    }

    private final SentimentScorer sentimentScorer;
    private final SentimentAlgorithm sentimentAlgorithm;

    public EventNormalizer(SentimentScorer sentimentScorer, SentimentAlgorithm sentimentAlgorithm) {
        this.sentimentScorer = sentimentScorer;
        this.sentimentAlgorithm = sentimentAlgorithm;
    }

    /**
     * 规范化一个来源批次。Schema 错误的记录计数后跳过，不影响其余记录。
     *
     * @param source     来源类型
     * @param records    原始记录
     * @param runTime    本次运行的处理时间，作为缺失 ingested_at 的默认值
     */
    public NormalizationResult normalizeBatch(SourceKind source, List<Map<String, Object>> records, LocalDateTime runTime) {
        NormalizationResult result = new NormalizationResult();
        Set<String> warnedFields = new HashSet<>();
        for (Map<String, Object> record : records) {
            result.setRawRecords(result.getRawRecords() + 1);
            try {
                result.getEvents().add(normalize(source, record, runTime, warnedFields));
            } catch (SchemaException e) {
                result.setSchemaErrors(result.getSchemaErrors() + 1);
                log.warn("[{}] 丢弃无法规范化的记录: {}", source.code(), e.getMessage());
            }
        }
        log.info("[{}] 规范化完成：原始 {} 条，成功 {} 条，Schema 错误 {} 条",
                source.code(), result.getRawRecords(), result.getEvents().size(), result.getSchemaErrors());
        return result;
    }

    public CanonicalEventDTO normalize(SourceKind source, Map<String, Object> record, LocalDateTime runTime) {
        return normalize(source, record, runTime, new HashSet<>());
    }

    private CanonicalEventDTO normalize(SourceKind source, Map<String, Object> record, LocalDateTime runTime,
                                        Set<String> warnedFields) {
        Map<String, String> schema = SCHEMAS.get(source);
        if (schema == null) {
            throw new SchemaException("未声明字段映射的来源: " + source);
        }

        Map<String, Object> canonical = new HashMap<>();
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            String target = schema.get(entry.getKey());
            if (target == null) {
                if (warnedFields.add(entry.getKey())) {
                    log.warn("[{}] 未知字段 '{}' 已忽略", source.code(), entry.getKey());
                }
            } else if (!target.isEmpty()) {
                canonical.put(target, entry.getValue());
            }
        }

        String sourceId = cleanText(canonical.get(SOURCE_ID));
        if (sourceId == null) {
            throw new SchemaException("缺少 source_id");
        }
        LocalDateTime publishedAt = parseTimestamp(canonical.get(PUBLISHED_AT), PUBLISHED_AT);
        if (publishedAt == null) {
            throw new SchemaException("记录 " + sourceId + " 缺少 published_at");
        }

        CanonicalEventDTO event = new CanonicalEventDTO();
        event.setSourceId(sourceId);
        event.setSource(source);
        event.setPublishedAt(publishedAt);

        LocalDateTime ingestedAt = parseTimestamp(canonical.get(INGESTED_AT), INGESTED_AT);
        event.setIngestedAt(ingestedAt != null ? ingestedAt : runTime);

        event.setBrand(upperTrim(canonical.get(BRAND)));
        event.setParentCompany(upperTrim(canonical.get(PARENT_COMPANY)));
        event.setCategory(upperTrim(canonical.get(CATEGORY)));
        event.setCreator(cleanText(canonical.get(CREATOR)));
        event.setHeadline(collapseWhitespace(canonical.get(HEADLINE)));
        event.setBodyText(cleanText(canonical.get(BODY_TEXT)));
        event.setChannel(cleanText(canonical.get(CHANNEL)));
        event.setEngagementCount(Math.max(0L, toLong(canonical.get(ENGAGEMENT))));

        Double score = toDouble(canonical.get(SENTIMENT_SCORE));
        if (score == null) {
            score = sentimentScorer.score(joinText(event.getHeadline(), event.getBodyText()));
        }
        event.setSentimentScore(score);
        event.setSentimentCategory(sentimentAlgorithm.categorize(score));
        return event;
    }

    /**
     * 时间解析：支持 ISO 本地时间、带时区偏移（转换为 UTC）、纯日期、Timestamp 与 LocalDateTime 对象。
     */
    static LocalDateTime parseTimestamp(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        // "2024-01-15 10:30:00" 形式
        String iso = text.length() > 10 && text.charAt(10) == ' ' ? text.substring(0, 10) + 'T' + text.substring(11) : text;
        LocalDateTime parsed = tryParse(iso, LocalDateTime::parse);
        if (parsed == null) {
            parsed = tryParse(iso, t -> OffsetDateTime.parse(t, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (parsed == null) {
            parsed = tryParse(iso, t -> LocalDate.parse(t).atStartOfDay());
        }
        if (parsed == null) {
            throw new SchemaException("无法解析的时间 " + field + "='" + text + "'");
        }
        return parsed;
    }

    private static LocalDateTime tryParse(String text, Function<String, LocalDateTime> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String cleanText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String upperTrim(Object value) {
        String text = cleanText(value);
        return text == null ? null : text.toUpperCase(Locale.ROOT);
    }

    private static String collapseWhitespace(Object value) {
        String text = cleanText(value);
        return text == null ? null : text.replaceAll("\\s+", " ");
    }

    private static String joinText(String headline, String body) {
        return (headline == null ? "" : headline) + " " + (body == null ? "" : body);
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return (long) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SchemaException("无法解析的互动数: " + value, e);
        }
    }

    private static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new SchemaException("无法解析的情感分数: " + value, e);
        }
    }
}
