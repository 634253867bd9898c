package com.market.sentiment.service;

import com.market.sentiment.dto.CanonicalEventDTO;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 身份解析：为统一事件生成确定性的代理键。
 * event_id = md5(source_id | published_at | source)，任一字段为空按 "" 处理。
 * 三个字段缺一不可：同一 source_id + published_at 在不同来源下必须得到不同的 event_id。
 */
@Component
public class EventIdentityResolver {

    private static final String SEPARATOR = "|";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public CanonicalEventDTO resolve(CanonicalEventDTO event) {
        event.setEventId(eventId(event.getSourceId(), event.getPublishedAt(),
                event.getSource() == null ? null : event.getSource().code()));
        event.setBrandKey(brandKey(event.getBrand()));
        event.setContentHash(contentHash(event));
        return event;
    }

    public String eventId(String sourceId, LocalDateTime publishedAt, String source) {
        return surrogateKey(sourceId, formatTimestamp(publishedAt), source);
    }

    public String brandKey(String brand) {
        return surrogateKey(brand);
    }

    /**
     * 统一事件全部内容字段的摘要，批内去重时作为 ingested_at 相同情况下的稳定次序。
     */
    public String contentHash(CanonicalEventDTO event) {
        return surrogateKey(
                event.getSourceId(),
                formatTimestamp(event.getPublishedAt()),
                event.getSource() == null ? null : event.getSource().code(),
                event.getBrand(),
                event.getParentCompany(),
                event.getCategory(),
                event.getCreator(),
                event.getHeadline(),
                event.getBodyText(),
                event.getChannel(),
                String.valueOf(event.getEngagementCount()),
                event.getSentimentScore() == null ? null : event.getSentimentScore().toString());
    }

    /**
     * 时间戳的固定文本格式：yyyy-MM-dd HH:mm:ss，存在亚秒部分时追加 6 位微秒。
     */
    static String formatTimestamp(LocalDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        String text = TIMESTAMP_FORMAT.format(timestamp);
        if (timestamp.getNano() != 0) {
            text += String.format(".%06d", timestamp.getNano() / 1000);
        }
        return text;
    }

    private static String surrogateKey(String... fields) {
        String joined = Arrays.stream(fields)
                .map(f -> Objects.toString(f, ""))
                .collect(Collectors.joining(SEPARATOR));
        return DigestUtils.md5DigestAsHex(joined.getBytes(StandardCharsets.UTF_8));
    }
}
