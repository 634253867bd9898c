package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties.DedupOrder;
import com.market.sentiment.dto.CanonicalEventDTO;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * 批内同一 event_id 多个版本的排序规则：排在最前的版本胜出。
 * ingested_at 为主序，content_hash 降序作为稳定的次序，结果与输入顺序无关。
 */
public final class EventVersionComparator {

    private static final Comparator<CanonicalEventDTO> BY_INGESTED_AT = Comparator.comparing(
            CanonicalEventDTO::getIngestedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));

    private static final Comparator<CanonicalEventDTO> BY_CONTENT_HASH_DESC = Comparator.comparing(
            CanonicalEventDTO::getContentHash, Comparator.nullsLast(Comparator.<String>reverseOrder()));

    private EventVersionComparator() {
    }

    public static Comparator<CanonicalEventDTO> forOrder(DedupOrder order) {
        Comparator<CanonicalEventDTO> primary = order == DedupOrder.EARLIEST_INGESTED
                ? BY_INGESTED_AT
                : BY_INGESTED_AT.reversed();
        return primary.thenComparing(BY_CONTENT_HASH_DESC);
    }
}
