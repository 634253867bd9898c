package com.market.sentiment.repository;

import com.market.sentiment.entity.QualityFlag;
import com.market.sentiment.entity.SentimentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SentimentEventRepository extends JpaRepository<SentimentEvent, String> {

    /**
     * 水位线：已持久化的 VALID 事件中最大的 published_at，表为空时返回 null。
     */
    @Query("SELECT MAX(e.publishedAt) FROM SentimentEvent e WHERE e.qualityFlag = :flag")
    LocalDateTime findMaxPublishedAtByQualityFlag(@Param("flag") QualityFlag flag);

    /**
     * 聚合窗口：某个时间点之后的指定质量标记事件。
     */
    List<SentimentEvent> findByQualityFlagAndPublishedAtGreaterThanEqual(QualityFlag flag, LocalDateTime from);

    List<SentimentEvent> findByQualityFlag(QualityFlag flag);

    // 品牌维表同步：VALID 事件中的 (brand, parent_company, category) 组合
    @Query(value = "SELECT e.brand, MAX(e.parent_company), MAX(e.category) FROM sentiment_events e " +
                   "WHERE e.quality_flag = 'VALID' AND e.brand IS NOT NULL GROUP BY e.brand", nativeQuery = true)
    List<Object[]> findValidBrandAttributes();

    // 数据质量检查：同一 (source_id, published_at, source) 出现多行即为身份键缺陷
    @Query(value = "SELECT COUNT(*) FROM (SELECT e.source_id, e.published_at, e.source FROM sentiment_events e " +
                   "GROUP BY e.source_id, e.published_at, e.source HAVING COUNT(*) > 1) t", nativeQuery = true)
    Long countDuplicateIdentityTriples();
}
