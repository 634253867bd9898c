package com.market.sentiment.repository;

import com.market.sentiment.entity.AnomalyFlag;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.entity.DailyBrandSentimentId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface DailyBrandSentimentRepository extends JpaRepository<DailyBrandSentiment, DailyBrandSentimentId> {

    /**
     * 重算窗口内的日度行整体删除后重建，避免在旧值上累加。
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DailyBrandSentiment d WHERE d.sentimentDate >= :from")
    int deleteBySentimentDateFrom(@Param("from") LocalDate from);

    /**
     * 异常检测需要品牌的全部历史日度数据，而不只是本次窗口。
     */
    List<DailyBrandSentiment> findByBrandInOrderBySentimentDateAsc(Collection<String> brands);

    List<DailyBrandSentiment> findByBrandOrderBySentimentDateAsc(String brand);

    List<DailyBrandSentiment> findByAnomalyFlagOrderBySentimentDateDesc(AnomalyFlag anomalyFlag);
}
