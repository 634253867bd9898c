package com.market.sentiment.repository;

import com.market.sentiment.entity.TrendingTopic;
import com.market.sentiment.entity.TrendingTopicId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrendingTopicRepository extends JpaRepository<TrendingTopic, TrendingTopicId> {

    List<TrendingTopic> findAllByOrderByTrendingScoreDesc(Pageable pageable);
}
