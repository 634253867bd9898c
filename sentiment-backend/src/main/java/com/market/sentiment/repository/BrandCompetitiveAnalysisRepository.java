package com.market.sentiment.repository;

import com.market.sentiment.entity.BrandCompetitiveAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BrandCompetitiveAnalysisRepository extends JpaRepository<BrandCompetitiveAnalysis, String> {

    List<BrandCompetitiveAnalysis> findAllByOrderByShareOfVoicePctDesc();
}
