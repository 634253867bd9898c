package com.market.sentiment.repository;

import com.market.sentiment.entity.BrandDimension;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BrandDimensionRepository extends JpaRepository<BrandDimension, String> {

    Optional<BrandDimension> findByBrand(String brand);
}
