package com.market.sentiment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对应数据库表 dim_brands
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "dim_brands")
public class BrandDimension {

    /**
     * brand_key: md5(brand)，与事件表中的 brand_key 一致
     */
    @Id
    @Column(name = "brand_key", length = 32)
    private String brandKey;

    @Column(name = "brand", nullable = false, unique = true, length = 128)
    private String brand;

    @Column(name = "parent_company", length = 128)
    private String parentCompany;

    @Column(name = "category", length = 128)
    private String category;

    /** PUBLIC / PRIVATE */
    @Column(name = "company_type", length = 16)
    private String companyType;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
