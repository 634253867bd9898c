package com.market.sentiment.service;

import com.market.sentiment.config.SentimentProperties;
import com.market.sentiment.entity.BrandDimension;
import com.market.sentiment.repository.BrandDimensionRepository;
import com.market.sentiment.repository.SentimentEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 品牌维表同步：每次合并后按 VALID 事件中出现的品牌 upsert dim_brands。
 */
@Service
public class BrandDimensionSyncService {

    private static final Logger log = LoggerFactory.getLogger(BrandDimensionSyncService.class);

    static final String PUBLIC = "PUBLIC";
    static final String PRIVATE = "PRIVATE";

    private final SentimentEventRepository eventRepository;
    private final BrandDimensionRepository brandDimensionRepository;
    private final EventIdentityResolver identityResolver;
    private final SentimentProperties properties;

    public BrandDimensionSyncService(SentimentEventRepository eventRepository,
                                     BrandDimensionRepository brandDimensionRepository,
                                     EventIdentityResolver identityResolver,
                                     SentimentProperties properties) {
        this.eventRepository = eventRepository;
        this.brandDimensionRepository = brandDimensionRepository;
        this.identityResolver = identityResolver;
        this.properties = properties;
    }

    @Transactional
    public int syncBrands(LocalDateTime updatedAt) {
        List<Object[]> attributes = eventRepository.findValidBrandAttributes();
        List<BrandDimension> dimensions = new ArrayList<>(attributes.size());
        for (Object[] row : attributes) {
            String brand = (String) row[0];
            String parentCompany = (String) row[1];
            String category = (String) row[2];
            dimensions.add(new BrandDimension(
                    identityResolver.brandKey(brand),
                    brand,
                    parentCompany,
                    category,
                    companyType(parentCompany),
                    Boolean.TRUE,
                    updatedAt));
        }
        brandDimensionRepository.saveAll(dimensions);
        log.info("品牌维表同步完成，共 {} 个品牌", dimensions.size());
        return dimensions.size();
    }

    String companyType(String parentCompany) {
        if (parentCompany == null) {
            return PRIVATE;
        }
        return properties.getPublicCompanies().stream().anyMatch(parentCompany::equalsIgnoreCase) ? PUBLIC : PRIVATE;
    }
}
