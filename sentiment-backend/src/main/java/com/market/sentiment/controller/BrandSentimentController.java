package com.market.sentiment.controller;

import com.market.sentiment.dto.CommonResponse;
import com.market.sentiment.entity.BrandCompetitiveAnalysis;
import com.market.sentiment.entity.DailyBrandSentiment;
import com.market.sentiment.service.SentimentQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class BrandSentimentController {

    private final SentimentQueryService queryService;

    public BrandSentimentController(SentimentQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/v1/brands/{brand}/daily
     * 功能: 指定品牌的日度情感序列（按日期升序），品牌不存在时返回 404
     */
    @GetMapping("/brands/{brand}/daily")
    public ResponseEntity<CommonResponse<List<DailyBrandSentiment>>> getBrandDaily(@PathVariable String brand) {
        List<DailyBrandSentiment> rows = queryService.getBrandDailySentiment(brand);
        if (rows.isEmpty()) {
            return ResponseEntity.status(404).body(CommonResponse.error(404, "没有品牌 " + brand + " 的日度数据"));
        }
        return ResponseEntity.ok(CommonResponse.success(rows));
    }

    /**
     * GET /api/v1/anomalies
     * 功能: 全部被标记为 ANOMALY 的日度行
     */
    @GetMapping("/anomalies")
    public ResponseEntity<CommonResponse<List<DailyBrandSentiment>>> getAnomalies() {
        return ResponseEntity.ok(CommonResponse.success(queryService.getAnomalies()));
    }

    /**
     * GET /api/v1/brands/competitive
     * 功能: 品牌竞争分析（按声量份额降序）
     */
    @GetMapping("/brands/competitive")
    public ResponseEntity<CommonResponse<List<BrandCompetitiveAnalysis>>> getCompetitive() {
        return ResponseEntity.ok(CommonResponse.success(queryService.getCompetitiveAnalysis()));
    }
}
