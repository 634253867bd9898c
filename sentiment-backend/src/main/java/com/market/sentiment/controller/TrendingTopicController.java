package com.market.sentiment.controller;

import com.market.sentiment.dto.CommonResponse;
import com.market.sentiment.entity.TrendingTopic;
import com.market.sentiment.service.SentimentQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/topics")
public class TrendingTopicController {

    private final SentimentQueryService queryService;

    public TrendingTopicController(SentimentQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/v1/topics/trending?limit=20
     */
    @GetMapping("/trending")
    public ResponseEntity<CommonResponse<List<TrendingTopic>>> getTrending(
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(CommonResponse.success(queryService.getTrendingTopics(limit)));
    }
}
