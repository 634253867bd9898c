package com.market.sentiment.controller;

import com.market.sentiment.dto.CommonResponse;
import com.market.sentiment.entity.PipelineRun;
import com.market.sentiment.service.SentimentPipelineService;
import com.market.sentiment.service.SentimentQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final SentimentPipelineService pipelineService;
    private final SentimentQueryService queryService;

    public PipelineController(SentimentPipelineService pipelineService, SentimentQueryService queryService) {
        this.pipelineService = pipelineService;
        this.queryService = queryService;
    }

    /**
     * POST /api/v1/pipeline/runs
     * 功能: 立即执行一次流水线，返回运行记录。已有运行时返回 409。
     */
    @PostMapping("/runs")
    public ResponseEntity<CommonResponse<PipelineRun>> triggerRun() {
        return ResponseEntity.ok(CommonResponse.success(pipelineService.runPipeline()));
    }

    /**
     * GET /api/v1/pipeline/runs
     * 功能: 最近 20 次运行记录
     */
    @GetMapping("/runs")
    public ResponseEntity<CommonResponse<List<PipelineRun>>> getRecentRuns() {
        return ResponseEntity.ok(CommonResponse.success(queryService.getRecentRuns()));
    }
}
