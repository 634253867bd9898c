package com.market.sentiment.service;

import com.market.sentiment.exception.PipelineBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时触发器。sentiment.schedule.cron 默认为 "-"，即不注册定时任务，只能通过接口手动触发。
 */
@Component
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final SentimentPipelineService pipelineService;

    public PipelineScheduler(SentimentPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(cron = "${sentiment.schedule.cron:-}")
    public void scheduledRun() {
        log.info("【定时触发】开始执行情感流水线");
        try {
            pipelineService.runPipeline();
        } catch (PipelineBusyException e) {
            log.warn("定时触发跳过: {}", e.getMessage());
        }
    }
}
