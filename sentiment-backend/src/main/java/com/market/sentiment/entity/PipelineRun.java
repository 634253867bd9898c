package com.market.sentiment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * PipelineRun Entity: 每次批处理运行的汇总记录（运行级错误报告）。
 * 保留历史，每次运行新增一行。
 */
@Entity
@Data
@Table(name = "pipeline_runs")
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "run_id")
    private Long runId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    /** RUNNING / SUCCEEDED / FAILED */
    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "high_watermark")
    private LocalDateTime highWatermark;

    @Column(name = "window_start")
    private LocalDateTime windowStart;

    // --- 记录级计数 ---
    @Column(name = "raw_records")
    private Integer rawRecords = 0;

    @Column(name = "schema_errors")
    private Integer schemaErrors = 0;

    @Column(name = "outside_window")
    private Integer outsideWindow = 0;

    @Column(name = "candidates")
    private Integer candidates = 0;

    @Column(name = "duplicates_dropped")
    private Integer duplicatesDropped = 0;

    @Column(name = "merge_conflicts")
    private Integer mergeConflicts = 0;

    @Column(name = "inserted")
    private Integer inserted = 0;

    @Column(name = "replaced")
    private Integer replaced = 0;

    // --- 质量标记分布 ---
    @Column(name = "valid_count")
    private Integer validCount = 0;

    @Column(name = "invalid_sentiment_count")
    private Integer invalidSentimentCount = 0;

    @Column(name = "null_headline_count")
    private Integer nullHeadlineCount = 0;

    @Column(name = "future_date_count")
    private Integer futureDateCount = 0;

    // --- 派生表行数 ---
    @Column(name = "daily_rows")
    private Integer dailyRows = 0;

    @Column(name = "trend_rows")
    private Integer trendRows = 0;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;
}
