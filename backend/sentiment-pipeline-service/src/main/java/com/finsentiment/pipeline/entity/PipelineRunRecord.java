package com.finsentiment.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 종료된 파이프라인 실행 이력.
 * 실행이 종료 상태(COMPLETED/STOPPED/FAILED)에 도달하면 한 건 기록됩니다.
 */
@Entity
@Table(name = "pipeline_runs", indexes = {
    @Index(name = "idx_pipeline_runs_started_at", columnList = "started_at"),
    @Index(name = "idx_pipeline_runs_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, unique = true, length = 64)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 32)
    private RunTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "model", length = 128)
    private String model;

    /**
     * 실행 대상 소스 ID 목록 (쉼표 구분)
     */
    @Column(name = "source_ids", length = 1024)
    private String sourceIds;

    @Column(name = "total")
    private Integer total;

    @Column(name = "progress")
    private Integer progress;

    @Column(name = "urls_discovered")
    private Integer urlsDiscovered;

    @Column(name = "articles_stored")
    private Integer articlesStored;

    @Column(name = "articles_analyzed")
    private Integer articlesAnalyzed;

    @Column(name = "analysis_failures")
    private Integer analysisFailures;

    @Column(name = "extraction_failures")
    private Integer extractionFailures;

    @Column(name = "sources_skipped")
    private Integer sourcesSkipped;

    @Column(name = "entities_found")
    private Integer entitiesFound;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;
}
