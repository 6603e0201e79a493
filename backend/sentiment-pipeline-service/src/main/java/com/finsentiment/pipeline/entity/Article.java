package com.finsentiment.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "articles", indexes = {
    @Index(name = "idx_articles_source_id", columnList = "source_id"),
    @Index(name = "idx_articles_analysis_status", columnList = "analysis_status"),
    @Index(name = "idx_articles_scraped_at", columnList = "scraped_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 정규화된 기사 URL (중복 판정 키)
     */
    @Column(name = "url", nullable = false, unique = true, length = 2048)
    private String url;

    @Column(name = "source_id", nullable = false, length = 128)
    private String sourceId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "author", length = 512)
    private String author;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    /**
     * 소스가 보고한 게시 시각 (없을 수 있음)
     */
    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @CreationTimestamp
    @Column(name = "scraped_at", nullable = false, updatable = false)
    private LocalDateTime scrapedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_status", nullable = false, length = 16)
    @Builder.Default
    private AnalysisStatus analysisStatus = AnalysisStatus.PENDING;

    @Column(name = "analyzed_at")
    private LocalDateTime analyzedAt;

    public void markAnalyzed() {
        this.analysisStatus = AnalysisStatus.ANALYZED;
        this.analyzedAt = LocalDateTime.now();
    }

    public void markAnalysisFailed() {
        this.analysisStatus = AnalysisStatus.FAILED;
        this.analyzedAt = LocalDateTime.now();
    }
}
