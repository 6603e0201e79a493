package com.finsentiment.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 기사 내 엔티티별 감성 분석 결과.
 *
 * 재무 감성(주가, 실적 등 정량 지표)과 전반 감성(제품, 제휴, 법적 이슈 등)을 분리해 저장.
 */
@Entity
@Table(name = "entity_sentiments", indexes = {
    @Index(name = "idx_entity_sentiments_article_id", columnList = "article_id"),
    @Index(name = "idx_entity_sentiments_entity_name", columnList = "entity_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntitySentiment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "article_id", nullable = false)
    private Long articleId;

    @Column(name = "entity_name", nullable = false, length = 512)
    private String entityName;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 16)
    private EntityType entityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "financial_sentiment", nullable = false, length = 16)
    private SentimentLabel financialSentiment;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_sentiment", nullable = false, length = 16)
    private SentimentLabel overallSentiment;

    @Column(name = "reasoning", columnDefinition = "TEXT")
    private String reasoning;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
