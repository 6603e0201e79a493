package com.finsentiment.pipeline.dto;

import com.finsentiment.pipeline.entity.UsageOutcome;
import com.finsentiment.pipeline.entity.UsageRecord;

import java.time.LocalDateTime;

public record UsageRecordDTO(
        Long id,
        Long articleId,
        String provider,
        String model,
        Integer attempt,
        Integer inputTokens,
        Integer outputTokens,
        Integer totalTokens,
        Double costUsd,
        UsageOutcome outcome,
        String errorMessage,
        LocalDateTime createdAt
) {

    public static UsageRecordDTO from(UsageRecord record) {
        return new UsageRecordDTO(
                record.getId(),
                record.getArticleId(),
                record.getProvider(),
                record.getModel(),
                record.getAttempt(),
                record.getInputTokens(),
                record.getOutputTokens(),
                record.getTotalTokens(),
                record.getCostUsd(),
                record.getOutcome(),
                record.getErrorMessage(),
                record.getCreatedAt()
        );
    }
}
