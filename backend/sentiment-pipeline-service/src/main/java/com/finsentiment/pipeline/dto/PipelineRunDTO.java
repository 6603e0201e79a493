package com.finsentiment.pipeline.dto;

import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.RunStatus;
import com.finsentiment.pipeline.entity.RunTrigger;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

public record PipelineRunDTO(
        String runId,
        RunTrigger trigger,
        RunStatus status,
        String provider,
        String model,
        List<String> sourceIds,
        Integer total,
        Integer progress,
        Integer urlsDiscovered,
        Integer articlesStored,
        Integer articlesAnalyzed,
        Integer analysisFailures,
        Integer extractionFailures,
        Integer sourcesSkipped,
        Integer entitiesFound,
        String errorMessage,
        LocalDateTime startedAt,
        LocalDateTime finishedAt
) {

    public static PipelineRunDTO from(PipelineRunRecord record) {
        List<String> sourceIds = record.getSourceIds() == null || record.getSourceIds().isBlank()
                ? List.of()
                : Arrays.asList(record.getSourceIds().split(","));
        return new PipelineRunDTO(
                record.getRunId(),
                record.getTrigger(),
                record.getStatus(),
                record.getProvider(),
                record.getModel(),
                sourceIds,
                record.getTotal(),
                record.getProgress(),
                record.getUrlsDiscovered(),
                record.getArticlesStored(),
                record.getArticlesAnalyzed(),
                record.getAnalysisFailures(),
                record.getExtractionFailures(),
                record.getSourcesSkipped(),
                record.getEntitiesFound(),
                record.getErrorMessage(),
                record.getStartedAt(),
                record.getFinishedAt()
        );
    }
}
