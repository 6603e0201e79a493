package com.finsentiment.pipeline.pipeline;

import com.finsentiment.pipeline.entity.RunStatus;
import com.finsentiment.pipeline.entity.RunTrigger;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable view of the current (or last) pipeline run.
 */
@Builder(toBuilder = true)
public record RunSnapshot(
        String runId,
        boolean running,
        RunStatus status,
        String statusMessage,
        int progress,
        int total,
        String currentTask,
        String provider,
        String model,
        List<String> sourceIds,
        RunTrigger trigger,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        String error,
        boolean cancelRequested,
        int urlsDiscovered,
        int articlesStored,
        int articlesAnalyzed,
        int analysisFailures,
        int extractionFailures,
        int sourcesSkipped,
        int entitiesFound
) {

    public RunSnapshot {
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
    }

    public static RunSnapshot idle() {
        return RunSnapshot.builder()
                .status(RunStatus.IDLE)
                .statusMessage("Idle")
                .build();
    }
}
