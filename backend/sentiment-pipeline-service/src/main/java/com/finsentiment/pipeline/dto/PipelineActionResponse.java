package com.finsentiment.pipeline.dto;

import com.finsentiment.pipeline.pipeline.RunSnapshot;

public record PipelineActionResponse(
        boolean success,
        String message,
        RunSnapshot run
) {
}
