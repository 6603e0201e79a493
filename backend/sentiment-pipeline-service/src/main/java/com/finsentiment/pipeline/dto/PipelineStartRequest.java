package com.finsentiment.pipeline.dto;

import java.util.List;

/**
 * All fields optional: missing provider/model fall back to configuration, missing sources mean all.
 */
public record PipelineStartRequest(
        String provider,
        String model,
        List<String> sources
) {
    public PipelineStartRequest {
        sources = sources == null ? List.of() : sources;
    }
}
