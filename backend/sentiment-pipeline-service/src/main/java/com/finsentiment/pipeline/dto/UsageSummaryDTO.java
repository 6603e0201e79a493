package com.finsentiment.pipeline.dto;

public record UsageSummaryDTO(
        String provider,
        String model,
        Long totalCalls,
        Long totalTokens,
        Double totalCostUsd
) {}
