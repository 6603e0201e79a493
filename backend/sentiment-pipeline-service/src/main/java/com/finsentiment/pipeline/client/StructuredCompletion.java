package com.finsentiment.pipeline.client;

/**
 * Raw model output with the token usage the provider reported (0 when absent).
 */
public record StructuredCompletion(
        String content,
        int inputTokens,
        int outputTokens,
        int totalTokens
) {
}
