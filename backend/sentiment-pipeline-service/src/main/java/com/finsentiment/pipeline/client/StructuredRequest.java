package com.finsentiment.pipeline.client;

import java.util.Map;

/**
 * @param schemaName name reported to the provider with the schema
 * @param schema     JSON schema of the expected document
 */
public record StructuredRequest(
        String model,
        String systemPrompt,
        String userPrompt,
        String schemaName,
        Map<String, Object> schema
) {
}
