package com.finsentiment.pipeline.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt and JSON schema for per-entity dual sentiment extraction.
 */
public final class EntitySentimentSchema {

    public static final String NAME = "text_analysis";

    public static final String SYSTEM_PROMPT = """
            You are a highly precise financial analyst. Extract only legitimate companies and \
            cryptocurrencies from the provided text and analyze each of them from two perspectives: \
            financial sentiment and overall sentiment.

            Rules:
            1. Return the full, official name of each entity, resolved from abbreviations \
            (e.g. "IBM" becomes "International Business Machines").
            2. Do not extract locations such as countries or cities.
            3. If there are no valid entities, return an empty "entities" list.
            4. Financial sentiment is strictly about quantitative performance: stock prices, earnings, market data.
            5. Overall sentiment is about qualitative, operational news: decisions, products, partnerships, legal issues.
            6. Every entity object must contain entity_name, entity_type ("company" or "crypto"), \
            financial_sentiment and overall_sentiment ("positive", "negative" or "neutral") and a brief reasoning.
            """;

    public static final Map<String, Object> SCHEMA = buildSchema();

    private EntitySentimentSchema() {
    }

    private static Map<String, Object> buildSchema() {
        List<String> sentiments = List.of("positive", "negative", "neutral");

        Map<String, Object> entityProperties = new LinkedHashMap<>();
        entityProperties.put("entity_name", Map.of("type", "string",
                "description", "Full, official name of the company or cryptocurrency"));
        entityProperties.put("entity_type", Map.of("type", "string", "enum", List.of("company", "crypto")));
        entityProperties.put("financial_sentiment", Map.of("type", "string", "enum", sentiments,
                "description", "Sentiment based only on financial performance"));
        entityProperties.put("overall_sentiment", Map.of("type", "string", "enum", sentiments,
                "description", "Sentiment based on general, non-financial news"));
        entityProperties.put("reasoning", Map.of("type", "string",
                "description", "Brief justification for both classifications"));

        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("type", "object");
        entity.put("properties", entityProperties);
        entity.put("required", List.copyOf(entityProperties.keySet()));
        entity.put("additionalProperties", false);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "object");
        root.put("properties", Map.of("entities", Map.of("type", "array", "items", entity)));
        root.put("required", List.of("entities"));
        root.put("additionalProperties", false);
        return Collections.unmodifiableMap(root);
    }
}
