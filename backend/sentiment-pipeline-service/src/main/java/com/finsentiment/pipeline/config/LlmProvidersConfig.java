package com.finsentiment.pipeline.config;

import com.finsentiment.pipeline.client.StructuredOutputMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LLM provider endpoints, credentials and model pricing.
 *
 * Every entry under {@code pipeline.llm.providers} becomes a selectable provider;
 * OpenAI-compatible endpoints need configuration only.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline.llm")
@Data
public class LlmProvidersConfig {

    private Map<String, ProviderEntry> providers = new LinkedHashMap<>();

    /**
     * USD price per million tokens, keyed by model name
     */
    private Map<String, ModelPrice> pricing = new LinkedHashMap<>();

    @Data
    public static class ProviderEntry {
        private String baseUrl;

        /**
         * Opaque credential. Only its presence is checked.
         */
        private String apiKey;

        private String defaultModel;

        private StructuredOutputMode structuredOutput = StructuredOutputMode.JSON_SCHEMA;

        private int timeoutSeconds = 120;

        private double temperature = 0.0;

        /**
         * Local endpoints (e.g. Ollama) do not need a key
         */
        private boolean requiresApiKey = true;
    }

    @Data
    public static class ModelPrice {
        private double inputPerMillion;
        private double outputPerMillion;
    }
}
