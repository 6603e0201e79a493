package com.finsentiment.pipeline.client;

/**
 * How a provider is asked for JSON output.
 */
public enum StructuredOutputMode {
    /**
     * response_format = json_schema (strict). OpenAI.
     */
    JSON_SCHEMA,

    /**
     * response_format = json_object, schema described in the system prompt. Groq, Ollama.
     */
    JSON_OBJECT
}
