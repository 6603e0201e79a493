package com.finsentiment.pipeline.client;

import reactor.core.publisher.Mono;

/**
 * A chat model endpoint that can return a JSON document matching a schema.
 *
 * New provider types are added by implementing this interface and registering
 * the implementation as a Spring bean.
 */
public interface LlmProvider {

    /**
     * Name used to select the provider, e.g. "openai"
     */
    String name();

    /**
     * Whether the provider has what it needs to be called (credentials, endpoint)
     */
    boolean isConfigured();

    String defaultModel();

    Mono<StructuredCompletion> completeStructured(StructuredRequest request);
}
