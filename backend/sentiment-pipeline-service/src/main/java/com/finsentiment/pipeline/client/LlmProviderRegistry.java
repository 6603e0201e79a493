package com.finsentiment.pipeline.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.config.LlmProvidersConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selectable LLM providers by name.
 *
 * Built once at startup from {@code pipeline.llm.providers} entries and any
 * {@link LlmProvider} beans. A bean with the same name as a configured entry replaces it.
 */
@Component
@Slf4j
public class LlmProviderRegistry {

    private final Map<String, LlmProvider> providers;

    @Autowired
    public LlmProviderRegistry(LlmProvidersConfig config,
                               ObjectMapper objectMapper,
                               ObjectProvider<LlmProvider> providerBeans) {
        Map<String, LlmProvider> table = new LinkedHashMap<>();
        config.getProviders().forEach((name, entry) ->
                table.put(name, new OpenAICompatibleProvider(name, entry, objectMapper)));
        providerBeans.orderedStream().forEach(provider -> table.put(provider.name(), provider));
        this.providers = Collections.unmodifiableMap(table);

        log.info("LLM providers registered: {}", providers.values().stream()
                .map(p -> p.name() + (p.isConfigured() ? "" : " (not configured)"))
                .collect(Collectors.joining(", ")));
    }

    public LlmProviderRegistry(List<LlmProvider> providers) {
        Map<String, LlmProvider> table = new LinkedHashMap<>();
        providers.forEach(provider -> table.put(provider.name(), provider));
        this.providers = Collections.unmodifiableMap(table);
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * @throws IllegalArgumentException when no provider has this name
     */
    public LlmProvider require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown LLM provider '" + name + "'. Available: " + providers.keySet()));
    }
}
