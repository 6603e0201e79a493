package com.finsentiment.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.config.LlmProvidersConfig.ProviderEntry;
import com.finsentiment.pipeline.exception.LlmCallException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI-compatible chat completions client for one configured provider.
 * Works with OpenAI, Groq, OpenRouter, Ollama and other endpoints exposing /chat/completions.
 */
@Slf4j
public class OpenAICompatibleProvider implements LlmProvider {

    private final String name;
    private final ProviderEntry settings;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenAICompatibleProvider(String name, ProviderEntry settings, ObjectMapper objectMapper) {
        this(name, settings, createWebClient(settings), objectMapper);
    }

    public OpenAICompatibleProvider(String name, ProviderEntry settings, WebClient webClient, ObjectMapper objectMapper) {
        this.name = name;
        this.settings = settings;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    private static WebClient createWebClient(ProviderEntry settings) {
        int timeoutSeconds = settings.getTimeoutSeconds();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 30000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                            .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                )
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", "FinSentiment-Pipeline/1.0")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        if (isBlank(settings.getBaseUrl())) {
            return false;
        }
        return !settings.isRequiresApiKey() || !isBlank(settings.getApiKey());
    }

    @Override
    public String defaultModel() {
        return settings.getDefaultModel();
    }

    @Override
    public Mono<StructuredCompletion> completeStructured(StructuredRequest request) {
        if (!isConfigured()) {
            return Mono.error(new LlmCallException(name, "Provider '" + name + "' is not configured"));
        }

        String baseUrl = settings.getBaseUrl();
        String url = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";

        Map<String, Object> body;
        try {
            body = buildBody(request);
        } catch (JsonProcessingException e) {
            return Mono.error(new LlmCallException(name, "Cannot serialize schema: " + e.getMessage(), e));
        }

        log.debug("Calling {} API: {} with model {} ({})", name, url, request.model(), settings.getStructuredOutput());

        WebClient.RequestBodySpec spec = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);

        if (!isBlank(settings.getApiKey())) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey());
        }

        return spec
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .onErrorMap(e -> !(e instanceof LlmCallException), this::toCallException)
                .flatMap(this::parseCompletion);
    }

    private Map<String, Object> buildBody(StructuredRequest request) throws JsonProcessingException {
        String systemPrompt = request.systemPrompt();
        Map<String, Object> responseFormat = new LinkedHashMap<>();

        if (settings.getStructuredOutput() == StructuredOutputMode.JSON_SCHEMA) {
            Map<String, Object> jsonSchema = new LinkedHashMap<>();
            jsonSchema.put("name", request.schemaName());
            jsonSchema.put("strict", true);
            jsonSchema.put("schema", request.schema());
            responseFormat.put("type", "json_schema");
            responseFormat.put("json_schema", jsonSchema);
        } else {
            // json mode는 스키마를 강제하지 않으므로 프롬프트에 포함
            systemPrompt = systemPrompt
                    + "\n\nRespond only with a JSON object that conforms to this JSON schema:\n"
                    + objectMapper.writeValueAsString(request.schema());
            responseFormat.put("type", "json_object");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("temperature", settings.getTemperature());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", request.userPrompt())
        ));
        body.put("response_format", responseFormat);
        return body;
    }

    private Mono<StructuredCompletion> parseCompletion(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            return Mono.error(new LlmCallException(name, "Response is not JSON: " + e.getOriginalMessage(), e));
        }

        JsonNode usage = root.path("usage");
        int inputTokens = usage.path("prompt_tokens").asInt(0);
        int outputTokens = usage.path("completion_tokens").asInt(0);
        int totalTokens = usage.path("total_tokens").asInt(inputTokens + outputTokens);

        JsonNode message = root.path("choices").path(0).path("message");
        JsonNode content = message.path("content");
        if (!content.isTextual()) {
            String refusal = message.path("refusal").asText("");
            String reason = refusal.isBlank() ? "Response has no message content" : "Model refused: " + refusal;
            // 토큰은 소비되었으므로 사용량은 빈 content와 함께 돌려준다
            return Mono.just(new StructuredCompletion("", inputTokens, outputTokens, totalTokens))
                    .doOnNext(c -> log.warn("{} returned no content: {}", name, reason));
        }

        return Mono.just(new StructuredCompletion(content.asText(), inputTokens, outputTokens, totalTokens));
    }

    private Throwable toCallException(Throwable e) {
        if (e instanceof WebClientResponseException wce) {
            String detail = wce.getResponseBodyAsString();
            if (detail.length() > 300) {
                detail = detail.substring(0, 300) + "...";
            }
            return new LlmCallException(name, name + " returned HTTP " + wce.getStatusCode().value() + ": " + detail, e);
        }
        return new LlmCallException(name, name + " call failed: " + e.getMessage(), e);
    }

    private static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }
}
