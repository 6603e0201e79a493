package com.finsentiment.pipeline.analysis;

import com.finsentiment.pipeline.analysis.EntitySentimentParser.ParseResult;
import com.finsentiment.pipeline.client.LlmProvider;
import com.finsentiment.pipeline.client.LlmProviderRegistry;
import com.finsentiment.pipeline.client.StructuredCompletion;
import com.finsentiment.pipeline.client.StructuredRequest;
import com.finsentiment.pipeline.config.PipelineProperties;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.UsageOutcome;
import com.finsentiment.pipeline.entity.UsageRecord;
import com.finsentiment.pipeline.exception.AnalysisFailedException;
import com.finsentiment.pipeline.store.PipelineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * LLM 기반 엔티티 감성 분석.
 *
 * 호출마다 UsageRecord를 한 건씩 남기며, 실패 시 지수 백오프로 재시도합니다.
 * 1. provider 호출
 * 2. 응답 파싱/검증 (실패도 재시도 대상)
 * 3. 마지막 시도까지 실패하면 AnalysisFailedException
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SentimentAnalysisClient {

    private final LlmProviderRegistry providerRegistry;
    private final EntitySentimentParser parser;
    private final ModelPricing pricing;
    private final PipelineStore store;
    private final PipelineProperties properties;

    /**
     * Blocks until the analysis succeeds or every attempt has failed.
     *
     * @param articleId only used for usage accounting, may be null
     * @return entity sentiments without article id, possibly empty
     * @throws AnalysisFailedException  when all attempts failed
     * @throws IllegalArgumentException when the provider is unknown
     */
    public List<EntitySentiment> analyze(Long articleId, String text, String providerName, String model) {
        return analyzeAsync(articleId, text, providerName, model).block();
    }

    private Mono<List<EntitySentiment>> analyzeAsync(Long articleId, String text, String providerName, String model) {
        LlmProvider provider = providerRegistry.require(providerName);
        StructuredRequest request = new StructuredRequest(
                model,
                EntitySentimentSchema.SYSTEM_PROMPT,
                truncate(text),
                EntitySentimentSchema.NAME,
                EntitySentimentSchema.SCHEMA
        );
        return Mono.defer(() -> attemptAnalysis(provider, request, articleId, 0));
    }

    /**
     * 분석 시도 (재귀적)
     */
    private Mono<List<EntitySentiment>> attemptAnalysis(LlmProvider provider, StructuredRequest request,
                                                        Long articleId, int attempt) {
        int maxAttempts = Math.max(1, properties.getAnalysis().getMaxRetries());

        return provider.completeStructured(request)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Provider returned no completion")))
                .flatMap(completion -> {
                    ParseResult parsed = parser.parse(completion.content());
                    if (!parsed.isValid()) {
                        return Mono.error(new InvalidAnswerException(parsed.error(), completion));
                    }
                    recordUsage(provider, request.model(), articleId, attempt, completion, UsageOutcome.SUCCESS, null);
                    log.debug("Analysis succeeded (attempt {}/{}): {} entities", attempt + 1, maxAttempts, parsed.entities().size());
                    return Mono.just(parsed.entities());
                })
                .onErrorResume(e -> {
                    StructuredCompletion completion = e instanceof InvalidAnswerException invalid ? invalid.completion : null;
                    String reason = e.getMessage();
                    boolean lastAttempt = attempt + 1 >= maxAttempts;

                    recordUsage(provider, request.model(), articleId, attempt, completion,
                            lastAttempt ? UsageOutcome.FAILURE : UsageOutcome.RETRIED, reason);

                    if (lastAttempt) {
                        log.warn("Analysis failed after {} attempts (article {}): {}", maxAttempts, articleId, reason);
                        return Mono.error(new AnalysisFailedException(
                                "Analysis failed after " + maxAttempts + " attempts: " + reason, maxAttempts, e));
                    }

                    Duration delay = backoff(attempt);
                    log.warn("Analysis attempt {}/{} failed (article {}): {}. Retrying in {}ms",
                            attempt + 1, maxAttempts, articleId, reason, delay.toMillis());
                    return Mono.delay(delay)
                            .then(Mono.defer(() -> attemptAnalysis(provider, request, articleId, attempt + 1)));
                });
    }

    /**
     * initial * multiplier^attempt, capped at max
     */
    Duration backoff(int attempt) {
        PipelineProperties.Analysis analysis = properties.getAnalysis();
        double millis = analysis.getInitialBackoff().toMillis() * Math.pow(analysis.getBackoffMultiplier(), attempt);
        long capped = (long) Math.min(millis, analysis.getMaxBackoff().toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }

    private String truncate(String text) {
        int max = properties.getAnalysis().getMaxTextLength();
        if (text == null) {
            return "";
        }
        if (max > 0 && text.length() > max) {
            log.debug("Article text truncated from {} to {} characters", text.length(), max);
            return text.substring(0, max);
        }
        return text;
    }

    private void recordUsage(LlmProvider provider, String model, Long articleId, int attempt,
                             StructuredCompletion completion, UsageOutcome outcome, String errorMessage) {
        int inputTokens = completion != null ? completion.inputTokens() : 0;
        int outputTokens = completion != null ? completion.outputTokens() : 0;
        int totalTokens = completion != null ? completion.totalTokens() : 0;

        UsageRecord usageRecord = UsageRecord.builder()
                .articleId(articleId)
                .provider(provider.name())
                .model(model)
                .attempt(attempt + 1)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(totalTokens)
                .costUsd(pricing.cost(model, inputTokens, outputTokens))
                .outcome(outcome)
                .errorMessage(abbreviate(errorMessage))
                .build();
        try {
            store.appendUsage(usageRecord);
        } catch (RuntimeException e) {
            // 사용량 기록 실패는 분석 흐름을 막지 않음
            log.warn("Failed to record usage for {}/{} (article {}): {}", provider.name(), model, articleId, e.getMessage());
        }
    }

    private static String abbreviate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000) + "...";
    }

    /**
     * 파싱/검증 실패. 토큰 사용량 기록을 위해 completion을 함께 보관
     */
    private static final class InvalidAnswerException extends RuntimeException {
        private final transient StructuredCompletion completion;

        private InvalidAnswerException(String reason, StructuredCompletion completion) {
            super("Invalid model answer: " + reason);
            this.completion = completion;
        }
    }
}
