package com.finsentiment.pipeline.pipeline;

import com.finsentiment.pipeline.analysis.SentimentAnalysisClient;
import com.finsentiment.pipeline.client.LlmProvider;
import com.finsentiment.pipeline.client.LlmProviderRegistry;
import com.finsentiment.pipeline.config.PipelineProperties;
import com.finsentiment.pipeline.entity.Article;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.RunStatus;
import com.finsentiment.pipeline.exception.AlreadyRunningException;
import com.finsentiment.pipeline.exception.AnalysisFailedException;
import com.finsentiment.pipeline.exception.ExtractionFailedException;
import com.finsentiment.pipeline.exception.InfrastructureFailureException;
import com.finsentiment.pipeline.exception.SourceUnavailableException;
import com.finsentiment.pipeline.source.ScrapedArticle;
import com.finsentiment.pipeline.source.SourceRegistry;
import com.finsentiment.pipeline.store.PipelineStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 뉴스 수집 + 감성 분석 파이프라인 실행 엔진.
 *
 * 한 번에 하나의 실행만 허용하며 (RunState CAS), 실행 루프는 전용 단일 스레드
 * 실행자에서 돌아갑니다. 중지 요청은 기사 처리 사이에서만 확인합니다.
 *
 * Idle → Running → Completed | Stopped | Failed, 종료 상태에서 다음 start 시 다시 Running.
 */
@Service
@Slf4j
public class PipelineEngine {

    private final SourceRegistry sourceRegistry;
    private final SentimentAnalysisClient analysisClient;
    private final LlmProviderRegistry providerRegistry;
    private final PipelineStore store;
    private final RunState runState;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Executor pipelineExecutor;

    public PipelineEngine(SourceRegistry sourceRegistry,
                          SentimentAnalysisClient analysisClient,
                          LlmProviderRegistry providerRegistry,
                          PipelineStore store,
                          RunState runState,
                          PipelineProperties properties,
                          MeterRegistry meterRegistry,
                          @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.sourceRegistry = sourceRegistry;
        this.analysisClient = analysisClient;
        this.providerRegistry = providerRegistry;
        this.store = store;
        this.runState = runState;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Starts a run in the background and returns its initial snapshot.
     *
     * @throws AlreadyRunningException  when a run is in progress; nothing is started
     * @throws IllegalArgumentException when the provider is unknown or unconfigured, or no requested source exists
     */
    public RunSnapshot start(StartCommand command) {
        String providerName = isBlank(command.provider())
                ? properties.getAnalysis().getDefaultProvider()
                : command.provider().trim();
        LlmProvider provider = providerRegistry.require(providerName);
        if (!provider.isConfigured()) {
            throw new IllegalArgumentException("LLM provider '" + providerName + "' is not configured (missing API key or base URL)");
        }
        String model = resolveModel(command.model(), provider);
        List<String> sourceIds = resolveSources(command.sourceIds());

        RunSnapshot running = RunSnapshot.builder()
                .runId(UUID.randomUUID().toString())
                .running(true)
                .status(RunStatus.RUNNING)
                .statusMessage("Starting...")
                .provider(providerName)
                .model(model)
                .sourceIds(sourceIds)
                .trigger(command.trigger())
                .startedAt(LocalDateTime.now())
                .build();

        if (!runState.tryBegin(running)) {
            throw new AlreadyRunningException(runState.snapshot().runId());
        }
        log.info("[Pipeline] Run {} started ({}): provider={}, model={}, sources={}",
                running.runId(), command.trigger(), providerName, model, sourceIds);

        try {
            pipelineExecutor.execute(() -> run(running.runId(), providerName, model, sourceIds));
        } catch (RejectedExecutionException e) {
            log.error("[Pipeline] Run {} could not be scheduled: {}", running.runId(), e.getMessage(), e);
            finish(RunStatus.FAILED, "Failed", "Run could not be scheduled: " + e.getMessage());
            throw new InfrastructureFailureException("Pipeline executor rejected the run", e);
        }
        return running;
    }

    /**
     * Requests cooperative cancellation. The run stops before its next article.
     *
     * @return false when nothing is running
     */
    public boolean stop() {
        boolean requested = runState.requestCancel();
        if (requested) {
            log.info("[Pipeline] Stop requested for run {}", runState.snapshot().runId());
        }
        return requested;
    }

    public RunSnapshot status() {
        return runState.snapshot();
    }

    private String resolveModel(String requested, LlmProvider provider) {
        if (!isBlank(requested)) {
            return requested.trim();
        }
        String configured = properties.getAnalysis().getDefaultModel();
        if (provider.name().equals(properties.getAnalysis().getDefaultProvider()) && !isBlank(configured)) {
            return configured;
        }
        if (isBlank(provider.defaultModel())) {
            throw new IllegalArgumentException("No model given and provider '" + provider.name() + "' has no default model");
        }
        return provider.defaultModel();
    }

    private List<String> resolveSources(List<String> requested) {
        if (requested.isEmpty()) {
            List<String> all = new ArrayList<>(sourceRegistry.listSources());
            if (all.isEmpty()) {
                throw new IllegalArgumentException("No news sources are registered");
            }
            return all;
        }

        List<String> known = new ArrayList<>();
        for (String sourceId : requested) {
            if (sourceRegistry.contains(sourceId)) {
                if (!known.contains(sourceId)) {
                    known.add(sourceId);
                }
            } else {
                log.warn("[Pipeline] Unknown source '{}' ignored", sourceId);
            }
        }
        if (known.isEmpty()) {
            throw new IllegalArgumentException("None of the requested sources exist: " + requested
                    + ". Available: " + sourceRegistry.listSources());
        }
        return known;
    }

    // ---- run loop (pipelineExecutor thread) ----

    private void run(String runId, String provider, String model, List<String> sourceIds) {
        try {
            List<PendingArticle> pending = discover(sourceIds);
            runState.update(s -> s.toBuilder()
                    .total(pending.size())
                    .statusMessage("Processing " + pending.size() + " new articles")
                    .build());
            log.info("[Pipeline] Run {}: {} new articles to process", runId, pending.size());

            for (PendingArticle article : pending) {
                if (runState.snapshot().cancelRequested()) {
                    log.info("[Pipeline] Run {} stopped by request", runId);
                    finish(RunStatus.STOPPED, "Stopped by request", null);
                    return;
                }
                process(article, provider, model);
            }

            finish(RunStatus.COMPLETED, "Completed", null);
        } catch (RuntimeException e) {
            log.error("[Pipeline] Run {} failed: {}", runId, e.getMessage(), e);
            finish(RunStatus.FAILED, "Failed", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (Error e) {
            // 실행 상태는 반드시 종료로 전환한 뒤 전파
            log.error("[Pipeline] Run {} aborted by fatal error: {}", runId, e.toString(), e);
            finish(RunStatus.FAILED, "Failed", "Fatal error: " + e);
            throw e;
        }
    }

    /**
     * 소스별 URL 수집 후 저장소/실행 내 중복 제거. total은 모든 수집이 끝난 뒤 확정
     */
    private List<PendingArticle> discover(List<String> sourceIds) {
        Map<String, PendingArticle> novel = new LinkedHashMap<>();

        for (String sourceId : sourceIds) {
            runState.update(s -> s.toBuilder()
                    .statusMessage("Discovering articles")
                    .currentTask("Discovering " + sourceId)
                    .build());
            List<String> urls;
            try {
                urls = sourceRegistry.discoverUrls(sourceId);
            } catch (SourceUnavailableException e) {
                log.warn("[Pipeline] Source {} skipped: {}", sourceId, e.getMessage());
                runState.update(s -> s.toBuilder().sourcesSkipped(s.sourcesSkipped() + 1).build());
                continue;
            }

            runState.update(s -> s.toBuilder().urlsDiscovered(s.urlsDiscovered() + urls.size()).build());
            int fresh = 0;
            for (String url : urls) {
                if (novel.containsKey(url) || store.existsUrl(url)) {
                    continue;
                }
                novel.put(url, new PendingArticle(sourceId, url));
                fresh++;
            }
            log.info("[Pipeline] Source {}: {} urls discovered, {} new", sourceId, urls.size(), fresh);
        }
        return new ArrayList<>(novel.values());
    }

    private void process(PendingArticle pending, String provider, String model) {
        runState.update(s -> s.toBuilder().currentTask("Fetching " + pending.url()).build());

        ScrapedArticle scraped;
        try {
            scraped = sourceRegistry.fetchArticle(pending.sourceId(), pending.url());
        } catch (ExtractionFailedException e) {
            log.warn("[Pipeline] Extraction failed for {}: {}", pending.url(), e.getMessage());
            countArticle("extraction_failed");
            runState.update(s -> s.toBuilder()
                    .extractionFailures(s.extractionFailures() + 1)
                    .progress(s.progress() + 1)
                    .build());
            return;
        }

        Long articleId = store.saveArticle(Article.builder()
                .url(pending.url())
                .sourceId(pending.sourceId())
                .title(scraped.title())
                .author(scraped.author())
                .body(scraped.body())
                .publishedAt(scraped.publishedAt())
                .build());
        String label = scraped.title() != null ? scraped.title() : pending.url();
        runState.update(s -> s.toBuilder()
                .articlesStored(s.articlesStored() + 1)
                .currentTask("Analyzing: " + label)
                .build());

        try {
            List<EntitySentiment> sentiments = analysisClient.analyze(articleId, analysisText(scraped), provider, model);
            store.saveEntitySentiments(articleId, sentiments);
            countArticle("analyzed");
            runState.update(s -> s.toBuilder()
                    .articlesAnalyzed(s.articlesAnalyzed() + 1)
                    .entitiesFound(s.entitiesFound() + sentiments.size())
                    .progress(s.progress() + 1)
                    .build());
            log.info("[Pipeline] ({}/{}) {}: {} entities", runState.snapshot().progress(), runState.snapshot().total(),
                    pending.url(), sentiments.size());
        } catch (AnalysisFailedException e) {
            log.warn("[Pipeline] Analysis failed for {} after {} attempts: {}", pending.url(), e.getAttempts(), e.getMessage());
            store.markAnalysisFailed(articleId);
            countArticle("analysis_failed");
            runState.update(s -> s.toBuilder()
                    .analysisFailures(s.analysisFailures() + 1)
                    .progress(s.progress() + 1)
                    .build());
        }
    }

    private static String analysisText(ScrapedArticle article) {
        if (isBlank(article.title())) {
            return article.body();
        }
        return article.title() + "\n\n" + article.body();
    }

    private void finish(RunStatus status, String message, String error) {
        RunSnapshot finished = runState.update(s -> s.toBuilder()
                .running(false)
                .status(status)
                .statusMessage(message)
                .currentTask(null)
                .error(error)
                .finishedAt(LocalDateTime.now())
                .build());

        log.info("[Pipeline] Run {} {}: total={}, progress={}, stored={}, analyzed={}, analysisFailures={}, "
                        + "extractionFailures={}, sourcesSkipped={}, entities={}",
                finished.runId(), status, finished.total(), finished.progress(), finished.articlesStored(),
                finished.articlesAnalyzed(), finished.analysisFailures(), finished.extractionFailures(),
                finished.sourcesSkipped(), finished.entitiesFound());

        meterRegistry.counter("pipeline.runs", "status", status.name().toLowerCase()).increment();
        saveRunRecord(finished);
    }

    private void saveRunRecord(RunSnapshot snapshot) {
        try {
            store.saveRun(PipelineRunRecord.builder()
                    .runId(snapshot.runId())
                    .trigger(snapshot.trigger())
                    .status(snapshot.status())
                    .provider(snapshot.provider())
                    .model(snapshot.model())
                    .sourceIds(String.join(",", snapshot.sourceIds()))
                    .total(snapshot.total())
                    .progress(snapshot.progress())
                    .urlsDiscovered(snapshot.urlsDiscovered())
                    .articlesStored(snapshot.articlesStored())
                    .articlesAnalyzed(snapshot.articlesAnalyzed())
                    .analysisFailures(snapshot.analysisFailures())
                    .extractionFailures(snapshot.extractionFailures())
                    .sourcesSkipped(snapshot.sourcesSkipped())
                    .entitiesFound(snapshot.entitiesFound())
                    .errorMessage(truncate(snapshot.error()))
                    .startedAt(snapshot.startedAt())
                    .finishedAt(snapshot.finishedAt())
                    .build());
        } catch (RuntimeException e) {
            log.error("[Pipeline] Failed to record run {}: {}", snapshot.runId(), e.getMessage(), e);
        }
    }

    private void countArticle(String outcome) {
        meterRegistry.counter("pipeline.articles", "outcome", outcome).increment();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000) + "...";
    }

    private static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }

    private record PendingArticle(String sourceId, String url) {
    }
}
