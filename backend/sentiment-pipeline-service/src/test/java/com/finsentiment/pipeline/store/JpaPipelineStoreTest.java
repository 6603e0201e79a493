package com.finsentiment.pipeline.store;

import com.finsentiment.pipeline.dto.UsageSummaryDTO;
import com.finsentiment.pipeline.entity.AnalysisStatus;
import com.finsentiment.pipeline.entity.Article;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.EntityType;
import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.RunStatus;
import com.finsentiment.pipeline.entity.RunTrigger;
import com.finsentiment.pipeline.entity.SentimentLabel;
import com.finsentiment.pipeline.entity.UsageOutcome;
import com.finsentiment.pipeline.entity.UsageRecord;
import com.finsentiment.pipeline.exception.InfrastructureFailureException;
import com.finsentiment.pipeline.repository.ArticleRepository;
import com.finsentiment.pipeline.repository.EntitySentimentRepository;
import com.finsentiment.pipeline.repository.PipelineRunRecordRepository;
import com.finsentiment.pipeline.repository.UsageRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * JpaPipelineStore 통합 테스트 (H2)
 */
@DataJpaTest
@Import(JpaPipelineStore.class)
@ActiveProfiles("test")
class JpaPipelineStoreTest {

    @Autowired
    private JpaPipelineStore store;

    @Autowired
    private ArticleRepository articleRepository;

    @Autowired
    private EntitySentimentRepository entitySentimentRepository;

    @Autowired
    private UsageRecordRepository usageRecordRepository;

    @Autowired
    private PipelineRunRecordRepository runRecordRepository;

    private static Article article(String url) {
        return Article.builder()
                .url(url)
                .sourceId("zawya.com")
                .title("Banks report record profits")
                .author("Staff")
                .body("UAE banks reported record profits this quarter.")
                .publishedAt(LocalDateTime.of(2024, 3, 5, 6, 15))
                .build();
    }

    private static EntitySentiment sentiment(String name) {
        return EntitySentiment.builder()
                .entityName(name)
                .entityType(EntityType.COMPANY)
                .financialSentiment(SentimentLabel.POSITIVE)
                .overallSentiment(SentimentLabel.NEUTRAL)
                .reasoning("Profit growth")
                .build();
    }

    private static UsageRecord usage(String provider, String model, int tokens, double cost, UsageOutcome outcome) {
        return UsageRecord.builder()
                .provider(provider)
                .model(model)
                .attempt(1)
                .totalTokens(tokens)
                .costUsd(cost)
                .outcome(outcome)
                .build();
    }

    @Test
    @DisplayName("기사 저장 후 URL 존재 확인, 초기 상태 PENDING")
    void saveArticleAndCheckUrl() {
        // when
        Long id = store.saveArticle(article("https://www.zawya.com/en/business/banks-1"));

        // then
        assertThat(id).isNotNull();
        assertThat(store.existsUrl("https://www.zawya.com/en/business/banks-1")).isTrue();
        assertThat(store.existsUrl("https://www.zawya.com/en/business/other")).isFalse();
        Article saved = articleRepository.findById(id).orElseThrow();
        assertThat(saved.getAnalysisStatus()).isEqualTo(AnalysisStatus.PENDING);
        assertThat(saved.getScrapedAt()).isNotNull();
    }

    @Test
    @DisplayName("감성 결과 저장 시 기사 상태가 ANALYZED로 변경")
    void saveSentimentsMarksAnalyzed() {
        // given
        Long id = store.saveArticle(article("https://z/2"));

        // when
        store.saveEntitySentiments(id, List.of(sentiment("Emirates NBD"), sentiment("First Abu Dhabi Bank")));

        // then
        assertThat(entitySentimentRepository.findAll())
                .extracting(EntitySentiment::getEntityName)
                .containsExactlyInAnyOrder("Emirates NBD", "First Abu Dhabi Bank");
        Article saved = articleRepository.findById(id).orElseThrow();
        assertThat(saved.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZED);
        assertThat(saved.getAnalyzedAt()).isNotNull();
    }

    @Test
    @DisplayName("분석 실패 표시는 감성 행 없이 FAILED")
    void markAnalysisFailed() {
        Long id = store.saveArticle(article("https://z/3"));

        store.markAnalysisFailed(id);

        assertThat(articleRepository.findById(id).orElseThrow().getAnalysisStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(entitySentimentRepository.findAll())
                .noneMatch(sentiment -> id.equals(sentiment.getArticleId()));
    }

    @Test
    @DisplayName("중복 URL 저장은 InfrastructureFailure")
    void duplicateUrlIsInfrastructureFailure() {
        store.saveArticle(article("https://z/dup"));

        assertThatThrownBy(() -> store.saveArticle(article("https://z/dup")))
                .isInstanceOf(InfrastructureFailureException.class);
    }

    @Test
    @DisplayName("기사별 사용량 기록은 시도 순서대로 조회")
    void appendsUsagePerArticle() {
        // given
        Long id = store.saveArticle(article("https://z/usage"));
        UsageRecord retried = UsageRecord.builder()
                .articleId(id).provider("openai").model("gpt-4o-mini").attempt(1)
                .totalTokens(400).costUsd(0.0001).outcome(UsageOutcome.RETRIED)
                .errorMessage("Invalid model answer: missing 'entities' array")
                .build();
        UsageRecord success = UsageRecord.builder()
                .articleId(id).provider("openai").model("gpt-4o-mini").attempt(2)
                .totalTokens(600).costUsd(0.0002).outcome(UsageOutcome.SUCCESS)
                .build();

        // when
        store.appendUsage(success);
        store.appendUsage(retried);

        // then
        List<UsageRecord> records = usageRecordRepository.findAll().stream()
                .filter(row -> id.equals(row.getArticleId()))
                .sorted(Comparator.comparing(UsageRecord::getAttempt))
                .toList();
        assertThat(records).extracting(UsageRecord::getOutcome)
                .containsExactly(UsageOutcome.RETRIED, UsageOutcome.SUCCESS);
        assertThat(records.get(0).getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("사용량 기록 provider/model 별 합계")
    void summarizesUsage() {
        // given
        store.appendUsage(usage("openai", "gpt-4o-mini", 1000, 0.0004, UsageOutcome.SUCCESS));
        store.appendUsage(usage("openai", "gpt-4o-mini", 500, 0.0002, UsageOutcome.RETRIED));
        store.appendUsage(usage("groq", "llama3-8b-8192", 700, 0.0, UsageOutcome.SUCCESS));

        // when
        List<UsageSummaryDTO> summary = usageRecordRepository.summarizeByProviderAndModel();

        // then
        assertThat(summary).hasSize(2);
        UsageSummaryDTO openai = summary.stream().filter(s -> s.provider().equals("openai")).findFirst().orElseThrow();
        assertThat(openai.totalCalls()).isEqualTo(2L);
        assertThat(openai.totalTokens()).isEqualTo(1500L);
        assertThat(openai.totalCostUsd()).isCloseTo(0.0006, within(1e-9));
    }

    @Test
    @DisplayName("실행 기록 저장 후 마지막 실행 조회")
    void saveRunAndFindLatest() {
        // given
        LocalDateTime now = LocalDateTime.now();
        store.saveRun(run("run-old", now.minusDays(1), RunStatus.FAILED));
        store.saveRun(run("run-new", now, RunStatus.COMPLETED));

        // when
        PipelineRunRecord latest = runRecordRepository.findFirstByOrderByStartedAtDesc().orElseThrow();

        // then
        assertThat(latest.getRunId()).isEqualTo("run-new");
        assertThat(latest.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(latest.getTrigger()).isEqualTo(RunTrigger.MANUAL);
        assertThat(runRecordRepository.findAll())
                .filteredOn(run -> run.getRunId().equals("run-old"))
                .singleElement()
                .satisfies(run -> assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED));
    }

    private static PipelineRunRecord run(String runId, LocalDateTime startedAt, RunStatus status) {
        return PipelineRunRecord.builder()
                .runId(runId)
                .trigger(RunTrigger.MANUAL)
                .status(status)
                .provider("openai")
                .model("gpt-4o-mini")
                .sourceIds("zawya.com")
                .total(2)
                .progress(2)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusMinutes(3))
                .build();
    }
}
