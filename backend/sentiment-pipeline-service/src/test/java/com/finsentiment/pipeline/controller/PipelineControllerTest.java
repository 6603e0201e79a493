package com.finsentiment.pipeline.controller;

import com.finsentiment.pipeline.dto.UsageSummaryDTO;
import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.RunStatus;
import com.finsentiment.pipeline.entity.RunTrigger;
import com.finsentiment.pipeline.exception.AlreadyRunningException;
import com.finsentiment.pipeline.pipeline.PipelineEngine;
import com.finsentiment.pipeline.pipeline.RunSnapshot;
import com.finsentiment.pipeline.pipeline.StartCommand;
import com.finsentiment.pipeline.repository.PipelineRunRecordRepository;
import com.finsentiment.pipeline.repository.UsageRecordRepository;
import com.finsentiment.pipeline.scheduler.ScheduleConfig;
import com.finsentiment.pipeline.scheduler.ScheduleService;
import com.finsentiment.pipeline.source.SourceRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PipelineController 단위 테스트
 */
@WebFluxTest(PipelineController.class)
@ActiveProfiles("test")
class PipelineControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private PipelineEngine pipelineEngine;

    @MockBean
    private SourceRegistry sourceRegistry;

    @MockBean
    private ScheduleService scheduleService;

    @MockBean
    private PipelineRunRecordRepository runRecordRepository;

    @MockBean
    private UsageRecordRepository usageRecordRepository;

    private static RunSnapshot running(String runId) {
        return RunSnapshot.builder()
                .runId(runId)
                .running(true)
                .status(RunStatus.RUNNING)
                .statusMessage("Starting...")
                .provider("openai")
                .model("gpt-4o-mini")
                .trigger(RunTrigger.MANUAL)
                .startedAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("GET /api/v1/pipeline/sources - 정렬된 소스 목록")
    void listSources() {
        when(sourceRegistry.listSources()).thenReturn(new TreeSet<>(List.of("zawya.com", "gulfnews.com")));

        webTestClient.get()
                .uri("/api/v1/pipeline/sources")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0]").isEqualTo("gulfnews.com")
                .jsonPath("$[1]").isEqualTo("zawya.com");
    }

    @Test
    @DisplayName("POST /api/v1/pipeline/start - 시작 요청은 202")
    void startAccepted() {
        // given
        when(pipelineEngine.start(any(StartCommand.class))).thenReturn(running("run-1"));

        // when & then
        webTestClient.post()
                .uri("/api/v1/pipeline/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"provider\":\"openai\",\"sources\":[\"zawya.com\"]}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.run.runId").isEqualTo("run-1")
                .jsonPath("$.run.status").isEqualTo("RUNNING");

        ArgumentCaptor<StartCommand> captor = ArgumentCaptor.forClass(StartCommand.class);
        verify(pipelineEngine).start(captor.capture());
        assertThat(captor.getValue().provider()).isEqualTo("openai");
        assertThat(captor.getValue().model()).isNull();
        assertThat(captor.getValue().sourceIds()).containsExactly("zawya.com");
        assertThat(captor.getValue().trigger()).isEqualTo(RunTrigger.MANUAL);
    }

    @Test
    @DisplayName("POST /api/v1/pipeline/start - 본문 없이도 기본값으로 시작")
    void startWithoutBody() {
        when(pipelineEngine.start(any(StartCommand.class))).thenReturn(running("run-2"));

        webTestClient.post()
                .uri("/api/v1/pipeline/start")
                .exchange()
                .expectStatus().isAccepted();

        ArgumentCaptor<StartCommand> captor = ArgumentCaptor.forClass(StartCommand.class);
        verify(pipelineEngine).start(captor.capture());
        assertThat(captor.getValue().provider()).isNull();
        assertThat(captor.getValue().sourceIds()).isEmpty();
    }

    @Test
    @DisplayName("POST /api/v1/pipeline/start - 실행 중이면 409")
    void startConflict() {
        when(pipelineEngine.start(any(StartCommand.class))).thenThrow(new AlreadyRunningException("run-0"));

        webTestClient.post()
                .uri("/api/v1/pipeline/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("ALREADY_RUNNING")
                .jsonPath("$.runId").isEqualTo("run-0");
    }

    @Test
    @DisplayName("POST /api/v1/pipeline/start - 알 수 없는 제공자는 400")
    void startUnknownProvider() {
        when(pipelineEngine.start(any(StartCommand.class)))
                .thenThrow(new IllegalArgumentException("Unknown LLM provider: acme"));

        webTestClient.post()
                .uri("/api/v1/pipeline/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"provider\":\"acme\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").isEqualTo("Unknown LLM provider: acme");
    }

    @Test
    @DisplayName("POST /api/v1/pipeline/stop - 실행 중이면 202, 아니면 409")
    void stop() {
        RunSnapshot stopping = running("run-1").toBuilder().cancelRequested(true).statusMessage("Stopping...").build();
        when(pipelineEngine.stop()).thenReturn(true, false);
        when(pipelineEngine.status()).thenReturn(stopping);

        webTestClient.post()
                .uri("/api/v1/pipeline/stop")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.run.cancelRequested").isEqualTo(true);

        webTestClient.post()
                .uri("/api/v1/pipeline/stop")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_RUNNING");
    }

    @Test
    @DisplayName("GET /api/v1/pipeline/status - 현재 상태 조회")
    void status() {
        when(pipelineEngine.status()).thenReturn(RunSnapshot.idle());

        webTestClient.get()
                .uri("/api/v1/pipeline/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(false)
                .jsonPath("$.status").isEqualTo("IDLE");
    }

    @Test
    @DisplayName("PUT /api/v1/pipeline/schedule - 잘못된 시각은 400, 저장하지 않음")
    void scheduleValidation() {
        webTestClient.put()
                .uri("/api/v1/pipeline/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"time\":\"24:00\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_FAILED");

        verify(scheduleService, never()).configureSchedule(any(), any());
    }

    @Test
    @DisplayName("PUT /api/v1/pipeline/schedule - 유효한 시각은 저장")
    void scheduleUpdate() {
        when(scheduleService.configureSchedule("14:30", true)).thenReturn(new ScheduleConfig("14:30", true));

        webTestClient.put()
                .uri("/api/v1/pipeline/schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"time\":\"14:30\",\"enabled\":true}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.time").isEqualTo("14:30")
                .jsonPath("$.enabled").isEqualTo(true);
    }

    @Test
    @DisplayName("GET /api/v1/pipeline/runs/latest - 기록이 없으면 404")
    void latestRunMissing() {
        when(runRecordRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/pipeline/runs/latest")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET /api/v1/pipeline/runs/latest - 마지막 실행 기록")
    void latestRun() {
        PipelineRunRecord record = PipelineRunRecord.builder()
                .runId("run-9")
                .trigger(RunTrigger.SCHEDULED)
                .status(RunStatus.COMPLETED)
                .sourceIds("gulfnews.com,zawya.com")
                .total(4)
                .progress(4)
                .startedAt(LocalDateTime.of(2024, 3, 5, 1, 0))
                .build();
        when(runRecordRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.of(record));

        webTestClient.get()
                .uri("/api/v1/pipeline/runs/latest")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runId").isEqualTo("run-9")
                .jsonPath("$.status").isEqualTo("COMPLETED")
                .jsonPath("$.sourceIds[1]").isEqualTo("zawya.com");
    }

    @Test
    @DisplayName("GET /api/v1/pipeline/usage?summarize=true - provider/model 별 합계")
    void usageSummary() {
        when(usageRecordRepository.summarizeByProviderAndModel())
                .thenReturn(List.of(new UsageSummaryDTO("openai", "gpt-4o-mini", 3L, 4200L, 0.0012)));

        webTestClient.get()
                .uri("/api/v1/pipeline/usage?summarize=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].provider").isEqualTo("openai")
                .jsonPath("$[0].totalCalls").isEqualTo(3)
                .jsonPath("$[0].totalTokens").isEqualTo(4200);
    }
}
