package com.finsentiment.pipeline.controller;

import com.finsentiment.pipeline.dto.PageResponse;
import com.finsentiment.pipeline.dto.PipelineActionResponse;
import com.finsentiment.pipeline.dto.PipelineRunDTO;
import com.finsentiment.pipeline.dto.PipelineStartRequest;
import com.finsentiment.pipeline.dto.ScheduleRequest;
import com.finsentiment.pipeline.dto.UsageRecordDTO;
import com.finsentiment.pipeline.exception.PipelineNotRunningException;
import com.finsentiment.pipeline.pipeline.PipelineEngine;
import com.finsentiment.pipeline.pipeline.RunSnapshot;
import com.finsentiment.pipeline.pipeline.StartCommand;
import com.finsentiment.pipeline.repository.PipelineRunRecordRepository;
import com.finsentiment.pipeline.repository.UsageRecordRepository;
import com.finsentiment.pipeline.scheduler.ScheduleConfig;
import com.finsentiment.pipeline.scheduler.ScheduleService;
import com.finsentiment.pipeline.source.SourceRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.SortedSet;

@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineEngine pipelineEngine;
    private final SourceRegistry sourceRegistry;
    private final ScheduleService scheduleService;
    private final PipelineRunRecordRepository runRecordRepository;
    private final UsageRecordRepository usageRecordRepository;

    /**
     * GET /api/v1/pipeline/sources - 등록된 뉴스 소스 ID 목록
     */
    @GetMapping("/sources")
    public ResponseEntity<SortedSet<String>> listSources() {
        return ResponseEntity.ok(sourceRegistry.listSources());
    }

    /**
     * POST /api/v1/pipeline/start - 파이프라인 시작 (이미 실행 중이면 409)
     */
    @PostMapping("/start")
    public ResponseEntity<PipelineActionResponse> start(@RequestBody(required = false) PipelineStartRequest request) {
        PipelineStartRequest body = request != null ? request : new PipelineStartRequest(null, null, null);
        RunSnapshot started = pipelineEngine.start(StartCommand.manual(body.provider(), body.model(), body.sources()));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new PipelineActionResponse(true, "Pipeline started", started));
    }

    /**
     * POST /api/v1/pipeline/stop - 중지 요청 (실행 중이 아니면 409)
     */
    @PostMapping("/stop")
    public ResponseEntity<PipelineActionResponse> stop() {
        if (!pipelineEngine.stop()) {
            throw new PipelineNotRunningException();
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new PipelineActionResponse(true, "Stop requested", pipelineEngine.status()));
    }

    /**
     * GET /api/v1/pipeline/status - 현재(또는 마지막) 실행 상태
     */
    @GetMapping("/status")
    public ResponseEntity<RunSnapshot> status() {
        return ResponseEntity.ok(pipelineEngine.status());
    }

    @GetMapping("/schedule")
    public ResponseEntity<ScheduleConfig> getSchedule() {
        return ResponseEntity.ok(scheduleService.currentSchedule());
    }

    /**
     * PUT /api/v1/pipeline/schedule - 일일 실행 시각(UTC) 변경
     */
    @PutMapping("/schedule")
    public ResponseEntity<ScheduleConfig> updateSchedule(@Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(scheduleService.configureSchedule(request.time(), request.enabled()));
    }

    /**
     * GET /api/v1/pipeline/runs/latest - 마지막으로 종료된 실행 기록
     */
    @GetMapping("/runs/latest")
    public ResponseEntity<PipelineRunDTO> latestRun() {
        return runRecordRepository.findFirstByOrderByStartedAtDesc()
                .map(PipelineRunDTO::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/pipeline/usage - LLM 사용량 기록 (summarize=true 이면 provider/model 별 합계)
     */
    @GetMapping("/usage")
    public ResponseEntity<?> usage(
            @RequestParam(defaultValue = "false") boolean summarize,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        if (summarize) {
            return ResponseEntity.ok(usageRecordRepository.summarizeByProviderAndModel());
        }
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 500));
        return ResponseEntity.ok(PageResponse.from(
                usageRecordRepository.findAllByOrderByCreatedAtDesc(pageable).map(UsageRecordDTO::from)));
    }
}
