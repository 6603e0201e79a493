package com.finsentiment.pipeline.pipeline;

import com.finsentiment.pipeline.entity.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * pipeline.run-once=true 일 때 기동 시 한 번 실행하고 종료합니다.
 * 종료 코드: Completed/Stopped → 0, Failed → 1
 */
@Component
@ConditionalOnProperty(name = "pipeline.run-once", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineCommandLineRunner implements ApplicationRunner {

    private final PipelineEngine pipelineEngine;
    private final ConfigurableApplicationContext applicationContext;

    @Value("${pipeline.run-once-provider:}")
    private String provider;

    @Value("${pipeline.run-once-model:}")
    private String model;

    @Value("${pipeline.run-once-sources:}")
    private String sources;

    @Value("${pipeline.run-once-poll-millis:1000}")
    private long pollMillis = 1000;

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        List<String> sourceIds = sources.isBlank() ? List.of() : Arrays.asList(sources.split(","));
        RunSnapshot started = pipelineEngine.start(StartCommand.commandLine(provider, model, sourceIds));
        log.info("[Pipeline] Command-line run {} started", started.runId());

        RunSnapshot finished = awaitTermination(started.runId());
        int exitCode = exitCode(finished.status());
        log.info("[Pipeline] Command-line run {} finished with {} (exit code {})", finished.runId(), finished.status(), exitCode);

        System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
    }

    RunSnapshot awaitTermination(String runId) throws InterruptedException {
        while (true) {
            RunSnapshot snapshot = pipelineEngine.status();
            if (runId.equals(snapshot.runId()) && snapshot.status().isTerminal()) {
                return snapshot;
            }
            Thread.sleep(pollMillis);
        }
    }

    static int exitCode(RunStatus status) {
        return status == RunStatus.FAILED ? 1 : 0;
    }
}
