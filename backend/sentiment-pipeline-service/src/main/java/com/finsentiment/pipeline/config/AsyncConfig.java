package com.finsentiment.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${pipeline.executor.await-termination-seconds:30}")
    private int awaitTerminationSeconds;

    /**
     * 파이프라인 실행 전용 실행자.
     * 한 번에 하나의 실행만 허용하므로 스레드 1개, 대기열 1개.
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("pipeline-run-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }

    /**
     * 일일 스케줄 트리거 전용 스케줄러
     */
    @Bean(name = "pipelineTaskScheduler")
    public TaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("pipeline-schedule-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("[Scheduler] Scheduled trigger failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }
}
