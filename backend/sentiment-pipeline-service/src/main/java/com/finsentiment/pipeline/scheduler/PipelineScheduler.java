package com.finsentiment.pipeline.scheduler;

import com.finsentiment.pipeline.exception.AlreadyRunningException;
import com.finsentiment.pipeline.pipeline.PipelineEngine;
import com.finsentiment.pipeline.pipeline.RunSnapshot;
import com.finsentiment.pipeline.pipeline.StartCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

/**
 * 매일 지정된 UTC 시각에 파이프라인을 시작합니다.
 * 이미 실행 중이면 해당 회차는 건너뜁니다 (대기열에 쌓지 않음).
 */
@Component
@Slf4j
public class PipelineScheduler {

    private final TaskScheduler taskScheduler;
    private final PipelineEngine engine;

    private ScheduledFuture<?> scheduledTask;
    private String cronExpression;

    public PipelineScheduler(@Qualifier("pipelineTaskScheduler") TaskScheduler taskScheduler,
                             PipelineEngine engine) {
        this.taskScheduler = taskScheduler;
        this.engine = engine;
    }

    /**
     * Cancels the pending trigger (a running pipeline is not interrupted) and registers
     * the new one when enabled.
     */
    public synchronized void reschedule(ScheduleConfig config) {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
            cronExpression = null;
        }

        if (!config.enabled()) {
            log.info("[Scheduler] Daily pipeline schedule disabled");
            return;
        }

        LocalTime time = LocalTime.parse(config.time());
        cronExpression = String.format("0 %d %d * * *", time.getMinute(), time.getHour());
        scheduledTask = taskScheduler.schedule(this::trigger, new CronTrigger(cronExpression, ZoneOffset.UTC));
        log.info("[Scheduler] Daily pipeline scheduled at {} UTC (cron: {})", config.time(), cronExpression);
    }

    /**
     * Starts a scheduled run with the default provider, model and all sources.
     */
    void trigger() {
        log.info("[Scheduler] Triggering scheduled pipeline run");
        try {
            RunSnapshot started = engine.start(StartCommand.scheduled());
            log.info("[Scheduler] Scheduled run {} started", started.runId());
        } catch (AlreadyRunningException e) {
            log.info("[Scheduler] Skipping scheduled run, run {} is still in progress", e.getRunningRunId());
        } catch (IllegalArgumentException e) {
            log.warn("[Scheduler] Scheduled run not started: {}", e.getMessage());
        }
    }

    public synchronized boolean isScheduled() {
        return scheduledTask != null && !scheduledTask.isCancelled();
    }

    public synchronized String getCronExpression() {
        return cronExpression;
    }
}
