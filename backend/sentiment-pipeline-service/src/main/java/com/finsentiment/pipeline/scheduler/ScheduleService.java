package com.finsentiment.pipeline.scheduler;

import com.finsentiment.pipeline.config.PipelineProperties;
import com.finsentiment.pipeline.entity.AppSetting;
import com.finsentiment.pipeline.repository.AppSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.regex.Pattern;

/**
 * 일일 실행 시각 설정 관리.
 * 값은 app_settings 테이블에 저장되어 재시작 후에도 유지되며, 없으면 설정 파일 기본값을 사용합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    static final String TIME_KEY = "schedule_time";
    static final String ENABLED_KEY = "schedule_enabled";

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    private final AppSettingRepository settingRepository;
    private final PipelineProperties properties;
    private final PipelineScheduler pipelineScheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void registerOnStartup() {
        ScheduleConfig config = currentSchedule();
        log.info("[Scheduler] Loaded schedule: time={} UTC, enabled={}", config.time(), config.enabled());
        pipelineScheduler.reschedule(config);
    }

    @Transactional(readOnly = true)
    public ScheduleConfig currentSchedule() {
        String time = settingRepository.findById(TIME_KEY)
                .map(AppSetting::getValue)
                .filter(value -> TIME_PATTERN.matcher(value).matches())
                .orElse(properties.getSchedule().getTime());
        boolean enabled = settingRepository.findById(ENABLED_KEY)
                .map(AppSetting::getValue)
                .map(Boolean::parseBoolean)
                .orElse(properties.getSchedule().isEnabled());
        return new ScheduleConfig(time, enabled);
    }

    /**
     * Validates and stores the schedule, then re-registers the daily trigger.
     *
     * @param enabled null keeps the current value
     * @throws IllegalArgumentException when time is not HH:MM (00:00-23:59)
     */
    @Transactional
    public ScheduleConfig configureSchedule(String time, Boolean enabled) {
        if (time == null || !TIME_PATTERN.matcher(time.trim()).matches()) {
            throw new IllegalArgumentException("Invalid time format '" + time + "'. Use HH:MM (00:00-23:59, UTC)");
        }

        ScheduleConfig updated = new ScheduleConfig(
                time.trim(),
                enabled != null ? enabled : currentSchedule().enabled()
        );
        settingRepository.save(AppSetting.builder().key(TIME_KEY).value(updated.time()).build());
        settingRepository.save(AppSetting.builder().key(ENABLED_KEY).value(String.valueOf(updated.enabled())).build());

        pipelineScheduler.reschedule(updated);
        log.info("[Scheduler] Schedule updated: time={} UTC, enabled={}", updated.time(), updated.enabled());
        return updated;
    }
}
