package com.finsentiment.pipeline.scheduler;

/**
 * @param time daily trigger time in UTC, HH:mm
 */
public record ScheduleConfig(String time, boolean enabled) {
}
