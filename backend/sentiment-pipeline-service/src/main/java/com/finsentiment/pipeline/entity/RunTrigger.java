package com.finsentiment.pipeline.entity;

/**
 * 파이프라인 실행을 시작한 주체
 */
public enum RunTrigger {
    MANUAL,
    SCHEDULED,
    COMMAND_LINE
}
