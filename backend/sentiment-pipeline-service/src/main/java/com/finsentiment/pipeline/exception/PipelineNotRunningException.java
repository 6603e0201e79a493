package com.finsentiment.pipeline.exception;

/**
 * 실행 중인 파이프라인이 없어 중지 요청을 처리할 수 없음
 */
public class PipelineNotRunningException extends PipelineException {

    public PipelineNotRunningException() {
        super("NOT_RUNNING", "No pipeline run is in progress");
    }
}
