package com.finsentiment.pipeline.exception;

/**
 * 이미 실행 중인 파이프라인이 있어 시작 요청이 거부됨
 */
public class AlreadyRunningException extends PipelineException {

    private final String runningRunId;

    public AlreadyRunningException(String runningRunId) {
        super("ALREADY_RUNNING", "A pipeline run is already in progress: " + runningRunId);
        this.runningRunId = runningRunId;
    }

    public String getRunningRunId() {
        return runningRunId;
    }
}
