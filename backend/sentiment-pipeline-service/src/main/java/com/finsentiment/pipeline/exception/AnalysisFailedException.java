package com.finsentiment.pipeline.exception;

/**
 * 모든 재시도 후에도 감성 분석에 실패함
 */
public class AnalysisFailedException extends PipelineException {

    private final int attempts;

    public AnalysisFailedException(String message, int attempts, Throwable cause) {
        super("ANALYSIS_FAILED", message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
