package com.finsentiment.pipeline.exception;

import lombok.Getter;

/**
 * LLM 엔드포인트 호출 실패 (HTTP 오류, 응답 형식 오류)
 */
@Getter
public class LlmCallException extends PipelineException {

    private final String provider;

    public LlmCallException(String provider, String message) {
        super("LLM_CALL_FAILED", message);
        this.provider = provider;
    }

    public LlmCallException(String provider, String message, Throwable cause) {
        super("LLM_CALL_FAILED", message, cause);
        this.provider = provider;
    }
}
