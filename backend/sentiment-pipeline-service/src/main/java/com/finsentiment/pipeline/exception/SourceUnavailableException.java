package com.finsentiment.pipeline.exception;

/**
 * URL discovery failed for one source. The run skips the source and continues.
 */
public class SourceUnavailableException extends PipelineException {

    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message) {
        super("SOURCE_UNAVAILABLE", message);
        this.sourceId = sourceId;
    }

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super("SOURCE_UNAVAILABLE", message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
