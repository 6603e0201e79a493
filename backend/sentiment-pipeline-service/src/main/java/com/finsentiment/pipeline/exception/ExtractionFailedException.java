package com.finsentiment.pipeline.exception;

/**
 * Content fetch/extraction failed for one URL. The URL stays novel for a later run.
 */
public class ExtractionFailedException extends PipelineException {

    private final String url;

    public ExtractionFailedException(String url, String message) {
        super("EXTRACTION_FAILED", message);
        this.url = url;
    }

    public ExtractionFailedException(String url, String message, Throwable cause) {
        super("EXTRACTION_FAILED", message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
