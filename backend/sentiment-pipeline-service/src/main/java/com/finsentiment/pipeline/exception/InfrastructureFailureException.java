package com.finsentiment.pipeline.exception;

/**
 * Store or connectivity failure that prevents the run from making further progress.
 */
public class InfrastructureFailureException extends PipelineException {

    public InfrastructureFailureException(String message, Throwable cause) {
        super("INFRASTRUCTURE_FAILURE", message, cause);
    }
}
