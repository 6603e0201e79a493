package com.finsentiment.pipeline.entity;

/**
 * Status of a pipeline run
 */
public enum RunStatus {
    /**
     * No run has been started since the process came up
     */
    IDLE,

    /**
     * A run is executing on the pipeline worker
     */
    RUNNING,

    /**
     * All novel URLs were processed
     */
    COMPLETED,

    /**
     * Stopped cooperatively after a stop request
     */
    STOPPED,

    /**
     * Aborted by an infrastructure failure
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
