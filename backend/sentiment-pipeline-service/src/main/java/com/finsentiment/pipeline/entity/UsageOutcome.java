package com.finsentiment.pipeline.entity;

/**
 * Outcome of a single LLM call attempt
 */
public enum UsageOutcome {
    SUCCESS,
    /**
     * Attempt failed and another attempt follows
     */
    RETRIED,
    /**
     * Last allowed attempt failed
     */
    FAILURE
}
