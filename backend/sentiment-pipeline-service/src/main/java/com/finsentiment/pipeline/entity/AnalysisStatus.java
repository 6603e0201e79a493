package com.finsentiment.pipeline.entity;

/**
 * Analysis state of a stored article
 */
public enum AnalysisStatus {
    /**
     * Article stored, analysis not finished yet
     */
    PENDING,

    /**
     * Analysis succeeded and entity sentiments were stored
     */
    ANALYZED,

    /**
     * All analysis attempts failed; the article has no entity sentiments
     */
    FAILED
}
