package com.finsentiment.pipeline.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * 감성 레이블 (positive, negative, neutral)
 */
public enum SentimentLabel {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String value;

    SentimentLabel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<SentimentLabel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SentimentLabel label : values()) {
            if (label.value.equals(normalized)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }
}
