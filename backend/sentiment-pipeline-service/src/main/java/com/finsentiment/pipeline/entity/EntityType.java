package com.finsentiment.pipeline.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * 감성 분석 대상 엔티티 종류
 */
public enum EntityType {
    COMPANY("company"),
    CRYPTO("crypto");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * LLM 응답 값(소문자)으로 변환. 허용되지 않은 값이면 empty.
     */
    public static Optional<EntityType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
