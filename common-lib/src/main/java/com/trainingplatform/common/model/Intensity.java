package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Intensity {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    ULTRA("ultra");

    private final String code;

    Intensity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** HIGH and ULTRA both count as a hard session. */
    public boolean isHard() {
        return this == HIGH || this == ULTRA;
    }

    @JsonCreator
    public static Intensity fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Intensity intensity : values()) {
            if (intensity.code.equals(normalized)) return intensity;
        }
        return null;
    }
}
