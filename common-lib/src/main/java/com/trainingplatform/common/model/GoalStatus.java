package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GoalStatus {
    ACTIVE("active"),
    ARCHIVED("archived");

    private final String code;

    GoalStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static GoalStatus fromCode(String code) {
        if (code != null && "active".equals(code.trim().toLowerCase(Locale.ROOT))) {
            return ACTIVE;
        }
        return ARCHIVED;
    }
}
