package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Modality of a logged activity as recorded by the activity log.
 *
 * <p>Codes are lowercase on the wire ({@code "running"}); parsing is
 * case-insensitive. Blank or unrecognised codes deserialize to {@link #UNKNOWN}
 * so that a single odd record never rejects a whole history snapshot.
 * {@link #OTHER} is a real log entry ("other workout") and counts as cardio
 * for interference; {@link #UNKNOWN} classifies as nothing.
 */
public enum ActivityType {
    RUNNING("running"),
    CYCLING("cycling"),
    STRENGTH("strength"),
    WALKING("walking"),
    SWIMMING("swimming"),
    ROWING("rowing"),
    HYROX("hyrox"),
    YOGA("yoga"),
    STRETCHING("stretching"),
    REST("rest"),
    OTHER("other"),
    UNKNOWN("unknown");

    private final String code;

    ActivityType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Endurance modalities counted as cardio minutes. */
    public boolean isCardio() {
        return this == RUNNING || this == CYCLING || this == WALKING
            || this == SWIMMING || this == ROWING;
    }

    /**
     * Strict lookup: empty for blank or unrecognised codes.
     */
    public static Optional<ActivityType> lookup(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ActivityType type : values()) {
            if (type.code.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ActivityType fromCode(String code) {
        return lookup(code).orElse(UNKNOWN);
    }
}
