package com.trainingplatform.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Karvonen heart-rate zones Z1–Z5 (bpm), each bounded at 10% steps of the
 * heart-rate reserve from 50% to 100%.
 */
public record HeartRateZones(
    @JsonProperty("z1") Zone z1,
    @JsonProperty("z2") Zone z2,
    @JsonProperty("z3") Zone z3,
    @JsonProperty("z4") Zone z4,
    @JsonProperty("z5") Zone z5
) {
    public record Zone(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max
    ) {}
}
