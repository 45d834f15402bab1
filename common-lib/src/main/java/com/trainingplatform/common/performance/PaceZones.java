package com.trainingplatform.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Training paces in min/km. Slower paces are numerically larger, so a valid
 * instance always satisfies
 * {@code easy >= marathon >= threshold >= interval >= repetition}.
 * {@link #UNKNOWN} (all zeros) is returned for unusable fitness scores.
 */
public record PaceZones(
    @JsonProperty("easy")       double easy,
    @JsonProperty("marathon")   double marathon,
    @JsonProperty("threshold")  double threshold,
    @JsonProperty("interval")   double interval,
    @JsonProperty("repetition") double repetition
) {
    public static final PaceZones UNKNOWN = new PaceZones(0.0, 0.0, 0.0, 0.0, 0.0);

    public boolean isKnown() {
        return easy > 0;
    }
}
