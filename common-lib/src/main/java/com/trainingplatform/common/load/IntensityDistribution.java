package com.trainingplatform.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Share of the week's cardio minutes per intensity bucket (0–100 each).
 * All percentages are 0 when no cardio was logged.
 */
public record IntensityDistribution(
    @JsonProperty("lowPercent")      double lowPercent,
    @JsonProperty("moderatePercent") double moderatePercent,
    @JsonProperty("highPercent")     double highPercent,
    @JsonProperty("totalMinutes")    double totalMinutes
) {
    public static final IntensityDistribution EMPTY = new IntensityDistribution(0, 0, 0, 0);
}
