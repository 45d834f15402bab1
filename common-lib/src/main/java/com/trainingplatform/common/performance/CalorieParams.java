package com.trainingplatform.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional inputs for {@link CalorieEstimator}. Any field may be {@code null}.
 */
public record CalorieParams(
    @JsonProperty("weightKg")   Double weightKg,
    @JsonProperty("speedKph")   Double speedKph,
    @JsonProperty("powerWatts") Double powerWatts
) {
    public static final CalorieParams NONE = new CalorieParams(null, null, null);

    public static CalorieParams running(double weightKg, double speedKph) {
        return new CalorieParams(weightKg, speedKph, null);
    }

    public static CalorieParams cycling(double powerWatts) {
        return new CalorieParams(null, null, powerWatts);
    }
}
