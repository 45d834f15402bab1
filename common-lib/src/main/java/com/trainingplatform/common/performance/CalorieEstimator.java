package com.trainingplatform.common.performance;

import com.trainingplatform.common.model.ActivityType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Activity-specific energy expenditure estimates (kcal).
 *
 * <ul>
 *   <li>running: {@code weightKg · speedKph · hours} (≈ 1 kcal per kg per km)</li>
 *   <li>cycling: {@code watts · seconds / 4184 / 0.24}, mechanical work in kcal
 *       divided by a fixed 24% gross efficiency</li>
 *   <li>any other known type: {@code MET · weightKg · hours}</li>
 * </ul>
 *
 * <p>Running without a speed and cycling without power also fall back to the
 * MET formula. A missing weight defaults to {@value #DEFAULT_WEIGHT_KG} kg.
 * Unknown activity codes and non-positive durations return {@code 0}.
 */
public final class CalorieEstimator {

    public static final double DEFAULT_WEIGHT_KG = 70.0;

    private static final double JOULES_PER_KCAL = 4184.0;
    private static final double CYCLING_EFFICIENCY = 0.24;

    private static final Map<ActivityType, Double> MET = new EnumMap<>(ActivityType.class);

    static {
        MET.put(ActivityType.RUNNING,    9.8);
        MET.put(ActivityType.CYCLING,    7.5);
        MET.put(ActivityType.WALKING,    3.5);
        MET.put(ActivityType.STRENGTH,   5.0);
        MET.put(ActivityType.SWIMMING,   7.0);
        MET.put(ActivityType.ROWING,     7.0);
        MET.put(ActivityType.HYROX,      8.0);
        MET.put(ActivityType.YOGA,       2.5);
        MET.put(ActivityType.STRETCHING, 2.3);
        MET.put(ActivityType.OTHER,      5.0);
        MET.put(ActivityType.REST,       0.0);
    }

    private CalorieEstimator() {}

    /**
     * @param activityType    activity code, e.g. {@code "running"} (case-insensitive)
     * @param durationSeconds session length
     * @param params          optional weight / speed / power; may be {@code null}
     * @return estimated kcal, {@code 0.0} when the type is unknown or input unusable
     */
    public static double estimateCalories(String activityType, double durationSeconds,
                                          CalorieParams params) {
        if (!Double.isFinite(durationSeconds) || durationSeconds <= 0) return 0.0;
        return ActivityType.lookup(activityType)
            .map(type -> estimate(type, durationSeconds, params == null ? CalorieParams.NONE : params))
            .orElse(0.0);
    }

    /** kcal per minute at a running speed: {@code weight · speed / 60}. */
    public static double estimateKcalBurnRate(double weightKg, double speedKph) {
        if (!positive(weightKg) || !positive(speedKph)) return 0.0;
        return weightKg * speedKph / 60.0;
    }

    private static double estimate(ActivityType type, double durationSeconds, CalorieParams params) {
        double hours = durationSeconds / 3600.0;
        double weight = positive(params.weightKg()) ? params.weightKg() : DEFAULT_WEIGHT_KG;

        if (type == ActivityType.RUNNING && positive(params.speedKph())) {
            return weight * params.speedKph() * hours;
        }
        if (type == ActivityType.CYCLING && positive(params.powerWatts())) {
            return params.powerWatts() * durationSeconds / JOULES_PER_KCAL / CYCLING_EFFICIENCY;
        }
        return MET.getOrDefault(type, 0.0) * weight * hours;
    }

    private static boolean positive(Double value) {
        return value != null && Double.isFinite(value) && value > 0;
    }
}
