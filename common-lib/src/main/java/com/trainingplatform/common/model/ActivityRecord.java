package com.trainingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Immutable snapshot of one logged activity, owned by the external log store.
 *
 * <p>Optional measurements are boxed and {@code null} when not recorded.
 * {@code hyroxFocus} is only meaningful for hybrid sessions
 * ({@code "strength"} / {@code "cardio"}).
 */
public record ActivityRecord(
    @JsonProperty("id")               String id,
    @JsonProperty("date")             LocalDate date,
    @JsonProperty("type")             ActivityType type,
    @JsonProperty("title")            String title,
    @JsonProperty("durationMinutes")  double durationMinutes,
    @JsonProperty("distanceKm")       Double distanceKm,
    @JsonProperty("intensity")        Intensity intensity,
    @JsonProperty("averageHeartRate") Integer averageHeartRate,
    @JsonProperty("calories")         Integer calories,
    @JsonProperty("excludeFromStats") boolean excludeFromStats,
    @JsonProperty("hyroxFocus")       String hyroxFocus
) {
    public static ActivityRecord of(String id, LocalDate date, ActivityType type,
                                    double durationMinutes, Double distanceKm,
                                    Intensity intensity) {
        return new ActivityRecord(id, date, type, null, durationMinutes, distanceKm,
            intensity, null, null, false, null);
    }

    public ActivityRecord withTitle(String newTitle) {
        return new ActivityRecord(id, date, type, newTitle, durationMinutes, distanceKm,
            intensity, averageHeartRate, calories, excludeFromStats, hyroxFocus);
    }

    public ActivityRecord withHeartRate(Integer heartRate) {
        return new ActivityRecord(id, date, type, title, durationMinutes, distanceKm,
            intensity, heartRate, calories, excludeFromStats, hyroxFocus);
    }

    public ActivityRecord excluded() {
        return new ActivityRecord(id, date, type, title, durationMinutes, distanceKm,
            intensity, averageHeartRate, calories, true, hyroxFocus);
    }

    public boolean isRunning() {
        return type == ActivityType.RUNNING;
    }

    public boolean hasDistance() {
        return distanceKm != null && distanceKm > 0 && Double.isFinite(distanceKm);
    }

    public double distanceOrZero() {
        return hasDistance() ? distanceKm : 0.0;
    }

    /** Pace in min/km, or 0.0 when either distance or duration is missing. */
    public double paceMinPerKm() {
        if (!hasDistance() || !(durationMinutes > 0)) return 0.0;
        return durationMinutes / distanceKm;
    }
}
