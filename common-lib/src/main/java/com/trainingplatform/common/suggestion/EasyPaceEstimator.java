package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.ActivityRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Estimates the user's easy pace (min/km) as the median pace of runs with both
 * distance and duration in the {@value #WINDOW_DAYS} days up to the target date.
 *
 * <p>No qualifying runs → {@value #DEFAULT_PACE}. The result is always clamped
 * to [{@value #MIN_PACE}, {@value #MAX_PACE}].
 */
public final class EasyPaceEstimator {

    public static final double DEFAULT_PACE = 6.0;
    public static final double MIN_PACE = 3.0;
    public static final double MAX_PACE = 12.0;
    public static final int WINDOW_DAYS = 28;

    private EasyPaceEstimator() {}

    public static double estimate(List<ActivityRecord> history, LocalDate targetDate) {
        if (history == null || targetDate == null) return DEFAULT_PACE;
        LocalDate cutoff = targetDate.minusDays(WINDOW_DAYS);

        double[] paces = history.stream()
            .filter(a -> a != null && a.isRunning() && a.date() != null)
            .filter(a -> !a.date().isBefore(cutoff) && !a.date().isAfter(targetDate))
            .mapToDouble(ActivityRecord::paceMinPerKm)
            .filter(p -> p > 0 && Double.isFinite(p))
            .sorted()
            .toArray();

        if (paces.length == 0) return DEFAULT_PACE;

        int mid = paces.length / 2;
        double median = paces.length % 2 != 0 ? paces[mid] : (paces[mid - 1] + paces[mid]) / 2.0;
        return Math.max(MIN_PACE, Math.min(MAX_PACE, median));
    }
}
