package com.trainingplatform.common.load;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.PlannedCategory;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.LocalDate;
import java.util.List;

/**
 * Derives the weekly forecast: completed-to-date volume plus the volume of
 * sessions still {@code PLANNED} for the same week.
 *
 * <p>Only {@link ActivityType#RUNNING} contributes running kilometres.
 * Activities flagged {@code excludeFromStats} are ignored.
 * No state. Null lists are treated as empty.
 */
public final class WeeklyForecastCalculator {

    /** Number of completed weeks in the trailing baseline. */
    public static final int BASELINE_WEEKS = 4;

    private WeeklyForecastCalculator() {}

    public static WeeklyForecast forecast(WeekWindow week,
                                          List<ActivityRecord> activities,
                                          List<PlannedActivity> planned) {
        int runningSessions = 0;
        int strengthSessions = 0;
        double runningKm = 0.0;

        for (ActivityRecord a : safe(activities)) {
            if (!counts(a) || !week.contains(a.date())) continue;
            if (a.type() == ActivityType.RUNNING) {
                runningSessions++;
                runningKm += a.distanceOrZero();
            } else if (a.type() == ActivityType.STRENGTH) {
                strengthSessions++;
            }
        }

        for (PlannedActivity p : safe(planned)) {
            if (p == null || !p.isStillPlanned() || !week.contains(p.date()) || p.category() == null) {
                continue;
            }
            if (p.category().isRunning()) {
                runningSessions++;
                runningKm += p.estimatedDistanceOrZero();
            } else if (p.category() == PlannedCategory.STRENGTH) {
                strengthSessions++;
            }
        }

        return new WeeklyForecast(runningKm, runningSessions, strengthSessions);
    }

    /** Completed running kilometres inside {@code week}. */
    public static double completedRunningKm(WeekWindow week, List<ActivityRecord> activities) {
        return runningKmBetween(activities, week.start(), week.end());
    }

    /**
     * Mean weekly running kilometres over the {@value #BASELINE_WEEKS} completed
     * weeks before {@code week}.
     */
    public static double trailingAverageRunningKm(WeekWindow week, List<ActivityRecord> activities) {
        LocalDate from = week.start().minusWeeks(BASELINE_WEEKS);
        LocalDate to = week.start().minusDays(1);
        return runningKmBetween(activities, from, to) / BASELINE_WEEKS;
    }

    static boolean counts(ActivityRecord a) {
        return a != null && !a.excludeFromStats() && a.date() != null;
    }

    private static double runningKmBetween(List<ActivityRecord> activities, LocalDate from, LocalDate to) {
        return safe(activities).stream()
            .filter(WeeklyForecastCalculator::counts)
            .filter(ActivityRecord::isRunning)
            .filter(a -> !a.date().isBefore(from) && !a.date().isAfter(to))
            .mapToDouble(ActivityRecord::distanceOrZero)
            .sum();
    }

    static <T> List<T> safe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
