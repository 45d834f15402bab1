package com.trainingplatform.common.load;

import com.trainingplatform.common.exception.TrainingEngineException;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;
import com.trainingplatform.common.performance.PerformanceFormatter;

import java.time.LocalDate;
import java.util.List;

/**
 * Assembles the full weekly load picture for the week containing
 * {@code weekDate}: forecast, intensity distribution, volume trend,
 * adherence narrative and the average running pace.
 *
 * <p>When the caller supplies no forecast it is derived with
 * {@link WeeklyForecastCalculator}. Pure function of its arguments; a missing
 * {@code weekDate} is rejected, a missing {@code asOf} marks nothing as missed.
 */
public final class LoadAdherenceAnalyzer {

    static final String COMPONENT = "LoadAdherenceAnalyzer";

    private LoadAdherenceAnalyzer() {}

    public static WeeklyLoadReport analyze(LocalDate weekDate,
                                           List<ActivityRecord> activities,
                                           List<PlannedActivity> planned,
                                           WeeklyForecast suppliedForecast,
                                           UserPreferences preferences,
                                           LocalDate asOf) {
        if (weekDate == null) {
            throw TrainingEngineException.missing(COMPONENT, "analyze", "weekDate");
        }
        WeekWindow week = WeekWindow.containing(weekDate);
        UserPreferences prefs = preferences == null ? UserPreferences.DEFAULTS : preferences;

        WeeklyForecast forecast = suppliedForecast != null
            ? suppliedForecast
            : WeeklyForecastCalculator.forecast(week, activities, planned);

        IntensityDistribution intensity =
            IntensityDistributionCalculator.compute(week, activities, prefs.birthYear(), asOf);
        VolumeTrend trend = VolumeTrendAnalyzer.analyze(week, activities, forecast);
        AdherenceReport adherence = AdherenceAnalyzer.analyze(week, activities, planned, asOf);

        double pace = averageRunningPace(week, activities);
        return new WeeklyLoadReport(week, forecast, intensity, trend, adherence,
                                    pace, PerformanceFormatter.formatPace(pace));
    }

    /** Total minutes over total km for runs carrying both; 0.0 when none do. */
    static double averageRunningPace(WeekWindow week, List<ActivityRecord> activities) {
        double minutes = 0, km = 0;
        for (ActivityRecord a : WeeklyForecastCalculator.safe(activities)) {
            if (!WeeklyForecastCalculator.counts(a) || !a.isRunning() || !week.contains(a.date())) continue;
            if (a.paceMinPerKm() <= 0) continue;
            minutes += a.durationMinutes();
            km += a.distanceKm();
        }
        return km > 0 ? minutes / km : 0.0;
    }
}
