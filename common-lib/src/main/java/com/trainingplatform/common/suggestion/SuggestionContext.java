package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.load.WeekWindow;
import com.trainingplatform.common.load.WeeklyForecastCalculator;
import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Everything a {@link SuggestionRule} may read, derived once per request.
 *
 * <p>{@code history} holds only countable activities (not excluded from
 * statistics) dated on or before the target date, sorted oldest first.
 * Immutable; safe to share between rules.
 */
public final class SuggestionContext {

    private final LocalDate targetDate;
    private final WeekWindow week;
    private final List<ActivityRecord> history;
    private final List<PerformanceGoal> goals;
    private final WeeklyForecast forecast;
    private final UserPreferences preferences;
    private final double easyPace;
    private final double trailingAverageKm;
    private final double lastWeekKm;
    private final double longRunThresholdKm;
    private final double similarityToleranceKm;

    SuggestionContext(SuggestionRequest request, SuggestionSettings settings) {
        this.targetDate = request.targetDate();
        this.week = WeekWindow.containing(targetDate);
        this.preferences = request.preferences() == null ? UserPreferences.DEFAULTS : request.preferences();
        this.history = Stream.ofNullable(request.history())
            .flatMap(List::stream)
            .filter(Objects::nonNull)
            .filter(a -> !a.excludeFromStats() && a.date() != null && a.type() != null)
            .filter(a -> !a.date().isAfter(targetDate))
            .sorted(Comparator.comparing(ActivityRecord::date))
            .toList();
        this.goals = request.goals() == null ? List.of()
            : request.goals().stream().filter(Objects::nonNull).toList();
        this.forecast = request.forecast() != null
            ? request.forecast()
            : WeeklyForecastCalculator.forecast(week, request.history(), request.planned());
        this.easyPace = EasyPaceEstimator.estimate(history, targetDate);
        this.trailingAverageKm = WeeklyForecastCalculator.trailingAverageRunningKm(week, history);
        this.lastWeekKm = WeeklyForecastCalculator.completedRunningKm(week.previous(), history);
        this.longRunThresholdKm = preferences.longRunThresholdOr(settings.defaultLongRunThresholdKm());
        this.similarityToleranceKm = settings.similarityToleranceKm();
    }

    public static SuggestionContext of(SuggestionRequest request, SuggestionSettings settings) {
        return new SuggestionContext(request, settings);
    }

    public LocalDate targetDate()         { return targetDate; }
    public DayOfWeek dayOfWeek()          { return targetDate.getDayOfWeek(); }
    public WeekWindow week()              { return week; }
    public List<ActivityRecord> history() { return history; }
    public List<PerformanceGoal> goals()  { return goals; }
    public WeeklyForecast forecast()      { return forecast; }
    public UserPreferences preferences()  { return preferences; }
    public double easyPace()              { return easyPace; }
    public double trailingAverageKm()     { return trailingAverageKm; }
    public double lastWeekKm()            { return lastWeekKm; }
    public double longRunThresholdKm()    { return longRunThresholdKm; }
    public double similarityToleranceKm() { return similarityToleranceKm; }

    public boolean hasHistory() {
        return !history.isEmpty();
    }

    public boolean hasRunningHistory() {
        return history.stream().anyMatch(ActivityRecord::isRunning);
    }

    public List<ActivityRecord> activitiesOn(LocalDate date) {
        return history.stream().filter(a -> a.date().equals(date)).toList();
    }

    /** Runs dated in {@code [targetDate − days, targetDate]}. */
    public List<ActivityRecord> runsInLastDays(int days) {
        LocalDate from = targetDate.minusDays(days);
        return history.stream()
            .filter(ActivityRecord::isRunning)
            .filter(a -> !a.date().isBefore(from))
            .toList();
    }

    public boolean isWeekend() {
        return dayOfWeek() == DayOfWeek.SATURDAY || dayOfWeek() == DayOfWeek.SUNDAY;
    }

    /** Thursday through Sunday. */
    public boolean isBackHalfOfWeek() {
        return dayOfWeek().getValue() >= DayOfWeek.THURSDAY.getValue();
    }

    /** Tuesday, Wednesday or Thursday. */
    public boolean isMidweek() {
        DayOfWeek d = dayOfWeek();
        return d == DayOfWeek.TUESDAY || d == DayOfWeek.WEDNESDAY || d == DayOfWeek.THURSDAY;
    }

    /** Minutes needed to cover {@code km} at {@code pace} (min/km), rounded. */
    public static int minutesFor(double km, double pace) {
        return (int) Math.round(km * pace);
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
