package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.GoalStatus;
import com.trainingplatform.common.model.GoalTarget;
import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.UserPreferences;
import com.trainingplatform.common.model.WeeklyForecast;

import java.time.LocalDate;
import java.util.List;

/**
 * Shared builders for suggestion tests. Week of Monday 2024-06-03; runs are
 * built at 6:00 min/km unless a duration is given.
 */
public final class TrainingFixtures {

    public static final LocalDate MONDAY    = LocalDate.of(2024, 6, 3);
    public static final LocalDate TUESDAY   = MONDAY.plusDays(1);
    public static final LocalDate WEDNESDAY = MONDAY.plusDays(2);
    public static final LocalDate THURSDAY  = MONDAY.plusDays(3);
    public static final LocalDate FRIDAY    = MONDAY.plusDays(4);
    public static final LocalDate SATURDAY  = MONDAY.plusDays(5);

    private TrainingFixtures() {}

    public static ActivityRecord run(String id, LocalDate date, double km) {
        return ActivityRecord.of(id, date, ActivityType.RUNNING, km * 6.0, km, Intensity.LOW);
    }

    public static ActivityRecord run(String id, LocalDate date, double km, double minutes, Intensity intensity) {
        return ActivityRecord.of(id, date, ActivityType.RUNNING, minutes, km, intensity);
    }

    public static ActivityRecord strength(String id, LocalDate date, String title, double minutes) {
        return ActivityRecord.of(id, date, ActivityType.STRENGTH, minutes, null, Intensity.MODERATE)
            .withTitle(title);
    }

    public static PerformanceGoal weeklyKmGoal(double km) {
        return new PerformanceGoal("g-km", "Weekly running", GoalStatus.ACTIVE,
            List.of(new GoalTarget("km", km)), null, null);
    }

    public static PerformanceGoal strengthGoal(double sessions) {
        return new PerformanceGoal("g-str", "Strength 3x per week", GoalStatus.ACTIVE,
            List.of(new GoalTarget("sessions", sessions)), null, null);
    }

    public static SuggestionContext context(List<ActivityRecord> history, LocalDate target,
                                            List<PerformanceGoal> goals, WeeklyForecast forecast) {
        return SuggestionContext.of(SuggestionRequest.of(history, target, goals, forecast),
                                    SuggestionSettings.DEFAULTS);
    }

    public static SuggestionContext context(List<ActivityRecord> history, LocalDate target) {
        return context(history, target, List.of(), null);
    }

    public static SuggestionContext context(List<ActivityRecord> history, LocalDate target,
                                            UserPreferences preferences) {
        return SuggestionContext.of(SuggestionRequest.of(history, target, List.of(), null)
            .withPreferences(preferences), SuggestionSettings.DEFAULTS);
    }

    public static SuggestionSet emptySet() {
        return new SuggestionSet(SuggestionSettings.DEFAULT_SIMILARITY_TOLERANCE_KM, UserPreferences.DEFAULTS);
    }
}
