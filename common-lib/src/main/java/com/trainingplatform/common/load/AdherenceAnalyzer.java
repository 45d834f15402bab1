package com.trainingplatform.common.load;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.PlanStatus;
import com.trainingplatform.common.model.PlannedActivity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares a week's plan with what was actually logged.
 *
 * <ul>
 *   <li><b>completed</b>: plan status {@code COMPLETED}</li>
 *   <li><b>missed</b>: still {@code PLANNED} and dated before {@code asOf}</li>
 *   <li><b>extra</b>: logged activity that no plan in the week links to</li>
 * </ul>
 *
 * <p>Adherence is {@code completed / planned × 100}, and 100 when nothing was planned.
 */
public final class AdherenceAnalyzer {

    /** Distance deviation (km) beyond which a completed session is called out. */
    public static final double DISTANCE_DISCREPANCY_KM = 2.0;

    private static final double HIGH_ADHERENCE_PERCENT = 75.0;

    private AdherenceAnalyzer() {}

    public static AdherenceReport analyze(WeekWindow week, List<ActivityRecord> activities,
                                          List<PlannedActivity> planned, LocalDate asOf) {
        List<PlannedActivity> weekPlan = WeeklyForecastCalculator.safe(planned).stream()
            .filter(Objects::nonNull)
            .filter(p -> week.contains(p.date()))
            .toList();
        List<ActivityRecord> weekActual = WeeklyForecastCalculator.safe(activities).stream()
            .filter(WeeklyForecastCalculator::counts)
            .filter(a -> week.contains(a.date()))
            .toList();

        List<PlannedActivity> completed = weekPlan.stream()
            .filter(p -> p.status() == PlanStatus.COMPLETED)
            .toList();
        List<PlannedActivity> missed = weekPlan.stream()
            .filter(PlannedActivity::isStillPlanned)
            .filter(p -> asOf != null && p.date().isBefore(asOf))
            .toList();

        Set<String> linkedIds = weekPlan.stream()
            .map(PlannedActivity::completedActivityId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        List<ActivityRecord> extras = weekActual.stream()
            .filter(a -> a.id() == null || !linkedIds.contains(a.id()))
            .toList();

        double adherence = weekPlan.isEmpty() ? 100.0 : completed.size() * 100.0 / weekPlan.size();

        List<String> insights = new ArrayList<>();
        overallMessage(weekPlan.size(), completed.size(), weekActual.size(), adherence)
            .ifPresent(insights::add);

        for (PlannedActivity p : completed) {
            if (p.actualDistanceKm() == null || p.estimatedDistanceKm() == null) continue;
            double diff = p.actualDistanceKm() - p.estimatedDistanceKm();
            if (diff > DISTANCE_DISCREPANCY_KM) {
                insights.add(String.format(Locale.ROOT,
                    "Session \"%s\" ran %.1f km longer than planned. Strong work!", titleOf(p), diff));
            } else if (diff < -DISTANCE_DISCREPANCY_KM) {
                insights.add(String.format(Locale.ROOT,
                    "Session \"%s\" ended %.1f km shorter than planned.", titleOf(p), Math.abs(diff)));
            }
        }

        for (PlannedActivity p : missed) {
            insights.add(String.format(Locale.ROOT, "Missed session: \"%s\" (%s).", titleOf(p), p.date()));
        }

        if (!extras.isEmpty()) {
            insights.add(String.format(Locale.ROOT,
                "You did %d extra session%s that %s not in the plan.",
                extras.size(), extras.size() == 1 ? "" : "s", extras.size() == 1 ? "was" : "were"));
        }

        return new AdherenceReport(adherence, weekPlan.size(), completed.size(), missed.size(),
                                   extras.size(), List.copyOf(insights));
    }

    private static Optional<String> overallMessage(int plannedCount, int completedCount,
                                                             int actualCount, double adherence) {
        if (plannedCount == 0) {
            return actualCount > 0
                ? Optional.of("You trained well even though nothing was planned. Nice work!")
                : Optional.empty();
        }
        if (completedCount == plannedCount) {
            return Optional.of("100% adherence! You completed every planned session this week.");
        }
        if (adherence >= HIGH_ADHERENCE_PERCENT) {
            int misses = plannedCount - completedCount;
            return Optional.of(String.format(Locale.ROOT,
                "High adherence (%d%%). You only missed %d session%s.",
                Math.round(adherence), misses, misses == 1 ? "" : "s"));
        }
        if (completedCount > 0) {
            return Optional.of(String.format(Locale.ROOT,
                "You completed %d of %d planned sessions.", completedCount, plannedCount));
        }
        return Optional.empty();
    }

    private static String titleOf(PlannedActivity p) {
        if (p.title() != null && !p.title().isBlank()) return p.title();
        return p.category() == null ? "session" : p.category().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
