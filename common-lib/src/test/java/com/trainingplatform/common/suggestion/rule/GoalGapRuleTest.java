package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.GoalStatus;
import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.PerformanceGoal;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.model.WeeklyForecast;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.trainingplatform.common.suggestion.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GoalGapRuleTest {

    private final GoalGapRule rule = new GoalGapRule();

    private List<TrainingSuggestion> propose(LocalDate target, double goalKm, double forecastKm) {
        return rule.propose(context(List.of(), target, List.of(weeklyKmGoal(goalKm)),
            WeeklyForecast.ofRunningKm(forecastKm)), emptySet());
    }

    @Test
    @DisplayName("Thursday, 10 km short → run sized to the gap at easy pace")
    void fillsGap() {
        List<TrainingSuggestion> out = propose(THURSDAY, 40, 30);

        assertEquals(1, out.size());
        TrainingSuggestion s = out.get(0);
        assertEquals("sugg-2024-06-06-goal-gap", s.id());
        assertEquals(SuggestionType.RUN, s.type());
        assertEquals(SuggestionSource.GOAL_GAP, s.source());
        assertEquals(10.0, s.distanceKm(), 1e-9);
        assertEquals(60, s.durationMinutes());
        assertEquals(Intensity.MODERATE, s.intensity());
    }

    @Test
    @DisplayName("early in the week → nothing")
    void frontHalf() {
        assertTrue(propose(TUESDAY, 40, 30).isEmpty());
    }

    @Test
    @DisplayName("gap below 3 km or above 25 km → nothing")
    void outsideWindow() {
        assertTrue(propose(FRIDAY, 40, 38).isEmpty());
        assertTrue(propose(FRIDAY, 60, 34).isEmpty());
        assertEquals(1, propose(FRIDAY, 60, 35).size());
    }

    @Test
    @DisplayName("archived or session-count goals don't apply")
    void noDistanceGoal() {
        PerformanceGoal archived = new PerformanceGoal("g", "Old", GoalStatus.ARCHIVED,
            weeklyKmGoal(40).targets(), null, null);
        assertTrue(rule.propose(context(List.of(), FRIDAY, List.of(archived, strengthGoal(3)),
            WeeklyForecast.ofRunningKm(20)), emptySet()).isEmpty());
    }
}
