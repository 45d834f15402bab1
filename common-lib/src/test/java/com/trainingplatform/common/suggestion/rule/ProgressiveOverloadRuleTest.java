package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.model.WeeklyForecast;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.trainingplatform.common.suggestion.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ProgressiveOverloadRuleTest {

    private final ProgressiveOverloadRule rule = new ProgressiveOverloadRule();

    private List<TrainingSuggestion> propose(double lastWeekKm, double forecastKm) {
        return rule.propose(context(List.of(run("lw", MONDAY.minusDays(4), lastWeekKm)),
            WEDNESDAY, List.of(), WeeklyForecast.ofRunningKm(forecastKm)), emptySet());
    }

    @Test
    @DisplayName("20 km last week, 15 km forecast → exactly 6 km more")
    void missingDistance() {
        List<TrainingSuggestion> out = propose(20, 15);
        assertEquals(1, out.size());
        assertEquals(SuggestionSource.PROGRESSIVE_OVERLOAD, out.get(0).source());
        assertEquals(6.0, out.get(0).distanceKm(), 1e-9);
        assertEquals(36, out.get(0).durationMinutes());
    }

    @Test
    @DisplayName("forecast already at +5% → nothing")
    void onTrack() {
        assertTrue(propose(20, 21).isEmpty());
    }

    @Test
    @DisplayName("last week ≤ 5 km → nothing")
    void tooLittle() {
        assertTrue(propose(5, 0).isEmpty());
    }
}
