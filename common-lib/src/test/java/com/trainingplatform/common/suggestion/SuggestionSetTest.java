package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.model.UserPreferences;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.trainingplatform.common.suggestion.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SuggestionSetTest {

    private static TrainingSuggestion suggestion(SuggestionSource source, SuggestionType type, Double km) {
        return Suggestions.create(WEDNESDAY, source, type, "label", "description", "reason",
            30, km, Intensity.LOW);
    }

    @Nested
    @DisplayName("offer()")
    class OfferTests {

        @Test
        @DisplayName("same modality within tolerance → rejected")
        void duplicateRejected() {
            SuggestionSet set = emptySet();
            assertTrue(set.offer(suggestion(SuggestionSource.GOAL_GAP, SuggestionType.RUN, 10.0)));
            assertFalse(set.offer(suggestion(SuggestionSource.LONG_RUN, SuggestionType.RUN, 10.6)));
            assertEquals(1, set.size());
        }

        @Test
        @DisplayName("same modality beyond tolerance → accepted")
        void distinctDistance() {
            SuggestionSet set = emptySet();
            set.offer(suggestion(SuggestionSource.GOAL_GAP, SuggestionType.RUN, 10.0));
            assertTrue(set.offer(suggestion(SuggestionSource.LONG_RUN, SuggestionType.RUN, 15.0)));
        }

        @Test
        @DisplayName("different modality at the same distance → accepted")
        void differentModality() {
            SuggestionSet set = emptySet();
            set.offer(suggestion(SuggestionSource.GOAL_GAP, SuggestionType.RUN, 20.0));
            assertTrue(set.offer(suggestion(SuggestionSource.CHALLENGE, SuggestionType.BIKE, 20.0)));
        }

        @Test
        @DisplayName("two distance-less entries of one modality → second rejected")
        void distanceLessDuplicate() {
            SuggestionSet set = emptySet();
            set.offer(suggestion(SuggestionSource.STRENGTH_FREQUENCY, SuggestionType.STRENGTH, null));
            assertFalse(set.offer(suggestion(SuggestionSource.FAVORITE_STRENGTH, SuggestionType.STRENGTH, null)));
        }

        @Test
        @DisplayName("load-safety warnings neither get deduplicated nor shadow others")
        void loadSafetyBypass() {
            SuggestionSet set = emptySet();
            set.offer(suggestion(SuggestionSource.RECOVERY_ADVISORY, SuggestionType.REST, null));
            assertTrue(set.offer(suggestion(SuggestionSource.LOAD_SAFETY, SuggestionType.REST, null)));
            assertEquals(2, set.size());
        }

        @Test
        @DisplayName("disabled modality dropped, REST always kept")
        void modalityFilter() {
            SuggestionSet set = new SuggestionSet(1.0,
                new UserPreferences(null, EnumSet.of(SuggestionType.STRENGTH), null));
            assertFalse(set.offer(suggestion(SuggestionSource.GOAL_GAP, SuggestionType.RUN, 10.0)));
            assertTrue(set.offer(suggestion(SuggestionSource.LOAD_SAFETY, SuggestionType.REST, null)));
            assertTrue(set.offer(suggestion(SuggestionSource.STRENGTH_FREQUENCY, SuggestionType.STRENGTH, null)));
        }
    }

    @Test
    @DisplayName("coversDistance looks across modalities")
    void coversDistance() {
        SuggestionSet set = emptySet();
        set.offer(suggestion(SuggestionSource.CHALLENGE, SuggestionType.BIKE, 8.0));
        assertTrue(set.coversDistance(8.5));
        assertFalse(set.coversDistance(9.5));
    }

    @Test
    @DisplayName("ranking: load safety, goal-critical, weekday pattern, rest in emission order")
    void ranking() {
        List<TrainingSuggestion> emitted = List.of(
            suggestion(SuggestionSource.QUALITY_SESSION, SuggestionType.RUN, 8.0),
            suggestion(SuggestionSource.WEEKDAY_PATTERN, SuggestionType.RUN, 9.0),
            suggestion(SuggestionSource.DEFAULT_EASY, SuggestionType.RUN, 7.5),
            suggestion(SuggestionSource.STRENGTH_FREQUENCY, SuggestionType.STRENGTH, null),
            suggestion(SuggestionSource.LOAD_SAFETY, SuggestionType.REST, null),
            suggestion(SuggestionSource.GOAL_GAP, SuggestionType.RUN, 12.0));

        List<SuggestionSource> ranked = SuggestionRanking.rank(emitted).stream()
            .map(TrainingSuggestion::source).toList();

        assertEquals(List.of(
            SuggestionSource.LOAD_SAFETY,
            SuggestionSource.STRENGTH_FREQUENCY,
            SuggestionSource.GOAL_GAP,
            SuggestionSource.WEEKDAY_PATTERN,
            SuggestionSource.QUALITY_SESSION,
            SuggestionSource.DEFAULT_EASY), ranked);
    }
}
