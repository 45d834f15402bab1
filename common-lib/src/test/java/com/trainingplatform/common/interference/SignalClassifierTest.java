package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.PlannedCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SignalClassifierTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 5);

    private static SignalCategory logged(ActivityType type, Intensity intensity, String title) {
        return SignalClassifier.classify(ActivityAdapter.from(
            ActivityRecord.of("a", DAY, type, 45, null, intensity).withTitle(title)));
    }

    private static SignalCategory planned(PlannedCategory category, String title) {
        return SignalClassifier.classify(ActivityAdapter.from(
            PlannedActivity.planned("p", DAY, category, title, null)));
    }

    @Nested
    @DisplayName("hybrid sessions")
    class HybridTests {

        @Test
        @DisplayName("hyrox type → HYBRID")
        void hyroxType() {
            assertEquals(SignalCategory.HYBRID, logged(ActivityType.HYROX, null, null));
        }

        @Test
        @DisplayName("hyrox keyword in a strength title still → HYBRID")
        void hyroxBeatsStrength() {
            assertEquals(SignalCategory.HYBRID, logged(ActivityType.STRENGTH, null, "Hyrox stations"));
        }

        @Test
        @DisplayName("hyrox focus strength → MTOR, cardio → AMPK_HIGH")
        void focus() {
            ActivityRecord base = ActivityRecord.of("h", DAY, ActivityType.HYROX, 60, null, null);
            ActivityRecord strengthFocus = new ActivityRecord("h", DAY, ActivityType.HYROX, null, 60, null,
                null, null, null, false, "strength");
            ActivityRecord cardioFocus = new ActivityRecord("h", DAY, ActivityType.HYROX, null, 60, null,
                null, null, null, false, "cardio");

            assertEquals(SignalCategory.HYBRID, SignalClassifier.classify(ActivityAdapter.from(base)));
            assertEquals(SignalCategory.MTOR, SignalClassifier.classify(ActivityAdapter.from(strengthFocus)));
            assertEquals(SignalCategory.AMPK_HIGH, SignalClassifier.classify(ActivityAdapter.from(cardioFocus)));
        }
    }

    @Test
    @DisplayName("strength type, category or keyword → MTOR")
    void strength() {
        assertEquals(SignalCategory.MTOR, logged(ActivityType.STRENGTH, null, null));
        assertEquals(SignalCategory.MTOR, planned(PlannedCategory.STRENGTH, null));
        assertEquals(SignalCategory.MTOR, logged(ActivityType.OTHER, null, "Styrka ben"));
    }

    @Nested
    @DisplayName("cardio split")
    class CardioTests {

        @Test
        @DisplayName("high intensity, intervals, tempo and long runs → AMPK_HIGH")
        void high() {
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.RUNNING, Intensity.HIGH, null));
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.RUNNING, Intensity.ULTRA, null));
            assertEquals(SignalCategory.AMPK_HIGH, planned(PlannedCategory.INTERVALS, null));
            assertEquals(SignalCategory.AMPK_HIGH, planned(PlannedCategory.TEMPO, null));
            assertEquals(SignalCategory.AMPK_HIGH, planned(PlannedCategory.LONG_RUN, null));
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.RUNNING, null, "Intervaller 6x1000"));
        }

        @Test
        @DisplayName("low intensity, easy, recovery and walks → AMPK_LOW")
        void low() {
            assertEquals(SignalCategory.AMPK_LOW, logged(ActivityType.RUNNING, Intensity.LOW, null));
            assertEquals(SignalCategory.AMPK_LOW, planned(PlannedCategory.EASY, null));
            assertEquals(SignalCategory.AMPK_LOW, planned(PlannedCategory.RECOVERY, null));
            assertEquals(SignalCategory.AMPK_LOW, logged(ActivityType.WALKING, null, null));
            assertEquals(SignalCategory.AMPK_LOW, logged(ActivityType.CYCLING, null, "Jogg"));
        }

        @Test
        @DisplayName("ambiguous cardio → AMPK_HIGH")
        void ambiguous() {
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.CYCLING, Intensity.MODERATE, null));
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.RUNNING, null, null));
        }

        @Test
        @DisplayName("planned race → AMPK_HIGH")
        void race() {
            PlannedActivity race = new PlannedActivity("r", DAY, PlannedCategory.EASY, null, "Parkrun",
                5.0, null, true, null, null);
            assertEquals(SignalCategory.AMPK_HIGH, SignalClassifier.classify(ActivityAdapter.from(race)));
        }
    }

    @Test
    @DisplayName("rest, yoga, stretching → NEUTRAL")
    void neutral() {
        assertEquals(SignalCategory.NEUTRAL, logged(ActivityType.YOGA, null, null));
        assertEquals(SignalCategory.NEUTRAL, logged(ActivityType.STRETCHING, null, null));
        assertEquals(SignalCategory.NEUTRAL, logged(ActivityType.REST, null, null));
        assertEquals(SignalCategory.NEUTRAL, planned(PlannedCategory.REST, null));
    }

    @Nested
    @DisplayName("unmatched input")
    class UnknownTests {

        @Test
        @DisplayName("nothing recognisable → UNKNOWN")
        void empty() {
            assertEquals(SignalCategory.UNKNOWN,
                SignalClassifier.classify(new ActivityLike("x", DAY, null, null, null, null, null)));
        }

        @Test
        @DisplayName("unrecognised log type → UNKNOWN, not cardio")
        void unrecognisedType() {
            assertEquals(SignalCategory.UNKNOWN,
                logged(ActivityType.fromCode("padel"), Intensity.HIGH, null));
            assertNull(ActivityAdapter.from(
                ActivityRecord.of("p", DAY, ActivityType.fromCode("padel"), 60, null, null)).type());
        }

        @Test
        @DisplayName("explicit other workout stays cardio")
        void otherIsCardio() {
            assertEquals(SignalCategory.AMPK_HIGH, logged(ActivityType.OTHER, null, null));
        }
    }
}
