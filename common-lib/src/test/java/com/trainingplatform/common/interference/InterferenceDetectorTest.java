package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.ConflictType;
import com.trainingplatform.common.model.ConflictWarning;
import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.PlannedCategory;
import com.trainingplatform.common.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InterferenceDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 5);

    private static ActivityRecord gym(String id, LocalDate date) {
        return ActivityRecord.of(id, date, ActivityType.STRENGTH, 60, null, Intensity.HIGH);
    }

    private static ActivityRecord hardRun(String id, LocalDate date) {
        return ActivityRecord.of(id, date, ActivityType.RUNNING, 45, 10.0, Intensity.HIGH);
    }

    private static ActivityRecord easyRun(String id, LocalDate date) {
        return ActivityRecord.of(id, date, ActivityType.RUNNING, 30, 5.0, Intensity.LOW);
    }

    private static ActivityRecord hyrox(String id, LocalDate date) {
        return ActivityRecord.of(id, date, ActivityType.HYROX, 75, null, Intensity.HIGH);
    }

    @Nested
    @DisplayName("per-day rules")
    class RuleTests {

        @Test
        @DisplayName("MTOR + AMPK_HIGH → exactly one INTERFERENCE_EFFECT referencing both")
        void strengthPlusHardCardio() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(gym("g", DAY), hardRun("r", DAY)), null);

            assertEquals(1, warnings.size());
            ConflictWarning w = warnings.get(0);
            assertEquals(ConflictType.INTERFERENCE_EFFECT, w.type());
            assertEquals(RiskLevel.HIGH, w.riskLevel());
            assertEquals(Set.of("g", "r"), Set.copyOf(w.involvedActivityIds()));
            assertEquals("warn-2024-06-05-interf-high", w.id());
            assertTrue(w.suggestion().contains("6 hours"));
        }

        @Test
        @DisplayName("MTOR + AMPK_LOW only → MODERATE interference")
        void strengthPlusEasyCardio() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(gym("g", DAY), easyRun("e", DAY)), null);

            assertEquals(1, warnings.size());
            assertEquals(RiskLevel.MODERATE, warnings.get(0).riskLevel());
            assertEquals("warn-2024-06-05-interf-low", warnings.get(0).id());
        }

        @Test
        @DisplayName("easy cardio is not double-flagged when hard cardio is present")
        void lowSuppressedByHigh() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(gym("g", DAY), easyRun("e", DAY), hardRun("r", DAY)), null);
            assertEquals(1, warnings.size());
            assertEquals(RiskLevel.HIGH, warnings.get(0).riskLevel());
        }

        @Test
        @DisplayName("two strength sessions → DOUBLE_STRENGTH")
        void doubleStrength() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(gym("g1", DAY), gym("g2", DAY)), null);

            assertEquals(1, warnings.size());
            assertEquals(ConflictType.DOUBLE_STRENGTH, warnings.get(0).type());
            assertEquals(RiskLevel.MODERATE, warnings.get(0).riskLevel());
            assertEquals(List.of("g1", "g2"), warnings.get(0).involvedActivityIds());
        }

        @Test
        @DisplayName("HYBRID + MTOR → interference plus RECOVERY_RISK")
        void hybridPlusStrength() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(hyrox("h", DAY), gym("g", DAY)), null);

            assertEquals(List.of(ConflictType.INTERFERENCE_EFFECT, ConflictType.RECOVERY_RISK),
                warnings.stream().map(ConflictWarning::type).toList());
            ConflictWarning risk = warnings.get(1);
            assertEquals(RiskLevel.HIGH, risk.riskLevel());
            assertEquals(List.of("h", "g"), risk.involvedActivityIds());
        }
    }

    @Nested
    @DisplayName("grouping")
    class GroupingTests {

        @Test
        @DisplayName("different days never conflict")
        void differentDays() {
            assertTrue(InterferenceDetector.analyze(
                List.of(gym("g", DAY), hardRun("r", DAY.plusDays(1))), null).isEmpty());
        }

        @Test
        @DisplayName("single activity, neutral pairs, empty input → nothing")
        void nothing() {
            assertTrue(InterferenceDetector.analyze(List.of(gym("g", DAY)), null).isEmpty());
            assertTrue(InterferenceDetector.analyze(List.of(
                ActivityRecord.of("y", DAY, ActivityType.YOGA, 30, null, null), hardRun("r", DAY)), null).isEmpty());
            assertTrue(InterferenceDetector.analyze(null, null).isEmpty());
        }

        @Test
        @DisplayName("unrecognised activity next to strength → no warning")
        void unrecognisedTypeDoesNotConflict() {
            ActivityRecord padel = ActivityRecord.of("x", DAY, ActivityType.fromCode("padel"), 60, null, Intensity.HIGH);
            assertTrue(InterferenceDetector.analyze(List.of(padel, gym("g", DAY)), null).isEmpty());
        }

        @Test
        @DisplayName("logged and planned sessions are combined")
        void mixed() {
            List<ConflictWarning> warnings = InterferenceDetector.analyze(
                List.of(gym("g", DAY)),
                List.of(PlannedActivity.planned("p", DAY, PlannedCategory.INTERVALS, "Track", 8.0)));

            assertEquals(1, warnings.size());
            assertEquals(List.of("g", "p"), warnings.get(0).involvedActivityIds());
        }

        @Test
        @DisplayName("warnings come out in date order")
        void ordered() {
            LocalDate later = DAY.plusDays(3);
            List<ConflictWarning> warnings = InterferenceDetector.analyze(List.of(
                gym("g2", later), hardRun("r2", later), gym("g1", DAY), hardRun("r1", DAY)), null);

            assertEquals(List.of(DAY, later), warnings.stream().map(ConflictWarning::date).toList());
        }

        @Test
        @DisplayName("same input → same warnings")
        void deterministic() {
            List<ActivityRecord> acts = List.of(gym("g", DAY), hyrox("h", DAY), gym("g2", DAY), easyRun("e", DAY));
            assertEquals(InterferenceDetector.analyze(acts, null), InterferenceDetector.analyze(acts, null));
        }
    }
}
