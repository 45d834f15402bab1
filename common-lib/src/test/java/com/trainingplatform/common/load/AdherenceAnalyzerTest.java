package com.trainingplatform.common.load;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.PlannedCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdherenceAnalyzerTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 6, 3);
    private static final WeekWindow WEEK = WeekWindow.containing(MONDAY);
    private static final LocalDate SUNDAY_EVENING = MONDAY.plusDays(7);

    private static ActivityRecord run(String id, int dayOffset, double km) {
        return ActivityRecord.of(id, MONDAY.plusDays(dayOffset), ActivityType.RUNNING, km * 6, km, null);
    }

    private static PlannedActivity plan(String id, int dayOffset, String title, double km) {
        return PlannedActivity.planned(id, MONDAY.plusDays(dayOffset), PlannedCategory.EASY, title, km);
    }

    @Nested
    @DisplayName("nothing planned")
    class NothingPlanned {

        @Test
        @DisplayName("adherence is 100 regardless of activity count")
        void alwaysHundred() {
            for (int n = 0; n <= 3; n++) {
                List<ActivityRecord> acts = new ArrayList<>();
                for (int i = 0; i < n; i++) acts.add(run("a" + i, i, 5));
                AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, acts, List.of(), SUNDAY_EVENING);
                assertEquals(100.0, r.adherencePercent(), "activities=" + n);
            }
        }

        @Test
        @DisplayName("training anyway → praise, then extras")
        void praise() {
            AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, List.of(run("a", 1, 5)), null, SUNDAY_EVENING);
            assertEquals(List.of(
                "You trained well even though nothing was planned. Nice work!",
                "You did 1 extra session that was not in the plan."), r.insights());
            assertEquals(1, r.extraCount());
        }

        @Test
        @DisplayName("empty week → no insights")
        void silent() {
            assertTrue(AdherenceAnalyzer.analyze(WEEK, null, null, SUNDAY_EVENING).insights().isEmpty());
        }
    }

    @Test
    @DisplayName("all completed → perfect adherence message first")
    void perfect() {
        List<PlannedActivity> plans = List.of(
            plan("p1", 0, "Easy", 8).completedBy("a1", 8.0),
            plan("p2", 2, "Easy", 8).completedBy("a2", 8.5));
        List<ActivityRecord> acts = List.of(run("a1", 0, 8), run("a2", 2, 8.5));

        AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, acts, plans, SUNDAY_EVENING);

        assertEquals(100.0, r.adherencePercent());
        assertEquals(List.of("100% adherence! You completed every planned session this week."), r.insights());
        assertEquals(0, r.extraCount());
    }

    @Test
    @DisplayName("insight order: overall, discrepancies, missed, extras")
    void ordering() {
        List<PlannedActivity> plans = List.of(
            plan("p1", 0, "Monday easy", 8).completedBy("a1", 11.0),
            plan("p2", 1, "Tuesday easy", 10).completedBy("a2", 7.0),
            plan("p3", 2, "Wednesday easy", 8).completedBy("a3", 8.0),
            plan("p4", 3, "Thursday tempo", 10));
        List<ActivityRecord> acts = List.of(
            run("a1", 0, 11), run("a2", 1, 7), run("a3", 2, 8), run("x1", 4, 5), run("x2", 5, 6));

        AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, acts, plans, SUNDAY_EVENING);

        assertEquals(75.0, r.adherencePercent(), 1e-9);
        assertEquals(List.of(
            "High adherence (75%). You only missed 1 session.",
            "Session \"Monday easy\" ran 3.0 km longer than planned. Strong work!",
            "Session \"Tuesday easy\" ended 3.0 km shorter than planned.",
            "Missed session: \"Thursday tempo\" (2024-06-06).",
            "You did 2 extra sessions that were not in the plan."), r.insights());
        assertEquals(1, r.missedCount());
        assertEquals(2, r.extraCount());
    }

    @Test
    @DisplayName("planned sessions on or after asOf are not missed yet")
    void notYetMissed() {
        List<PlannedActivity> plans = List.of(plan("p1", 4, "Friday", 6), plan("p2", 1, "Tuesday", 6));
        AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, List.of(), plans, MONDAY.plusDays(4));
        assertEquals(1, r.missedCount());
        assertEquals(0.0, r.adherencePercent());
    }

    @Test
    @DisplayName("low adherence → completed-of-planned message")
    void partial() {
        List<PlannedActivity> plans = List.of(
            plan("p1", 0, "A", 5).completedBy("a1", 5.0), plan("p2", 1, "B", 5), plan("p3", 2, "C", 5));
        AdherenceReport r = AdherenceAnalyzer.analyze(WEEK, List.of(run("a1", 0, 5)), plans, SUNDAY_EVENING);
        assertEquals("You completed 1 of 3 planned sessions.", r.insights().get(0));
    }
}
