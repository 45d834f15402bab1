package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ConflictType;
import com.trainingplatform.common.model.ConflictWarning;
import com.trainingplatform.common.model.PlannedActivity;
import com.trainingplatform.common.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Flags same-day combinations of sessions whose adaptations work against each
 * other. Time of day is usually unknown, so every same-day pair counts.
 *
 * <p>Per day, each rule fires independently:
 * <pre>
 *   MTOR + (AMPK_HIGH | HYBRID)            INTERFERENCE_EFFECT  HIGH
 *   MTOR + AMPK_LOW, no AMPK_HIGH/HYBRID   INTERFERENCE_EFFECT  MODERATE
 *   2+ MTOR                                DOUBLE_STRENGTH      MODERATE
 *   HYBRID + MTOR                          RECOVERY_RISK        HIGH
 * </pre>
 * Warnings come out ordered by date, then in the rule order above.
 */
public final class InterferenceDetector {

    private static final Logger log = LoggerFactory.getLogger(InterferenceDetector.class);

    private InterferenceDetector() {
        // utility class
    }

    /** Convenience overload for a mix of logged and planned sessions. */
    public static List<ConflictWarning> analyze(List<ActivityRecord> activities, List<PlannedActivity> planned) {
        List<ActivityLike> all = Stream.concat(
                Stream.ofNullable(activities).flatMap(List::stream).filter(Objects::nonNull).map(ActivityAdapter::from),
                Stream.ofNullable(planned).flatMap(List::stream).filter(Objects::nonNull).map(ActivityAdapter::from))
            .toList();
        return analyze(all);
    }

    public static List<ConflictWarning> analyze(List<ActivityLike> activities) {
        Map<LocalDate, List<ActivityLike>> byDate = new TreeMap<>();
        if (activities != null) {
            for (ActivityLike a : activities) {
                if (a == null || a.date() == null) continue;
                byDate.computeIfAbsent(a.date(), d -> new ArrayList<>()).add(a);
            }
        }

        List<ConflictWarning> warnings = new ArrayList<>();
        byDate.forEach((date, day) -> {
            if (day.size() >= 2) warnings.addAll(analyzeDay(date, day));
        });
        log.debug("Interference analysis days={} warnings={}", byDate.size(), warnings.size());
        return warnings;
    }

    static List<ConflictWarning> analyzeDay(LocalDate date, List<ActivityLike> day) {
        List<String> mtor = new ArrayList<>();
        List<String> ampkHigh = new ArrayList<>();
        List<String> ampkLow = new ArrayList<>();
        List<String> hybrid = new ArrayList<>();

        for (ActivityLike a : day) {
            switch (SignalClassifier.classify(a)) {
                case MTOR -> mtor.add(a.id());
                case AMPK_HIGH -> ampkHigh.add(a.id());
                case HYBRID -> {
                    ampkHigh.add(a.id());
                    hybrid.add(a.id());
                }
                case AMPK_LOW -> ampkLow.add(a.id());
                default -> { }
            }
        }

        List<ConflictWarning> out = new ArrayList<>();
        if (!mtor.isEmpty() && !ampkHigh.isEmpty()) {
            out.add(warning(date, "interf-high", ConflictType.INTERFERENCE_EFFECT, RiskLevel.HIGH,
                "Strength and hard cardio on the same day",
                "Combining mTOR signalling (strength) with high AMPK activity (hard cardio) can blunt "
                    + "muscle growth. AMPK acts as a switch that turns protein synthesis down.",
                concat(mtor, ampkHigh),
                "Separate the sessions by at least 6 hours. If they must be back to back, do strength first."));
        }
        if (!mtor.isEmpty() && !ampkLow.isEmpty() && ampkHigh.isEmpty()) {
            out.add(warning(date, "interf-low", ConflictType.INTERFERENCE_EFFECT, RiskLevel.MODERATE,
                "Strength and easy cardio on the same day",
                "Even low-intensity cardio activates AMPK to some degree. With little time between "
                    + "sessions, recovery from the strength work can suffer.",
                concat(mtor, ampkLow),
                "Aim for 4-6 hours between the sessions. Cardio straight after strength should stay short and easy."));
        }
        if (mtor.size() >= 2) {
            out.add(warning(date, "double-str", ConflictType.DOUBLE_STRENGTH, RiskLevel.MODERATE,
                "Two strength sessions on the same day",
                "Two strength sessions in one day need careful planning so the nervous system and the "
                    + "same muscle groups are not overloaded.",
                Collections.unmodifiableList(mtor),
                "Keep at least 4 hours between them, or split muscle groups (upper body AM, lower body PM)."));
        }
        if (!hybrid.isEmpty() && !mtor.isEmpty()) {
            out.add(warning(date, "hybrid", ConflictType.RECOVERY_RISK, RiskLevel.HIGH,
                "Hyrox and heavy strength on the same day",
                "Hyrox is extremely demanding and causes both metabolic stress and muscle damage. "
                    + "Adding heavy strength the same day markedly raises the risk of overtraining.",
                concat(hybrid, mtor),
                "Prioritise recovery. If you must double up, keep the strength session far from the Hyrox session and low in volume."));
        }
        return out;
    }

    private static ConflictWarning warning(LocalDate date, String suffix, ConflictType type, RiskLevel risk,
                                           String message, String explanation, List<String> ids,
                                           String suggestion) {
        return new ConflictWarning("warn-" + date + "-" + suffix, date, type, risk,
            message, explanation, ids, suggestion);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(a);
        out.addAll(b);
        return Collections.unmodifiableList(out);
    }
}
