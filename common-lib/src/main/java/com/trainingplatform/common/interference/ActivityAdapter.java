package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.ActivityType;
import com.trainingplatform.common.model.PlannedActivity;

import java.util.Locale;

/**
 * Maps the two calendar shapes onto {@link ActivityLike}.
 */
public final class ActivityAdapter {

    private ActivityAdapter() {
        // utility class
    }

    public static ActivityLike from(ActivityRecord activity) {
        return new ActivityLike(
            activity.id(),
            activity.date(),
            typeCode(activity.type()),
            null,
            activity.intensity(),
            upper(activity.title()),
            activity.hyroxFocus());
    }

    /**
     * Planned entries carry no modality of their own; the category stands in
     * for it. A planned race is treated as a {@code RACE} category.
     */
    public static ActivityLike from(PlannedActivity planned) {
        String category = planned.race() ? "RACE"
            : planned.category() == null ? null : planned.category().name();
        return new ActivityLike(
            planned.id(),
            planned.date(),
            null,
            category,
            null,
            upper(planned.title()),
            null);
    }

    /** An unrecognised log type carries no modality, so the classifier sees none. */
    private static String typeCode(ActivityType type) {
        return type == null || type == ActivityType.UNKNOWN ? null : type.name();
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }
}
