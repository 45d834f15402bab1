package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.Intensity;

import java.util.Set;

/**
 * Assigns a {@link SignalCategory} to an {@link ActivityLike}.
 *
 * <p>Precedence:
 * <ol>
 *   <li>Hyrox type or title → HYBRID, unless its focus is {@code strength}
 *       (MTOR) or {@code cardio} (AMPK_HIGH)</li>
 *   <li>strength type, category or title keyword → MTOR</li>
 *   <li>cardio type or category → AMPK_HIGH when hard or long,
 *       AMPK_LOW when easy, AMPK_HIGH otherwise</li>
 *   <li>rest, yoga, stretching → NEUTRAL</li>
 *   <li>anything else → UNKNOWN</li>
 * </ol>
 * Title keywords cover English and Swedish.
 */
public final class SignalClassifier {

    private static final Set<String> CARDIO_TYPES =
        Set.of("RUN", "RUNNING", "CYCLING", "BIKE", "SWIMMING", "ROWING", "WALKING", "OTHER");
    private static final Set<String> CARDIO_CATEGORIES =
        Set.of("RUN", "BIKE", "EASY", "LONG_RUN", "INTERVALS", "TEMPO", "RECOVERY", "RACE");
    private static final Set<String> HARD_CATEGORIES =
        Set.of("INTERVALS", "TEMPO", "RACE", "VO2MAX", "THRESHOLD");
    private static final Set<String> NEUTRAL_TYPES = Set.of("REST", "YOGA", "STRETCHING");

    private SignalClassifier() {
        // utility class
    }

    public static SignalCategory classify(ActivityLike a) {
        String type = a.type() == null ? "" : a.type();
        String category = a.category() == null ? "" : a.category();
        String title = a.title() == null ? "" : a.title();

        if (type.equals("HYROX") || title.contains("HYROX")) {
            if ("strength".equalsIgnoreCase(a.hyroxFocus())) return SignalCategory.MTOR;
            if ("cardio".equalsIgnoreCase(a.hyroxFocus())) return SignalCategory.AMPK_HIGH;
            return SignalCategory.HYBRID;
        }

        if (type.equals("STRENGTH") || category.equals("STRENGTH")
                || title.contains("STYRKA") || title.contains("GYM") || title.contains("WEIGHT")) {
            return SignalCategory.MTOR;
        }

        if (CARDIO_TYPES.contains(type) || CARDIO_CATEGORIES.contains(category)) {
            Intensity intensity = a.intensity();
            if ((intensity != null && intensity.isHard()) || HARD_CATEGORIES.contains(category)
                    || title.contains("INTERVAL") || title.contains("TÄVLING") || title.contains("TEMPO")
                    || title.contains("RACE")) {
                return SignalCategory.AMPK_HIGH;
            }
            if (category.equals("LONG_RUN") || title.contains("LÅNGPASS") || title.contains("LONG RUN")) {
                return SignalCategory.AMPK_HIGH;
            }
            if (intensity == Intensity.LOW || category.equals("EASY") || category.equals("RECOVERY")
                    || type.equals("WALKING") || title.contains("PROMENAD") || title.contains("JOGG")
                    || title.contains("WALK")) {
                return SignalCategory.AMPK_LOW;
            }
            return SignalCategory.AMPK_HIGH;
        }

        if (NEUTRAL_TYPES.contains(type) || category.equals("REST")) {
            return SignalCategory.NEUTRAL;
        }
        return SignalCategory.UNKNOWN;
    }
}
