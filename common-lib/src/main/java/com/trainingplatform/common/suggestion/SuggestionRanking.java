package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.TrainingSuggestion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Single explicit priority order for suggestions: ascending
 * {@link com.trainingplatform.common.model.SuggestionSource#tier()}.
 * {@link List#sort} is stable, so equal tiers keep emission order.
 */
public final class SuggestionRanking {

    public static final Comparator<TrainingSuggestion> BY_PRIORITY =
        Comparator.comparingInt(s -> s.source().tier());

    private SuggestionRanking() {}

    public static List<TrainingSuggestion> rank(List<TrainingSuggestion> emitted) {
        List<TrainingSuggestion> ranked = new ArrayList<>(emitted);
        ranked.sort(BY_PRIORITY);
        return List.copyOf(ranked);
    }
}
