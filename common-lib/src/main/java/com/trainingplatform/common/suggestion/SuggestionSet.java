package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.Intensity;
import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.SuggestionType;
import com.trainingplatform.common.model.TrainingSuggestion;
import com.trainingplatform.common.model.UserPreferences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Emission-ordered collection with similarity-aware insertion.
 *
 * <p>A candidate is rejected when an accepted suggestion of the same modality
 * already covers it:
 * <ul>
 *   <li>both carry a distance and they differ by less than the tolerance, or</li>
 *   <li>neither carries a distance (same modality, nothing to tell them apart).</li>
 * </ul>
 * Load-safety warnings are always accepted. Candidates whose modality is
 * disabled in the user's preferences are dropped before they can shadow anything.
 *
 * <p>Not thread-safe; one instance lives for a single engine call.
 */
public final class SuggestionSet {

    private final List<TrainingSuggestion> accepted = new ArrayList<>();
    private final double toleranceKm;
    private final UserPreferences preferences;

    public SuggestionSet(double toleranceKm, UserPreferences preferences) {
        this.toleranceKm = toleranceKm;
        this.preferences = preferences == null ? UserPreferences.DEFAULTS : preferences;
    }

    /**
     * @return {@code true} if the candidate was added
     */
    public boolean offer(TrainingSuggestion candidate) {
        if (candidate == null || !preferences.isEnabled(candidate.type())) return false;
        if (candidate.source() != SuggestionSource.LOAD_SAFETY && isCovered(candidate)) return false;
        accepted.add(candidate);
        return true;
    }

    public boolean isCovered(TrainingSuggestion candidate) {
        return accepted.stream()
            .filter(s -> s.type() == candidate.type())
            .filter(s -> s.source() != SuggestionSource.LOAD_SAFETY)
            .anyMatch(s -> similar(s, candidate));
    }

    /** Any accepted suggestion, of any modality, with a distance within tolerance of {@code km}. */
    public boolean coversDistance(double km) {
        return accepted.stream()
            .anyMatch(s -> s.hasDistance() && Math.abs(s.distanceKm() - km) < toleranceKm);
    }

    public boolean hasType(SuggestionType type) {
        return accepted.stream().anyMatch(s -> s.type() == type);
    }

    public boolean has(SuggestionType type, Intensity intensity) {
        return accepted.stream().anyMatch(s -> s.type() == type && s.intensity() == intensity);
    }

    public boolean isEmpty() {
        return accepted.isEmpty();
    }

    public int size() {
        return accepted.size();
    }

    public List<TrainingSuggestion> asList() {
        return Collections.unmodifiableList(accepted);
    }

    private boolean similar(TrainingSuggestion a, TrainingSuggestion b) {
        if (a.hasDistance() && b.hasDistance()) {
            return Math.abs(a.distanceKm() - b.distanceKm()) < toleranceKm;
        }
        return !a.hasDistance() && !b.hasDistance();
    }
}
