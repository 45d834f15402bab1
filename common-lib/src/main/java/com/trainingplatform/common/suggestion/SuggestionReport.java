package com.trainingplatform.common.suggestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trainingplatform.common.model.TrainingSuggestion;

import java.util.List;

/**
 * Ranked suggestions plus caller-facing diagnostics. Diagnostics are only
 * populated when a non-deterministic rule took part in the run.
 */
public record SuggestionReport(
    @JsonProperty("suggestions") List<TrainingSuggestion> suggestions,
    @JsonProperty("diagnostics") List<String> diagnostics
) {
    public static SuggestionReport empty() {
        return new SuggestionReport(List.of(), List.of());
    }
}
