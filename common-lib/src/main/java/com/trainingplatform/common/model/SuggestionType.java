package com.trainingplatform.common.model;

/**
 * Training modality of a suggestion. {@link #REST} is never filtered out by
 * modality preferences.
 */
public enum SuggestionType {
    RUN,
    STRENGTH,
    HYROX,
    BIKE,
    REST
}
