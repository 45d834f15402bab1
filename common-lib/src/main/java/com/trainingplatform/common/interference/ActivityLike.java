package com.trainingplatform.common.interference;

import com.trainingplatform.common.model.Intensity;

import java.time.LocalDate;

/**
 * Normalised view of anything that can sit on the calendar, logged or planned.
 *
 * <p>{@code type} and {@code category} are upper-case tokens
 * ({@code RUNNING}, {@code LONG_RUN}); either may be {@code null}.
 * {@code title} is upper-cased for keyword matching.
 *
 * @see ActivityAdapter
 */
public record ActivityLike(
    String    id,
    LocalDate date,
    String    type,
    String    category,
    Intensity intensity,
    String    title,
    String    hyroxFocus
) {}
