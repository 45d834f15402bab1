package com.trainingplatform.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * A Monday–Sunday training week, both ends inclusive.
 */
public record WeekWindow(
    @JsonProperty("start") LocalDate start,
    @JsonProperty("end")   LocalDate end
) {
    public static WeekWindow containing(LocalDate date) {
        LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new WeekWindow(monday, monday.plusDays(6));
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public WeekWindow previous() {
        return new WeekWindow(start.minusWeeks(1), end.minusWeeks(1));
    }

    /** Days from {@code date} to Sunday, counting {@code date} itself (Mon = 7, Sun = 1). */
    public static int daysLeftIncluding(LocalDate date) {
        return 8 - date.getDayOfWeek().getValue();
    }
}
